package net.cronengine.adapter.jdbc.repo;

import net.cronengine.adapter.jdbc.mapper.RowMappers;
import net.cronengine.core.model.Job;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.cronengine.adapter.jdbc.JdbcUtil.flag;
import static net.cronengine.adapter.jdbc.JdbcUtil.setInstant;

/** Each call borrows its own connection and auto-commits; nothing spans calls. */
public final class JdbcJobRepository implements JobRepository {
    private final DataSource ds;
    private final Clock clock;

    public JdbcJobRepository(DataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    @Override
    public long add(Job job) throws Exception {
        Instant now = clock.now();
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                INSERT INTO jobs(name, cron, command, working_dir, enabled, timeout_seconds, tags,
                                 created_at, updated_at, next_run)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.cronExpr());
            ps.setString(i++, job.command());
            ps.setString(i++, job.workingDir());
            ps.setInt(i++, flag(job.enabled()));
            ps.setInt(i++, job.timeoutSeconds());
            ps.setString(i++, job.tags());
            setInstant(ps, i++, now);
            setInstant(ps, i++, now);
            setInstant(ps, i, job.nextRun());
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("No generated key for job " + job.name());
                return k.getLong(1);
            }
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        return findOne("SELECT * FROM jobs WHERE name = ?", ps -> ps.setString(1, name));
    }

    @Override
    public Optional<Job> findById(long id) throws Exception {
        return findOne("SELECT * FROM jobs WHERE id = ?", ps -> ps.setLong(1, id));
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public List<Job> list(boolean includeDisabled, String tagFilter) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT * FROM jobs WHERE 1 = 1");
        if (!includeDisabled) sql.append(" AND enabled = 1");
        if (tagFilter != null) sql.append(" AND tags LIKE ? ESCAPE '\\'");
        sql.append(" ORDER BY name");

        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {
            if (tagFilter != null) ps.setString(1, "%" + escapeLike(tagFilter) + "%");
            return readAll(ps);
        }
    }

    @Override
    public void update(Job job) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                UPDATE jobs
                   SET name            = ?,
                       cron            = ?,
                       command         = ?,
                       working_dir     = ?,
                       enabled         = ?,
                       timeout_seconds = ?,
                       tags            = ?,
                       next_run        = ?,
                       updated_at      = ?
                 WHERE id = ?
            """)) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.cronExpr());
            ps.setString(i++, job.command());
            ps.setString(i++, job.workingDir());
            ps.setInt(i++, flag(job.enabled()));
            ps.setInt(i++, job.timeoutSeconds());
            ps.setString(i++, job.tags());
            setInstant(ps, i++, job.nextRun());
            setInstant(ps, i++, clock.now());
            ps.setLong(i, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("jobs row not found for id=" + job.id());
            }
        }
    }

    @Override
    public boolean delete(String name) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE name = ?")) {
            ps.setString(1, name);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean setEnabled(String name, boolean enabled) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE jobs SET enabled = ?, updated_at = ? WHERE name = ?")) {
            ps.setInt(1, flag(enabled));
            setInstant(ps, 2, clock.now());
            ps.setString(3, name);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public void updateNextRun(long id, Instant nextRun) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE jobs SET next_run = ? WHERE id = ?")) {
            setInstant(ps, 1, nextRun);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Job> findDue(Instant now) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                SELECT *
                  FROM jobs
                 WHERE enabled = 1
                   AND next_run IS NOT NULL
                   AND next_run <= ?
                 ORDER BY next_run, id
            """)) {
            setInstant(ps, 1, now);
            return readAll(ps);
        }
    }

    // ---- helpers ----

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws Exception;
    }

    private Optional<Job> findOne(String sql, Binder binder) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    private static List<Job> readAll(PreparedStatement ps) throws Exception {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }
}
