package net.cronengine.adapter.jdbc.repo;

import net.cronengine.adapter.jdbc.mapper.RowMappers;
import net.cronengine.core.model.Run;
import net.cronengine.core.spi.RunRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.cronengine.adapter.jdbc.JdbcUtil.flag;
import static net.cronengine.adapter.jdbc.JdbcUtil.setInstant;
import static net.cronengine.adapter.jdbc.JdbcUtil.setNullableDouble;
import static net.cronengine.adapter.jdbc.JdbcUtil.setNullableInt;

public final class JdbcRunRepository implements RunRepository {
    private final DataSource ds;

    public JdbcRunRepository(DataSource ds) { this.ds = ds; }

    @Override
    public long create(Run run) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                INSERT INTO runs(job_id, job_name, started_at, ended_at, exit_code, stdout, stderr,
                                 timed_out, duration_seconds)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
            bindColumns(ps, run);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("No generated key for run of " + run.jobName());
                return k.getLong(1);
            }
        }
    }

    @Override
    public void update(Run run) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                UPDATE runs
                   SET job_id = ?, job_name = ?, started_at = ?, ended_at = ?, exit_code = ?,
                       stdout = ?, stderr = ?, timed_out = ?, duration_seconds = ?
                 WHERE id = ?
            """)) {
            bindColumns(ps, run);
            ps.setLong(10, run.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("runs row not found for id=" + run.id());
            }
        }
    }

    @Override
    public Optional<Run> findById(long id) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM runs WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toRun(rs));
            }
        }
    }

    @Override
    public List<Run> list(String jobName, int limit, boolean failedOnly) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT * FROM runs WHERE 1 = 1");
        if (jobName != null) sql.append(" AND job_name = ?");
        if (failedOnly) sql.append(" AND ((exit_code IS NOT NULL AND exit_code != 0) OR timed_out = 1)");
        sql.append(" ORDER BY started_at DESC, id DESC LIMIT ?");

        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            if (jobName != null) ps.setString(i++, jobName);
            ps.setInt(i, limit);
            List<Run> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toRun(rs));
            }
            return out;
        }
    }

    @Override
    public int cleanupOrphanedRuns(Instant now) throws Exception {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                UPDATE runs
                   SET ended_at = ?, exit_code = ?, stderr = ?, duration_seconds = 0
                 WHERE ended_at IS NULL
            """)) {
            setInstant(ps, 1, now);
            ps.setInt(2, Run.EXIT_ABORTED);
            ps.setString(3, Run.ORPHANED_MESSAGE);
            return ps.executeUpdate();
        }
    }

    @Override
    public int cleanupOldRuns(Instant now, int retentionDays) throws Exception {
        Instant cutoff = now.minus(Duration.ofDays(retentionDays));
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM runs WHERE started_at < ?")) {
            setInstant(ps, 1, cutoff);
            return ps.executeUpdate();
        }
    }

    private static void bindColumns(PreparedStatement ps, Run run) throws Exception {
        int i = 1;
        ps.setLong(i++, run.jobId());
        ps.setString(i++, run.jobName());
        setInstant(ps, i++, run.startedAt());
        setInstant(ps, i++, run.endedAt());
        setNullableInt(ps, i++, run.exitCode());
        ps.setString(i++, run.stdout());
        ps.setString(i++, run.stderr());
        ps.setInt(i++, flag(run.timedOut()));
        setNullableDouble(ps, i, run.durationSeconds());
    }
}
