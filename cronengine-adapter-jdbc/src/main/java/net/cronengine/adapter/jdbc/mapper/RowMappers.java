package net.cronengine.adapter.jdbc.mapper;

import net.cronengine.adapter.jdbc.JdbcUtil;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("cron"),
                rs.getString("command"),
                rs.getString("working_dir"),
                rs.getInt("enabled") == 1,
                rs.getInt("timeout_seconds"),
                rs.getString("tags"),
                JdbcUtil.toInstant(rs.getTimestamp("created_at")),
                JdbcUtil.toInstant(rs.getTimestamp("updated_at")),
                JdbcUtil.toInstant(rs.getTimestamp("next_run"))
        );
    }

    // --- Run ---
    public static Run toRun(ResultSet rs) throws SQLException {
        return new Run(
                rs.getLong("id"),
                rs.getLong("job_id"),
                rs.getString("job_name"),
                JdbcUtil.toInstant(rs.getTimestamp("started_at")),
                JdbcUtil.toInstant(rs.getTimestamp("ended_at")),
                JdbcUtil.getNullableInt(rs, "exit_code"),
                rs.getString("stdout"),
                rs.getString("stderr"),
                rs.getInt("timed_out") == 1,
                JdbcUtil.getNullableDouble(rs, "duration_seconds")
        );
    }
}
