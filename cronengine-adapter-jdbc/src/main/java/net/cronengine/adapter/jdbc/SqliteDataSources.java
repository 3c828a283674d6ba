package net.cronengine.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Pooled DataSource over a single SQLite file.
 * WAL journal plus a busy timeout so short concurrent connections (loop, executors) do not need external locking.
 */
public final class SqliteDataSources {
    private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

    public static final int DEFAULT_POOL_SIZE = 8;
    public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

    private SqliteDataSources() {}

    public static HikariDataSource open(Path dbFile) {
        return open(dbFile, DEFAULT_POOL_SIZE, DEFAULT_BUSY_TIMEOUT);
    }

    public static HikariDataSource open(Path dbFile, int poolSize, Duration busyTimeout) {
        Path abs = dbFile.toAbsolutePath();
        try {
            if (abs.getParent() != null) Files.createDirectories(abs.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory for " + abs, e);
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("cronengine-sqlite");
        cfg.setJdbcUrl("jdbc:sqlite:" + abs);
        cfg.setDriverClassName("org.sqlite.JDBC");
        cfg.setMaximumPoolSize(poolSize);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        cfg.addDataSourceProperty("journal_mode", "WAL");
        cfg.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeout.toMillis()));
        log.info("Opening SQLite store at {} (pool={}, busyTimeout={})", abs, poolSize, busyTimeout);
        return new HikariDataSource(cfg);
    }
}
