package net.cronengine.adapter.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.Comparator;
import java.util.stream.Stream;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected Path dir;

    @BeforeAll
    void setupDb() throws Exception {
        // one throwaway SQLite file per test class
        dir = Files.createTempDirectory("cronengine-test");
        ds = SqliteDataSources.open(dir.resolve("cronengine.db"));
        SchemaMigrator.migrate(ds);
    }

    @BeforeEach
    void truncateAll() throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("DELETE FROM runs");
            st.execute("DELETE FROM jobs");
        }
    }

    @AfterAll
    void cleanup() throws Exception {
        if (ds instanceof HikariDataSource h) h.close();
        try (Stream<Path> files = Files.walk(dir)) {
            files.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }
}
