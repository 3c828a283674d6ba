package net.cronengine.adapter.jdbc;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/** Brings the store schema up to date; safe to call on every start. */
public final class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String LOCATION = "classpath:db/migration/sqlite";

    private SchemaMigrator() {}

    public static MigrateResult migrate(DataSource ds) {
        MigrateResult result = Flyway.configure()
                .dataSource(ds)
                .locations(LOCATION)
                .baselineOnMigrate(true)
                .load()
                .migrate();
        log.info("Schema migrated: {} migration(s) applied, version={}", result.migrationsExecuted, result.targetSchemaVersion);
        return result;
    }
}
