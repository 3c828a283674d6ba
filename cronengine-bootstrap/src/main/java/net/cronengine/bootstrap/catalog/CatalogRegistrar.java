package net.cronengine.bootstrap.catalog;

import net.cronengine.bootstrap.props.CronEngineProperties;
import net.cronengine.core.model.Job;
import net.cronengine.core.service.JobCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/** Upserts the jobs declared under {@code cronengine.catalog.jobs}. */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    public enum Outcome { CREATED, UPDATED, UNCHANGED }

    private final JobCatalogService catalog;

    public CatalogRegistrar(JobCatalogService catalog) {
        this.catalog = catalog;
    }

    public void register(CronEngineProperties.Catalog defs) throws Exception {
        int created = 0, updated = 0;
        for (var def : defs.getJobs()) {
            switch (upsert(def)) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> { }
            }
        }
        log.info("Catalog registered: {} job(s) declared, {} created, {} updated",
                defs.getJobs().size(), created, updated);
    }

    Outcome upsert(CronEngineProperties.JobDef def) throws Exception {
        Job declared = toJob(def);

        // 1) new job
        Optional<Job> existing = catalog.find(declared.name());
        if (existing.isEmpty()) {
            Job saved = catalog.register(declared);
            log.info("Catalog job created: name='{}' cron='{}' nextRun={}", saved.name(), saved.cronExpr(), saved.nextRun());
            return Outcome.CREATED;
        }

        // 2) unchanged definition keeps its schedule
        if (sameDefinition(existing.get(), declared)) {
            log.debug("Catalog job unchanged: name='{}'", declared.name());
            return Outcome.UNCHANGED;
        }

        // 3) changed definition
        Job saved = catalog.update(declared);
        log.info("Catalog job updated: name='{}' cron='{}' nextRun={}", saved.name(), saved.cronExpr(), saved.nextRun());
        return Outcome.UPDATED;
    }

    static Job toJob(CronEngineProperties.JobDef def) {
        return new Job(null, def.getName(), def.getCron(), def.getCommand(), def.getWorkingDir(), def.isEnabled(),
                def.getTimeoutSeconds(), def.getTags(), null, null, null);
    }

    private static boolean sameDefinition(Job a, Job b) {
        return Objects.equals(a.cronExpr(), b.cronExpr())
                && Objects.equals(a.command(), b.command())
                && Objects.equals(a.workingDir(), b.workingDir())
                && a.enabled() == b.enabled()
                && a.timeoutSeconds() == b.timeoutSeconds()
                && Objects.equals(a.tags(), b.tags());
    }
}
