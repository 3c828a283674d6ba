package net.cronengine.core.maintenance;

import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Run-history housekeeping used by the scheduler.
 * - orphan recovery: force-close runs left in flight by a previous process
 * - retention purge: delete runs older than the retention window, at most once per interval
 */
public final class RunMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(RunMaintenanceService.class);

    public static final Duration DEFAULT_PURGE_INTERVAL = Duration.ofHours(24);

    private final RunRepository runs;
    private final Clock clock;
    private final int retentionDays;
    private final Duration purgeInterval;

    private volatile Instant lastPurge;   // null = never purged by this instance

    public RunMaintenanceService(RunRepository runs, Clock clock, int retentionDays) {
        this(runs, clock, retentionDays, DEFAULT_PURGE_INTERVAL);
    }

    public RunMaintenanceService(RunRepository runs, Clock clock, int retentionDays, Duration purgeInterval) {
        if (retentionDays < 1) throw new IllegalArgumentException("retentionDays must be >= 1: " + retentionDays);
        this.runs = runs;
        this.clock = clock;
        this.retentionDays = retentionDays;
        this.purgeInterval = purgeInterval;
    }

    public int recoverOrphanedRuns() throws Exception {
        int count = runs.cleanupOrphanedRuns(clock.now());
        if (count > 0) {
            log.warn("Recovered {} orphaned run(s), marked as interrupted", count);
        } else {
            log.debug("No orphaned runs");
        }
        return count;
    }

    /**
     * Purges when the interval has elapsed since the last attempt.
     * The attempt is stamped before the delete, so a failing purge is not retried on every poll.
     *
     * @return number of deleted runs, 0 when skipped
     */
    public int purgeIfDue() throws Exception {
        Instant now = clock.now();
        Instant last = lastPurge;
        if (last != null && Duration.between(last, now).compareTo(purgeInterval) < 0) return 0;

        lastPurge = now;
        int purged = runs.cleanupOldRuns(now, retentionDays);
        log.info("Retention purge: deleted {} run(s) older than {} day(s)", purged, retentionDays);
        return purged;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public Instant lastPurge() {
        return lastPurge;
    }
}
