package net.cronengine.core.engine;

import java.time.Duration;
import java.time.Instant;

public record EngineStatus(
        boolean running,
        Instant startedAt,            // null when not running
        Duration uptime,
        int totalJobs,
        int enabledJobs,
        int runningJobs,
        Instant nextScheduledRun,     // earliest next_run among enabled jobs
        int runsToday,                // UTC day
        int failedRunsToday
) {
}
