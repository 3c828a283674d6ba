package net.cronengine.core.service;

import java.time.Duration;

public record SchedulerSettings(
        Duration checkInterval,       // poll cadence
        Duration shutdownTimeout,     // how long stop() waits for the loop and in-flight runs
        int concurrencyLimit,         // global ceiling on simultaneous executions
        Duration errorBackoff,        // pause after a loop-level failure
        boolean awaitInFlightOnStop
) {
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_CONCURRENCY_LIMIT = 10;
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(5);

    public SchedulerSettings {
        if (checkInterval == null || checkInterval.isNegative() || checkInterval.isZero())
            throw new IllegalArgumentException("checkInterval must be positive");
        if (shutdownTimeout == null || shutdownTimeout.isNegative())
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        if (concurrencyLimit < 1)
            throw new IllegalArgumentException("concurrencyLimit must be >= 1: " + concurrencyLimit);
        if (errorBackoff == null || errorBackoff.isNegative())
            throw new IllegalArgumentException("errorBackoff must not be negative");
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_CHECK_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT,
                DEFAULT_CONCURRENCY_LIMIT, DEFAULT_ERROR_BACKOFF, true);
    }

    public SchedulerSettings withCheckInterval(Duration d) {
        return new SchedulerSettings(d, shutdownTimeout, concurrencyLimit, errorBackoff, awaitInFlightOnStop);
    }

    public SchedulerSettings withShutdownTimeout(Duration d) {
        return new SchedulerSettings(checkInterval, d, concurrencyLimit, errorBackoff, awaitInFlightOnStop);
    }

    public SchedulerSettings withConcurrencyLimit(int limit) {
        return new SchedulerSettings(checkInterval, shutdownTimeout, limit, errorBackoff, awaitInFlightOnStop);
    }

    public SchedulerSettings withErrorBackoff(Duration d) {
        return new SchedulerSettings(checkInterval, shutdownTimeout, concurrencyLimit, d, awaitInFlightOnStop);
    }

    public SchedulerSettings withAwaitInFlightOnStop(boolean await) {
        return new SchedulerSettings(checkInterval, shutdownTimeout, concurrencyLimit, errorBackoff, await);
    }
}
