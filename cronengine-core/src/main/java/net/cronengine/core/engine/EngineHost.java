package net.cronengine.core.engine;

import net.cronengine.core.event.EngineEvent;
import net.cronengine.core.event.EngineEventListener;
import net.cronengine.core.event.EngineEventPublisher;
import net.cronengine.core.event.EngineEventType;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.service.Scheduler;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.JobRepository;
import net.cronengine.core.spi.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns the scheduler and its sibling components and republishes their events.
 * Start order: scheduler, then siblings. Stop order: siblings, then scheduler.
 */
public final class EngineHost {
    private static final Logger log = LoggerFactory.getLogger(EngineHost.class);

    static final int STATUS_RUN_SAMPLE = 1000;

    private final Scheduler scheduler;
    private final JobRepository jobs;
    private final RunRepository runs;
    private final List<EngineComponent> siblings;
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final EngineEventPublisher events = new EngineEventPublisher("engine");
    private volatile Instant startedAt;

    public EngineHost(Scheduler scheduler,
                      JobRepository jobs,
                      RunRepository runs,
                      List<EngineComponent> siblings,
                      Duration shutdownTimeout,
                      Clock clock) {
        this.scheduler = scheduler;
        this.jobs = jobs;
        this.runs = runs;
        this.siblings = List.copyOf(siblings);
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout);
        this.clock = clock;

        scheduler.addListener(events::publish);
        for (EngineComponent c : this.siblings) c.addListener(events::publish);
    }

    public void addListener(EngineEventListener l) {
        events.addListener(l);
    }

    public void removeListener(EngineEventListener l) {
        events.removeListener(l);
    }

    public synchronized void start() throws Exception {
        if (startedAt != null) {
            log.debug("Engine already started at {}", startedAt);
            return;
        }
        scheduler.start();
        List<EngineComponent> started = new ArrayList<>();
        try {
            for (EngineComponent c : siblings) {
                c.start();
                started.add(c);
            }
        } catch (Exception e) {
            log.error("Engine component failed to start, rolling back: {}", e.getMessage(), e);
            stopAll(started);
            scheduler.stop(shutdownTimeout);
            throw e;
        }
        startedAt = clock.now();
        log.info("Engine started with {} sibling component(s)", siblings.size());
        events.publish(EngineEvent.engine(EngineEventType.ENGINE_STARTED, "Engine started", startedAt));
    }

    public synchronized void stop() {
        if (startedAt == null) return;
        events.publish(EngineEvent.engine(EngineEventType.ENGINE_STOPPING, "Engine stopping", clock.now()));
        stopAll(siblings);
        scheduler.stop(shutdownTimeout);
        startedAt = null;
        log.info("Engine stopped");
        events.publish(EngineEvent.engine(EngineEventType.ENGINE_STOPPED, "Engine stopped", clock.now()));
    }

    public boolean isRunning() {
        return startedAt != null;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public EngineStatus status() throws Exception {
        Instant now = clock.now();
        Instant since = startedAt;

        List<Job> all = jobs.list(true, null);
        int enabled = 0;
        Instant nextRun = null;
        for (Job j : all) {
            if (!j.enabled()) continue;
            enabled++;
            if (j.nextRun() != null && (nextRun == null || j.nextRun().isBefore(nextRun))) nextRun = j.nextRun();
        }

        Instant dayStart = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<Run> today = runs.list(null, STATUS_RUN_SAMPLE, false).stream()
                .filter(r -> !r.startedAt().isBefore(dayStart))
                .toList();
        int failed = (int) today.stream().filter(Run::failed).count();

        return new EngineStatus(
                since != null,
                since,
                since == null ? Duration.ZERO : Duration.between(since, now),
                all.size(),
                enabled,
                scheduler.runningJobCount(),
                nextRun,
                today.size(),
                failed);
    }

    private static void stopAll(List<EngineComponent> components) {
        for (EngineComponent c : components) {
            try {
                c.stop();
            } catch (Exception e) {
                log.error("Engine component {} failed to stop: {}", c.name(), e.getMessage(), e);
            }
        }
    }
}
