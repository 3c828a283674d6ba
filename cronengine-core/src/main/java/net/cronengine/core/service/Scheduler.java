package net.cronengine.core.service;

import net.cronengine.core.concurrent.CancellationToken;
import net.cronengine.core.event.EngineEvent;
import net.cronengine.core.event.EngineEventListener;
import net.cronengine.core.event.EngineEventPublisher;
import net.cronengine.core.event.EngineEventType;
import net.cronengine.core.maintenance.RunMaintenanceService;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.CronEvaluator;
import net.cronengine.core.spi.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polling scheduler.
 * <ol>
 *   <li>start: recover orphaned runs, seed next_run where missing, launch the loop</li>
 *   <li>loop: purge old runs when due, launch every due job not already running, sleep</li>
 *   <li>stop: cancel the shared token, wait for the loop and in-flight runs up to the shutdown timeout</li>
 * </ol>
 * At most one execution per job is in flight; the global count is capped by {@code concurrencyLimit}.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final Duration SLOT_POLL = Duration.ofMillis(200);

    private final JobRepository jobs;
    private final JobExecutor executor;
    private final CronEvaluator cron;
    private final RunMaintenanceService maintenance;
    private final Clock clock;
    private final SchedulerSettings settings;

    private final EngineEventPublisher events = new EngineEventPublisher("scheduler");
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STOPPED);
    private final Set<Long> runningJobs = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final Semaphore concurrencyGate;

    private volatile CancellationToken token;
    private volatile ExecutorService loopExecutor;
    private volatile ExecutorService workers;
    private volatile CompletableFuture<Void> loop;

    public Scheduler(JobRepository jobs,
                     JobExecutor executor,
                     CronEvaluator cron,
                     RunMaintenanceService maintenance,
                     Clock clock,
                     SchedulerSettings settings) {
        this.jobs = jobs;
        this.executor = executor;
        this.cron = cron;
        this.maintenance = maintenance;
        this.clock = clock;
        this.settings = settings;
        this.concurrencyGate = new Semaphore(settings.concurrencyLimit(), true);
    }

    public void addListener(EngineEventListener l) {
        events.addListener(l);
    }

    public void removeListener(EngineEventListener l) {
        events.removeListener(l);
    }

    public SchedulerState state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == SchedulerState.RUNNING;
    }

    public int runningJobCount() {
        return runningJobs.size();
    }

    public boolean isRunning(long jobId) {
        return runningJobs.contains(jobId);
    }

    public SchedulerSettings settings() {
        return settings;
    }

    /**
     * @throws IllegalStateException if the scheduler is not stopped
     */
    public void start() throws Exception {
        if (!state.compareAndSet(SchedulerState.STOPPED, SchedulerState.STARTING)) {
            throw new IllegalStateException("Scheduler is " + state.get() + ", cannot start");
        }
        try {
            // 1) runs left open by a previous process
            maintenance.recoverOrphanedRuns();

            // 2) enabled jobs without a next_run
            seedNextRuns();

            // 3) loop
            CancellationToken t = new CancellationToken();
            this.token = t;
            this.loopExecutor = Executors.newSingleThreadExecutor(daemonFactory("cronengine-scheduler"));
            this.workers = Executors.newCachedThreadPool(daemonFactory("cronengine-job"));
            this.loop = CompletableFuture.runAsync(() -> runLoop(t), loopExecutor);
            state.set(SchedulerState.RUNNING);
            log.info("Scheduler started: checkInterval={}, concurrencyLimit={}",
                    settings.checkInterval(), settings.concurrencyLimit());
        } catch (Exception e) {
            state.set(SchedulerState.STOPPED);
            shutdownExecutors();
            throw e;
        }
    }

    public void stop() {
        stop(settings.shutdownTimeout());
    }

    /** No-op unless running. Returns once the loop and in-flight runs finished or {@code timeout} elapsed. */
    public void stop(Duration timeout) {
        if (!state.compareAndSet(SchedulerState.RUNNING, SchedulerState.STOPPING)) {
            log.debug("stop() ignored, scheduler is {}", state.get());
            return;
        }
        log.info("Scheduler stopping (timeout={})", timeout);
        token.cancel("scheduler stopping");

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = awaitUntil(loop, deadline);
        if (drained && settings.awaitInFlightOnStop()) {
            CompletableFuture<?>[] pending = inFlight.toArray(new CompletableFuture<?>[0]);
            drained = awaitUntil(CompletableFuture.allOf(pending), deadline);
        }
        if (!drained) {
            log.warn("Scheduler stop timed out after {}, {} job(s) may still be running", timeout, runningJobs.size());
        }

        shutdownExecutors();
        state.set(SchedulerState.STOPPED);
        log.info("Scheduler stopped");
    }

    // ---- loop ----

    private void runLoop(CancellationToken t) {
        log.debug("Scheduler loop entered");
        while (!t.isCancelled()) {
            try {
                tick(t);
                if (t.await(settings.checkInterval())) break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Scheduler loop error: {}", JobExecutor.messageOf(e), e);
                events.publish(EngineEvent.engine(EngineEventType.ERROR,
                        "Scheduler loop error: " + JobExecutor.messageOf(e), clock.now()));
                try {
                    if (t.await(settings.errorBackoff())) break;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("Scheduler loop exited");
    }

    /** One poll: retention purge if due, then launch due jobs. */
    void tick(CancellationToken t) throws Exception {
        maintenance.purgeIfDue();

        List<Job> due = jobs.findDue(clock.now());
        for (Job job : due) {
            if (t.isCancelled()) return;
            if (!runningJobs.add(job.id())) {
                log.debug("Job {} still running, skipping this occurrence", job.name());
                continue;
            }
            launch(job, t);
        }
    }

    private void launch(Job job, CancellationToken t) {
        CompletableFuture<Void> f;
        try {
            f = CompletableFuture.runAsync(() -> runJob(job, t), workers);
        } catch (RuntimeException e) {
            runningJobs.remove(job.id());
            throw e;
        }
        inFlight.add(f);
        f.whenComplete((v, ex) -> inFlight.remove(f));
    }

    private void runJob(Job job, CancellationToken t) {
        boolean acquired = false;
        try {
            acquired = acquireSlot(t);
            if (!acquired) return;

            events.publish(EngineEvent.job(EngineEventType.JOB_STARTED, job.name(), null,
                    "Job started: " + job.name(), clock.now()));

            Run run = executor.execute(job, t);

            EngineEventType type;
            String message;
            if (run.timedOut()) {
                type = EngineEventType.JOB_TIMEOUT;
                message = "Job timed out after " + job.timeoutSeconds() + "s";
            } else if (run.succeeded()) {
                type = EngineEventType.JOB_COMPLETED;
                message = String.format("Job completed in %.1fs", run.durationSeconds());
            } else {
                type = EngineEventType.JOB_FAILED;
                message = Optional.ofNullable(run.stderr()).filter(s -> !s.isBlank())
                        .orElse("Exit code " + run.exitCode());
            }
            events.publish(EngineEvent.job(type, job.name(), run.id(), message, clock.now()));
        } catch (CancellationException e) {
            events.publish(EngineEvent.job(EngineEventType.JOB_FAILED, job.name(), null,
                    Run.CANCELLED_MESSAGE, clock.now()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.publish(EngineEvent.job(EngineEventType.JOB_FAILED, job.name(), null,
                    Run.CANCELLED_MESSAGE, clock.now()));
        } catch (Exception e) {
            log.error("Job {} failed outside the runner: {}", job.name(), JobExecutor.messageOf(e), e);
            events.publish(EngineEvent.job(EngineEventType.JOB_FAILED, job.name(), null,
                    JobExecutor.messageOf(e), clock.now()));
        } finally {
            if (acquired) concurrencyGate.release();
            runningJobs.remove(job.id());
        }
    }

    /** Waits for a concurrency slot without blocking the loop; false when cancelled first. */
    private boolean acquireSlot(CancellationToken t) throws InterruptedException {
        while (!t.isCancelled()) {
            if (concurrencyGate.tryAcquire(SLOT_POLL.toMillis(), TimeUnit.MILLISECONDS)) {
                if (t.isCancelled()) {
                    concurrencyGate.release();
                    return false;
                }
                return true;
            }
        }
        return false;
    }

    // ---- start/stop helpers ----

    private void seedNextRuns() throws Exception {
        Instant now = clock.now();
        int seeded = 0;
        for (Job job : jobs.list(false, null)) {
            if (job.nextRun() != null) continue;
            try {
                Instant next = cron.next(job.cronExpr(), now).orElse(null);
                jobs.updateNextRun(job.id(), next);
                seeded++;
            } catch (IllegalArgumentException e) {
                log.error("Cannot compute next_run for job {} ({}): {}", job.name(), job.cronExpr(), e.getMessage());
            }
        }
        if (seeded > 0) log.info("Seeded next_run for {} job(s)", seeded);
    }

    private static boolean awaitUntil(CompletableFuture<?> f, long deadlineNanos) {
        if (f == null) return true;
        long remaining = deadlineNanos - System.nanoTime();
        try {
            f.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | CancellationException e) {
            log.warn("Scheduler task ended abnormally: {}", JobExecutor.messageOf(e), e);
            return true;
        }
    }

    private void shutdownExecutors() {
        if (loopExecutor != null) loopExecutor.shutdown();
        if (workers != null) workers.shutdown();
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread th = new Thread(r, prefix + "-" + seq.incrementAndGet());
            th.setDaemon(true);
            return th;
        };
    }
}
