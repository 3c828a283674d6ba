package net.cronengine.core.service;

import net.cronengine.core.concurrent.CancellationToken;
import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.CronEvaluator;
import net.cronengine.core.spi.JobRepository;
import net.cronengine.core.spi.ProcessRunner;
import net.cronengine.core.spi.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * Runs one occurrence of a job end to end.
 * <ol>
 *   <li>open a Run row (ended_at = null) before the command starts, so a crash leaves it detectable</li>
 *   <li>invoke the process runner</li>
 *   <li>close the same Run row with the outcome</li>
 *   <li>advance next_run from the completion instant</li>
 * </ol>
 * Only cancellation is rethrown; a runner failure is recorded and swallowed.
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobRepository jobs;
    private final RunRepository runs;
    private final ProcessRunner runner;
    private final CronEvaluator cron;
    private final Clock clock;

    public JobExecutor(JobRepository jobs,
                       RunRepository runs,
                       ProcessRunner runner,
                       CronEvaluator cron,
                       Clock clock) {
        this.jobs = jobs;
        this.runs = runs;
        this.runner = runner;
        this.cron = cron;
        this.clock = clock;
    }

    public Run execute(Job job, CancellationToken token) throws Exception {
        log.info("Starting job: id={}, name={}", job.id(), job.name());

        // 1) in-flight row
        Run run = Run.start(job, clock.now());
        run = run.withId(runs.create(run));

        // 2) command
        long t0 = System.nanoTime();
        Run finished;
        CancellationException cancelled = null;
        boolean interrupted = false;
        try {
            var request = new ProcessRunner.Request(
                    job.command(), job.workingDir(), Duration.ofSeconds(job.timeoutSeconds()));
            ProcessRunner.Result result = runner.run(request, token);
            finished = run.complete(clock.now(), result.success(), result.output(), result.error(),
                    result.timedOut(), elapsedSeconds(t0));
            log.info("Job finished: name={}, success={}, timedOut={}, duration={}s",
                    job.name(), result.success(), result.timedOut(), String.format("%.1f", finished.durationSeconds()));
        } catch (CancellationException e) {
            finished = run.abort(clock.now(), Run.CANCELLED_MESSAGE, elapsedSeconds(t0));
            cancelled = e;
            log.info("Job cancelled: name={}", job.name());
        } catch (InterruptedException e) {
            // flag restored after the bookkeeping below, the pool refuses interrupted borrowers
            interrupted = true;
            finished = run.abort(clock.now(), Run.CANCELLED_MESSAGE, elapsedSeconds(t0));
            cancelled = new CancellationException("Interrupted while running " + job.name());
            log.info("Job interrupted: name={}", job.name());
        } catch (Exception e) {
            finished = run.abort(clock.now(), messageOf(e), elapsedSeconds(t0));
            log.warn("Job FAILED: name={}, error={}", job.name(), messageOf(e), e);
        }

        // 3) same row, written once
        runs.update(finished);

        // 4) reschedule from completion time, whatever the outcome
        advanceNextRun(job);

        if (interrupted) Thread.currentThread().interrupt();
        if (cancelled != null) throw cancelled;
        return finished;
    }

    private void advanceNextRun(Job job) throws Exception {
        Instant next = cron.next(job.cronExpr(), clock.now()).orElse(null);
        jobs.updateNextRun(job.id(), next);
        log.debug("next_run for {} -> {}", job.name(), next);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    static String messageOf(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getName() : m;
    }
}
