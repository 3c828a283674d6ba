package net.cronengine.core.service;

import net.cronengine.core.model.Job;
import net.cronengine.core.model.Run;
import net.cronengine.core.spi.Clock;
import net.cronengine.core.spi.CronEvaluator;
import net.cronengine.core.spi.JobRepository;
import net.cronengine.core.spi.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Synchronous registration surface for jobs.
 * Validation errors surface here as {@link JobValidationException}; the scheduler only ever sees valid jobs.
 */
public final class JobCatalogService {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogService.class);

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MAX_TIMEOUT_SECONDS = 86_400;

    private final JobRepository jobs;
    private final RunRepository runs;
    private final CronEvaluator cron;
    private final Clock clock;

    public JobCatalogService(JobRepository jobs, RunRepository runs, CronEvaluator cron, Clock clock) {
        this.jobs = jobs;
        this.runs = runs;
        this.cron = cron;
        this.clock = clock;
    }

    public Job register(Job job) throws Exception {
        validate(job);
        if (jobs.findByName(job.name()).isPresent()) {
            throw new JobValidationException("name", "Job already exists: " + job.name());
        }
        Job toStore = job.enabled() ? job.withNextRun(nextFromNow(job.cronExpr())) : job.withNextRun(null);
        long id = jobs.add(toStore);
        log.info("Registered job: id={}, name={}, cron={}, nextRun={}", id, job.name(), job.cronExpr(), toStore.nextRun());
        return jobs.findById(id).orElseThrow(() -> new IllegalStateException("Job vanished after insert: " + id));
    }

    /**
     * Replaces the mutable columns of the job with the same name.
     * next_run is recomputed when the cron changed or an enabled job has none.
     */
    public Job update(Job job) throws Exception {
        validate(job);
        Job current = jobs.findByName(job.name())
                .orElseThrow(() -> new JobValidationException("name", "Job not found: " + job.name()));

        Instant next = current.nextRun();
        if (!job.enabled()) {
            next = null;
        } else if (!Objects.equals(current.cronExpr(), job.cronExpr()) || next == null) {
            next = nextFromNow(job.cronExpr());
        }
        Job merged = new Job(current.id(), current.name(), job.cronExpr(), job.command(), job.workingDir(),
                job.enabled(), job.timeoutSeconds(), job.tags(), current.createdAt(), current.updatedAt(), next);
        jobs.update(merged);
        log.info("Updated job: name={}, cron={}, nextRun={}", merged.name(), merged.cronExpr(), next);
        return jobs.findById(current.id()).orElse(merged);
    }

    public boolean enable(String name) throws Exception {
        Optional<Job> job = jobs.findByName(name);
        if (job.isEmpty()) return false;
        jobs.setEnabled(name, true);
        Instant next = nextFromNow(job.get().cronExpr());
        jobs.updateNextRun(job.get().id(), next);
        log.info("Enabled job: name={}, nextRun={}", name, next);
        return true;
    }

    public boolean disable(String name) throws Exception {
        boolean changed = jobs.setEnabled(name, false);
        if (changed) log.info("Disabled job: name={}", name);
        return changed;
    }

    /** Removes the job; its run history stays. */
    public boolean delete(String name) throws Exception {
        boolean removed = jobs.delete(name);
        if (removed) log.info("Deleted job: name={}", name);
        return removed;
    }

    public Optional<Job> find(String name) throws Exception {
        return jobs.findByName(name);
    }

    public List<Job> list(boolean includeDisabled, String tag) throws Exception {
        return jobs.list(includeDisabled, tag);
    }

    public List<Run> runs(String jobName, int limit, boolean failedOnly) throws Exception {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        return runs.list(jobName, limit, failedOnly);
    }

    public String describeSchedule(String cronExpr) {
        return cron.describe(cronExpr);
    }

    void validate(Job job) {
        if (job == null) throw new JobValidationException("job", "Job is required");
        String name = job.name();
        if (name == null || name.isBlank()) throw new JobValidationException("name", "Name is required");
        if (name.length() > MAX_NAME_LENGTH)
            throw new JobValidationException("name", "Name must be at most " + MAX_NAME_LENGTH + " characters");
        if (job.command() == null || job.command().isBlank())
            throw new JobValidationException("command", "Command is required");
        if (!cron.isValid(job.cronExpr()))
            throw new JobValidationException("cron", "Invalid cron expression: " + job.cronExpr());
        if (job.timeoutSeconds() < MIN_TIMEOUT_SECONDS || job.timeoutSeconds() > MAX_TIMEOUT_SECONDS)
            throw new JobValidationException("timeoutSeconds",
                    "Timeout must be between " + MIN_TIMEOUT_SECONDS + " and " + MAX_TIMEOUT_SECONDS + " seconds");
    }

    private Instant nextFromNow(String cronExpr) {
        return cron.next(cronExpr, clock.now()).orElse(null);
    }
}
