package net.cronengine.core.model;

import java.time.Instant;

/**
 * One execution of a {@link Job}.
 * <p>
 * {@code endedAt == null} is the only in-flight marker; there is no status column.
 * {@code jobName} is copied at creation so history survives renames and deletes.
 */
public record Run(
        Long id,
        Long jobId,
        String jobName,
        Instant startedAt,
        Instant endedAt,
        Integer exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        Double durationSeconds
) {
    public static final int EXIT_ABORTED = -1;
    public static final String ORPHANED_MESSAGE = "Interrupted by shutdown";
    public static final String CANCELLED_MESSAGE = "Cancelled";

    public static Run start(Job job, Instant startedAt) {
        return new Run(null, job.id(), job.name(), startedAt, null, null, null, null, false, null);
    }

    public Run withId(long runId) {
        return new Run(runId, jobId, jobName, startedAt, endedAt, exitCode, stdout, stderr, timedOut, durationSeconds);
    }

    /** Process runner returned; exit code 0 on success, 1 on reported failure. */
    public Run complete(Instant ended, boolean success, String out, String err, boolean didTimeOut, double seconds) {
        return new Run(id, jobId, jobName, startedAt, ended, success ? 0 : 1, out, err, didTimeOut, seconds);
    }

    /** Process runner threw or was cancelled. */
    public Run abort(Instant ended, String error, double seconds) {
        return new Run(id, jobId, jobName, startedAt, ended, EXIT_ABORTED, stdout, error, false, seconds);
    }

    public boolean inFlight() {
        return endedAt == null;
    }

    public boolean succeeded() {
        return !timedOut && exitCode != null && exitCode == 0;
    }

    public boolean failed() {
        return timedOut || (exitCode != null && exitCode != 0);
    }
}
