package net.cronengine.core.model;

import java.time.Instant;

public record Job(
        Long id,
        String name,
        String cronExpr,
        String command,
        String workingDir,      // null = runner default
        boolean enabled,
        int timeoutSeconds,
        String tags,            // free text, matched by substring
        Instant createdAt,
        Instant updatedAt,
        Instant nextRun         // null = not scheduled, never due
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public static Job ofNew(String name, String cronExpr, String command) {
        return new Job(null, name, cronExpr, command, null, true, DEFAULT_TIMEOUT_SECONDS, null, null, null, null);
    }

    public Job withId(long id) {
        return new Job(id, name, cronExpr, command, workingDir, enabled, timeoutSeconds, tags, createdAt, updatedAt, nextRun);
    }

    public Job withNextRun(Instant next) {
        return new Job(id, name, cronExpr, command, workingDir, enabled, timeoutSeconds, tags, createdAt, updatedAt, next);
    }

    public Job withEnabled(boolean value) {
        return new Job(id, name, cronExpr, command, workingDir, value, timeoutSeconds, tags, createdAt, updatedAt, nextRun);
    }

    public Job withWorkingDir(String dir) {
        return new Job(id, name, cronExpr, command, dir, enabled, timeoutSeconds, tags, createdAt, updatedAt, nextRun);
    }

    public Job withTimeoutSeconds(int seconds) {
        return new Job(id, name, cronExpr, command, workingDir, enabled, seconds, tags, createdAt, updatedAt, nextRun);
    }

    public Job withTags(String value) {
        return new Job(id, name, cronExpr, command, workingDir, enabled, timeoutSeconds, value, createdAt, updatedAt, nextRun);
    }
}
