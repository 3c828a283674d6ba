package net.cronengine.core.event;

import java.time.Instant;
import java.util.Objects;

/** Not persisted; fanned out to listeners (UI, logs). */
public record EngineEvent(
        EngineEventType type,
        String jobName,
        Long runId,
        String message,
        Instant timestamp       // UTC
) {
    public EngineEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static EngineEvent engine(EngineEventType type, String message, Instant at) {
        return new EngineEvent(type, null, null, message, at);
    }

    public static EngineEvent job(EngineEventType type, String jobName, Long runId, String message, Instant at) {
        return new EngineEvent(type, jobName, runId, message, at);
    }
}
