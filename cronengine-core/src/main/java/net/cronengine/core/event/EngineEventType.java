package net.cronengine.core.event;

public enum EngineEventType {
    ENGINE_STARTED,
    ENGINE_STOPPING,
    ENGINE_STOPPED,
    JOB_STARTED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_TIMEOUT,
    ERROR
}
