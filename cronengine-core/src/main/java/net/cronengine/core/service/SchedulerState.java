package net.cronengine.core.service;

/** STOPPED → STARTING → RUNNING → STOPPING → STOPPED; a stopped scheduler may be started again. */
public enum SchedulerState {
    STOPPED, STARTING, RUNNING, STOPPING
}
