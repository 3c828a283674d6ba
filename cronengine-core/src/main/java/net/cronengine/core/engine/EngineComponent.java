package net.cronengine.core.engine;

import net.cronengine.core.event.EngineEventListener;

/** A long-running part hosted next to the scheduler, e.g. a queue dispatcher. */
public interface EngineComponent {
    String name();

    void start() throws Exception;

    void stop() throws Exception;

    void addListener(EngineEventListener listener);
}
