package net.cronengine.core.event;

@FunctionalInterface
public interface EngineEventListener {
    void onEvent(EngineEvent event);
}
