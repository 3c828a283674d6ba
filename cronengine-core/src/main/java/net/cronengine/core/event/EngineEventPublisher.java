package net.cronengine.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** Listener fan-out; a failing listener is logged and never reaches the publisher. */
public final class EngineEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EngineEventPublisher.class);

    private final String source;
    private final List<EngineEventListener> listeners = new CopyOnWriteArrayList<>();

    public EngineEventPublisher(String source) {
        this.source = source;
    }

    public void addListener(EngineEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(EngineEventListener l) {
        listeners.remove(l);
    }

    public void publish(EngineEvent event) {
        for (EngineEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[{}] event listener failed on {}: {}", source, event.type(), e.getMessage(), e);
            }
        }
    }
}
