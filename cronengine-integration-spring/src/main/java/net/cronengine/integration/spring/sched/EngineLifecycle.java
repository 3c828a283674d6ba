package net.cronengine.integration.spring.sched;

import net.cronengine.core.engine.EngineHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the {@link EngineHost} to the application context: started after refresh, stopped on close.
 * Runs in a late phase so it stops before the DataSource is closed.
 */
public class EngineLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);

    public static final int PHASE = Integer.MAX_VALUE - 1000;

    private final EngineHost host;
    private boolean autoStartup = true;

    public EngineLifecycle(EngineHost host) {
        this.host = host;
    }

    @Override
    public void start() {
        try {
            host.start();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Engine failed to start: " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        log.debug("Context closing, stopping engine");
        host.stop();
    }

    @Override
    public boolean isRunning() {
        return host.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
