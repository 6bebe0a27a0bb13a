package com.switchboard.hub.infrastructure.lifecycle;

import com.switchboard.hub.domain.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Closes every terminal connection and stops every liveness monitor when the context stops.
 *
 * <p>Runs in the last-started phase, so it stops before the embedded web server begins its own
 * graceful shutdown: terminals are disconnected first, then the listener goes away.
 */
@Component
public class HubShutdownCoordinator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(HubShutdownCoordinator.class);

    private final TenantRegistry registry;
    private volatile boolean running;

    public HubShutdownCoordinator(TenantRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("GracefullyShutdown: closing {} connections across {} tenants",
                registry.connectionCount(), registry.tenantCount());
        registry.shutdown();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
