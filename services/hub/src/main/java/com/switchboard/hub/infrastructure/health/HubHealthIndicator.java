package com.switchboard.hub.infrastructure.health;

import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TenantRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the hub DOWN once shutdown has begun or when a tenant's liveness monitor is no
 * longer running.
 */
@Component("hub")
public class HubHealthIndicator implements HealthIndicator {

    private final TenantRegistry registry;

    public HubHealthIndicator(TenantRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        long stalledMonitors = registry.tenants().stream()
                .map(Tenant::monitor)
                .filter(monitor -> monitor.map(m -> !m.isRunning()).orElse(true))
                .count();
        Health.Builder builder = registry.isClosed() || stalledMonitors > 0 ? Health.down() : Health.up();
        return builder
                .withDetail("tenants", registry.tenantCount())
                .withDetail("connections", registry.connectionCount())
                .withDetail("stalledMonitors", stalledMonitors)
                .build();
    }
}
