package com.switchboard.hub.api;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.LivenessMonitor;
import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TenantRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the hub. Only counts are exposed; terminal metadata stays inside each
 * tenant.
 */
@RestController
@RequestMapping("/api/v1")
public class HubInfoController {

    private final HubProperties properties;
    private final TenantRegistry registry;

    public HubInfoController(HubProperties properties, TenantRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    @GetMapping("/info")
    public Map<String, Object> hubInfo() {
        return Map.of(
                "name", properties.name(),
                "status", registry.isClosed() ? "stopping" : "running",
                "tenants", registry.tenantCount(),
                "connections", registry.connectionCount(),
                "timestamp", Instant.now().toString());
    }

    @GetMapping("/tenants/{publicKey}")
    public Map<String, Object> tenantInfo(@PathVariable String publicKey) {
        Tenant tenant = registry.find(publicKey)
                .orElseThrow(() -> new NoSuchElementException("unknown tenant " + publicKey));
        return Map.of(
                "public_key", tenant.publicKey(),
                "terminals", tenant.knownTerminalIds().size(),
                "connections", tenant.connectionCount(),
                "monitoring", tenant.monitor().map(LivenessMonitor::isRunning).orElse(false));
    }
}
