package com.switchboard.hub.domain;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.host.HostTerminal;
import com.switchboard.observability.MetricFactory;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Builds a fully initialised tenant: routing state, host terminal with its services, and a
 * started liveness monitor.
 */
public class TenantBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TenantBootstrap.class);

    private final String hostTerminalId;
    private final String adminPublicKey;
    private final MessageRouter router;
    private final TaskScheduler scheduler;
    private final Executor probeExecutor;
    private final HubProperties.Liveness liveness;
    private final MetricFactory metrics;

    public TenantBootstrap(String hostTerminalId, String adminPublicKey, MessageRouter router,
            TaskScheduler scheduler, Executor probeExecutor, HubProperties.Liveness liveness,
            MetricFactory metrics) {
        this.hostTerminalId = hostTerminalId;
        this.adminPublicKey = adminPublicKey;
        this.router = router;
        this.scheduler = scheduler;
        this.probeExecutor = probeExecutor;
        this.liveness = liveness;
        this.metrics = metrics;
    }

    Tenant bootstrap(String publicKey, TenantRegistry registry) {
        Tenant tenant = new Tenant(publicKey, hostTerminalId);
        HostTerminal host = new HostTerminal(hostTerminalId, tenant::isRoutable,
                frame -> router.route(tenant, frame));
        tenant.attachHost(host);
        boolean admin = publicKey.equals(adminPublicKey);
        HostServices.install(host, tenant, registry, admin);

        LivenessMonitor monitor = new LivenessMonitor(tenant, scheduler, probeExecutor, liveness,
                metrics.tenantCounter("hub.terminals.evicted", "Terminals evicted after failed probes", publicKey));
        tenant.attachMonitor(monitor);
        monitor.start();

        log.info("tenant created: {}{}", MetricFactory.tenantTag(publicKey), admin ? " (admin)" : "");
        return tenant;
    }
}
