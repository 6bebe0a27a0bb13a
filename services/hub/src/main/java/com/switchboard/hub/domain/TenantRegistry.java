package com.switchboard.hub.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide map of tenants keyed by public key.
 *
 * <p>Tenants are created on first use and live until shutdown. Creation is guarded per key, so
 * concurrent first connections under one key share a single tenant.
 */
public class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final ConcurrentMap<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final TenantBootstrap bootstrap;
    private volatile boolean closed;

    public TenantRegistry(TenantBootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    /**
     * Returns the tenant for {@code publicKey}, creating it on first use, and records
     * {@code signature} as its signature of record.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public Tenant getOrCreate(String publicKey, String signature) {
        if (closed) {
            throw new IllegalStateException("tenant registry is shut down");
        }
        Tenant tenant = tenants.computeIfAbsent(publicKey, key -> {
            if (closed) {
                throw new IllegalStateException("tenant registry is shut down");
            }
            return bootstrap.bootstrap(key, this);
        });
        if (closed) {
            // shutdown may have swept the map before this tenant was stored
            release(tenant);
            throw new IllegalStateException("tenant registry is shut down");
        }
        tenant.recordSignature(signature);
        return tenant;
    }

    public Optional<Tenant> find(String publicKey) {
        return Optional.ofNullable(tenants.get(publicKey));
    }

    public Collection<Tenant> tenants() {
        return List.copyOf(tenants.values());
    }

    public int tenantCount() {
        return tenants.size();
    }

    public int connectionCount() {
        return tenants.values().stream().mapToInt(Tenant::connectionCount).sum();
    }

    /** Public key and signature of record of every tenant, ordered by public key. */
    public List<HostRecord> hostRecords() {
        return tenants.values().stream()
                .map(tenant -> new HostRecord(tenant.publicKey(), tenant.signature()))
                .sorted(Comparator.comparing(HostRecord::publicKey))
                .toList();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops every liveness monitor and closes every terminal connection. New tenants are
     * refused afterwards.
     */
    public void shutdown() {
        closed = true;
        for (Tenant tenant : tenants.values()) {
            release(tenant);
        }
        log.info("closed connections of {} tenants", tenants.size());
    }

    private static void release(Tenant tenant) {
        tenant.monitor().ifPresent(LivenessMonitor::stop);
        tenant.closeAll();
        tenant.host().cancelPending();
    }
}
