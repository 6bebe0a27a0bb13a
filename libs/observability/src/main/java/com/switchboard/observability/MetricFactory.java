package com.switchboard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for hub meters. Every meter carries a {@code service} tag; meters that
 * concern a single tenant also carry a {@code tenant} tag holding a shortened
 * public key, which keeps label values bounded in length.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Number of leading public key characters kept in the tenant tag. */
    public static final int TENANT_TAG_LENGTH = 12;

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the process-wide counter {@code name}. Micrometer returns the same
     * instance for repeated calls with identical name and tags.
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags().and(tags))
                .register(registry);
    }

    /**
     * Returns the counter {@code name} scoped to one tenant.
     */
    public Counter tenantCounter(String name, String description, String tenant) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags().and(TAG_TENANT, tenantTag(tenant)))
                .register(registry);
    }

    /**
     * Registers a gauge and returns the value holder that backs it.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags().and(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    /**
     * Shortens a tenant public key for use as a tag value.
     */
    public static String tenantTag(String tenant) {
        if (tenant == null || tenant.isBlank()) {
            return "unknown";
        }
        return tenant.length() <= TENANT_TAG_LENGTH ? tenant : tenant.substring(0, TENANT_TAG_LENGTH);
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
