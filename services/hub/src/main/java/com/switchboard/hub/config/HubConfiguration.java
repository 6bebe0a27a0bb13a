package com.switchboard.hub.config;

import com.switchboard.hub.domain.MessageRouter;
import com.switchboard.hub.domain.TenantBootstrap;
import com.switchboard.hub.domain.TenantRegistry;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.security.ConnectionAuthenticator;
import com.switchboard.security.Ed25519Signatures;
import com.switchboard.security.SigningKeyPair;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wiring of the routing core. Domain classes carry no Spring annotations; they are assembled
 * here.
 */
@Configuration
public class HubConfiguration {

    private static final Logger log = LoggerFactory.getLogger(HubConfiguration.class);

    public static final String LIVENESS_SCHEDULER = "livenessScheduler";

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, HubProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public ConnectionAuthenticator connectionAuthenticator() {
        return new ConnectionAuthenticator();
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    /** The admin tenant's key pair: configured, or generated for this process lifetime. */
    @Bean
    public SigningKeyPair adminKeyPair(HubProperties properties) {
        if (properties.hasAdminPrivateKey()) {
            return Ed25519Signatures.fromPrivateKey(properties.adminPrivateKey());
        }
        log.info("no admin key configured, generating one");
        return Ed25519Signatures.generateKeyPair();
    }

    @Bean(name = LIVENESS_SCHEDULER, destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler livenessScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("liveness-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public MessageRouter messageRouter(MetricFactory metricFactory) {
        return new MessageRouter(metricFactory);
    }

    @Bean
    public TenantBootstrap tenantBootstrap(HubProperties properties, SigningKeyPair adminKeyPair,
            MessageRouter messageRouter, @Qualifier(LIVENESS_SCHEDULER) ThreadPoolTaskScheduler livenessScheduler,
            MetricFactory metricFactory) {
        return new TenantBootstrap(properties.hostTerminalId(), adminKeyPair.publicKey(), messageRouter,
                livenessScheduler, livenessScheduler, properties.liveness(), metricFactory);
    }

    @Bean
    public TenantRegistry tenantRegistry(TenantBootstrap tenantBootstrap) {
        return new TenantRegistry(tenantBootstrap);
    }
}
