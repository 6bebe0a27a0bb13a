package com.switchboard.hub.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the hub, bound from {@code switchboard.hub.*}.
 *
 * <pre>
 * switchboard:
 *   hub:
 *     name: switchboard-hub
 *     admin-private-key: 9f1c...   # optional, generated when absent
 *     host-terminal-id: "@host"
 *     liveness:
 *       interval: 10s
 *       probe-timeout: 5s
 *       max-attempts: 3
 *       error-retry-delay: 1s
 * </pre>
 *
 * @param name service name used in logs and metric tags. Required.
 * @param adminPrivateKey hex Ed25519 seed of the admin tenant; blank means generate one.
 * @param hostTerminalId reserved terminal id of each tenant's host terminal.
 * @param sendTimeLimit how long a single send to a terminal may block before the connection
 *     is treated as stuck.
 * @param sendBufferSizeLimit bytes that may queue for a terminal while a send is in progress.
 * @param maxFrameSize largest inbound text frame accepted, in bytes.
 * @param liveness phantom-terminal probing settings.
 */
@ConfigurationProperties(prefix = "switchboard.hub")
@Validated
public record HubProperties(
        @NotBlank String name,
        String adminPrivateKey,
        String hostTerminalId,
        Duration sendTimeLimit,
        int sendBufferSizeLimit,
        int maxFrameSize,
        Liveness liveness) {

    public static final String DEFAULT_HOST_TERMINAL_ID = "@host";
    public static final Duration DEFAULT_SEND_TIME_LIMIT = Duration.ofSeconds(10);
    public static final int DEFAULT_BUFFER_SIZE = 1024 * 1024;

    public HubProperties {
        if (hostTerminalId == null || hostTerminalId.isBlank()) {
            hostTerminalId = DEFAULT_HOST_TERMINAL_ID;
        }
        if (sendTimeLimit == null || sendTimeLimit.isNegative() || sendTimeLimit.isZero()) {
            sendTimeLimit = DEFAULT_SEND_TIME_LIMIT;
        }
        if (sendBufferSizeLimit <= 0) {
            sendBufferSizeLimit = DEFAULT_BUFFER_SIZE;
        }
        if (maxFrameSize <= 0) {
            maxFrameSize = DEFAULT_BUFFER_SIZE;
        }
        if (liveness == null) {
            liveness = new Liveness(null, null, 0, null);
        }
    }

    /** True when an admin key was configured rather than generated at startup. */
    public boolean hasAdminPrivateKey() {
        return adminPrivateKey != null && !adminPrivateKey.isBlank();
    }

    /**
     * Liveness probing of registered terminals.
     *
     * @param interval delay between the end of one sweep and the start of the next.
     * @param probeTimeout how long one probe waits for its response.
     * @param maxAttempts probe attempts per terminal per sweep before eviction.
     * @param errorRetryDelay delay before re-running a sweep that failed unexpectedly.
     */
    public record Liveness(
            Duration interval, Duration probeTimeout, int maxAttempts, Duration errorRetryDelay) {

        public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
        public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final Duration DEFAULT_ERROR_RETRY_DELAY = Duration.ofSeconds(1);

        public Liveness {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                interval = DEFAULT_INTERVAL;
            }
            if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero()) {
                probeTimeout = DEFAULT_PROBE_TIMEOUT;
            }
            if (maxAttempts <= 0) {
                maxAttempts = DEFAULT_MAX_ATTEMPTS;
            }
            if (errorRetryDelay == null || errorRetryDelay.isNegative() || errorRetryDelay.isZero()) {
                errorRetryDelay = DEFAULT_ERROR_RETRY_DELAY;
            }
        }
    }
}
