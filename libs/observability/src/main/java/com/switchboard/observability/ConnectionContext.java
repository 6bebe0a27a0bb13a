package com.switchboard.observability;

/**
 * Immutable context describing the terminal connection a piece of work belongs to.
 * <p>
 * Every WebSocket callback in the hub runs with a {@code ConnectionContext} installed so
 * that log lines carry the tenant and terminal they concern. Values are injected into
 * SLF4J MDC by {@link ConnectionContextHolder}.
 *
 * @param connectionId transport-level id of the connection (session id)
 * @param tenant       public key of the tenant the connection authenticated under
 * @param terminalId   terminal id claimed by the connection (nullable for hub-internal work)
 */
public record ConnectionContext(String connectionId, String tenant, String terminalId) {

    /** MDC key for the connection id. */
    public static final String MDC_CONNECTION_ID = "connectionId";

    /** MDC key for the tenant public key. */
    public static final String MDC_TENANT = "tenant";

    /** MDC key for the terminal id. */
    public static final String MDC_TERMINAL_ID = "terminalId";

    public ConnectionContext {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId must not be null or blank");
        }
        if (tenant == null || tenant.isBlank()) {
            throw new IllegalArgumentException("tenant must not be null or blank");
        }
    }

    /**
     * Context for work the hub does on behalf of a tenant without a client connection,
     * such as a liveness sweep.
     */
    public static ConnectionContext internal(String tenant, String terminalId) {
        return new ConnectionContext("internal", tenant, terminalId);
    }
}
