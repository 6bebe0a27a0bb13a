package com.switchboard.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link ConnectionContext} with SLF4J MDC bridge.
 * <p>
 * Container threads are pooled and shared between connections, so callers install the
 * context for the duration of a single callback with {@link #runWithContext} or
 * {@link #callWithContext}; the previous context (if any) is restored afterwards.
 */
public final class ConnectionContextHolder {

    private static final ThreadLocal<ConnectionContext> CONTEXT = new ThreadLocal<>();

    private ConnectionContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(ConnectionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(ConnectionContext.MDC_CONNECTION_ID, context.connectionId());
        setMdc(ConnectionContext.MDC_TENANT, context.tenant());
        setMdc(ConnectionContext.MDC_TERMINAL_ID, context.terminalId());
    }

    /**
     * Returns the current thread's context, if set.
     */
    public static Optional<ConnectionContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the context and removes the MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(ConnectionContext.MDC_CONNECTION_ID);
        MDC.remove(ConnectionContext.MDC_TENANT);
        MDC.remove(ConnectionContext.MDC_TERMINAL_ID);
    }

    /**
     * Runs {@code runnable} with {@code context} installed, then restores the previous one.
     */
    public static void runWithContext(ConnectionContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Calls {@code supplier} with {@code context} installed, then restores the previous one.
     */
    public static <T> T callWithContext(ConnectionContext context, Supplier<T> supplier) {
        ConnectionContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
