package com.switchboard.hub.infrastructure.web;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.MessageRouter;
import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TerminalConnection;
import com.switchboard.observability.ConnectionContext;
import com.switchboard.observability.ConnectionContextHolder;
import com.switchboard.observability.MetricFactory;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Connection lifecycle of terminals: register on open, route every text frame, release on
 * close. Transport errors close the session and follow the same release path.
 *
 * <ol>
 *   <li>{@code afterConnectionEstablished}: wraps the session, registers it with the tenant
 *       resolved by {@link TerminalHandshakeInterceptor} and closes any connection it supersedes.
 *   <li>{@code handleTextMessage}: hands the payload to the {@link MessageRouter} unchanged.
 *   <li>{@code handleTransportError}: closes the session; cleanup happens in the next step.
 *   <li>{@code afterConnectionClosed}: releases the connection only if it is still the one
 *       registered, so a superseded socket closing late never removes its successor.
 * </ol>
 *
 * <p>Each callback runs with the connection's {@link ConnectionContext} in the MDC.
 *
 * <p>WHY: several threads write to one session (the sender's thread, liveness pings, channel
 * pushes) and the servlet container forbids concurrent sends, so every session is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator}. A peer that stops reading trips the send time
 * or buffer limit and is closed instead of stalling its senders.
 */
public class TerminalWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TerminalWebSocketHandler.class);

    private final MessageRouter router;
    private final int sendTimeLimitMillis;
    private final int sendBufferSizeLimit;
    private final AtomicLong activeConnections;
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    public TerminalWebSocketHandler(MessageRouter router, HubProperties properties, MetricFactory metrics) {
        this.router = router;
        this.sendTimeLimitMillis = Math.toIntExact(properties.sendTimeLimit().toMillis());
        this.sendBufferSizeLimit = properties.sendBufferSizeLimit();
        this.activeConnections = metrics.gauge("hub.connections.active", "Open terminal connections");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Tenant tenant = (Tenant) session.getAttributes().get(TerminalHandshakeInterceptor.TENANT_ATTRIBUTE);
        String terminalId = (String) session.getAttributes().get(TerminalHandshakeInterceptor.TERMINAL_ID_ATTRIBUTE);
        if (tenant == null || terminalId == null) {
            log.warn("session {} opened without handshake attributes", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        WebSocketSession decorated =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, sendBufferSizeLimit);
        Binding binding = new Binding(tenant, new WebSocketTerminalConnection(decorated, terminalId));
        bindings.put(session.getId(), binding);
        activeConnections.incrementAndGet();

        ConnectionContextHolder.runWithContext(binding.context(session), () -> {
            Optional<TerminalConnection> previous = tenant.register(binding.connection());
            if (previous.isPresent()) {
                log.info("terminal replaced: {} {} -> {}", terminalId, previous.get().id(), session.getId());
            } else {
                log.info("terminal connected: {} {}", terminalId, session.getId());
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Binding binding = bindings.get(session.getId());
        if (binding == null) {
            return;
        }
        ConnectionContextHolder.runWithContext(binding.context(session),
                () -> router.route(binding.tenant(), message.getPayload()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.debug("transport error on {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Binding binding = bindings.remove(session.getId());
        if (binding == null) {
            return;
        }
        activeConnections.decrementAndGet();
        ConnectionContextHolder.runWithContext(binding.context(session), () -> {
            if (binding.tenant().release(binding.connection())) {
                log.info("terminal disconnected: {} {} {}", binding.connection().terminalId(), session.getId(), status);
            } else {
                log.debug("superseded connection {} closed {}", session.getId(), status);
            }
        });
    }

    int openSessions() {
        return bindings.size();
    }

    private record Binding(Tenant tenant, TerminalConnection connection) {

        ConnectionContext context(WebSocketSession session) {
            return new ConnectionContext(session.getId(), tenant.publicKey(), connection.terminalId());
        }
    }
}
