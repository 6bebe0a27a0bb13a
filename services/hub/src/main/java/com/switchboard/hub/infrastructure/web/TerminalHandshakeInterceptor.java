package com.switchboard.hub.infrastructure.web;

import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TenantRegistry;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.security.AuthenticationException;
import com.switchboard.security.ConnectionAuthenticator;
import com.switchboard.security.ConnectionCredentials;
import io.micrometer.core.instrument.Counter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Authenticates the upgrade request before the WebSocket handshake completes.
 *
 * <p>A request failing authentication is answered with an empty 401 and never reaches the
 * handler; nothing is registered for it. On success the tenant is resolved (created on first
 * use) and handed to the handler through the session attributes.
 */
public class TerminalHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TerminalHandshakeInterceptor.class);

    static final String TENANT_ATTRIBUTE = "switchboard.tenant";
    static final String TERMINAL_ID_ATTRIBUTE = "switchboard.terminalId";

    private final ConnectionAuthenticator authenticator;
    private final TenantRegistry registry;
    private final SensitiveDataRedactor redactor;
    private final Counter authFailures;
    private final String hostTerminalId;

    public TerminalHandshakeInterceptor(ConnectionAuthenticator authenticator, TenantRegistry registry,
            SensitiveDataRedactor redactor, MetricFactory metrics, String hostTerminalId) {
        this.authenticator = authenticator;
        this.hostTerminalId = hostTerminalId;
        this.registry = registry;
        this.redactor = redactor;
        this.authFailures = metrics.counter("hub.auth.failures", "Rejected connection attempts");
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Map<String, Object> attributes) {
        ConnectionCredentials credentials;
        try {
            credentials = credentialsOf(request);
            authenticator.authenticate(credentials);
        } catch (AuthenticationException e) {
            authFailures.increment();
            log.warn("Auth Failed {} reason {}", redactor.redactUri(request.getURI().toString()), e.reason());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        if (hostTerminalId.equals(credentials.terminalId())) {
            log.warn("Auth Failed {} reason terminal_id {} is reserved",
                    redactor.redactUri(request.getURI().toString()), hostTerminalId);
            response.setStatusCode(HttpStatus.FORBIDDEN);
            return false;
        }
        Tenant tenant;
        try {
            tenant = registry.getOrCreate(credentials.publicKey(), credentials.signature());
        } catch (IllegalStateException e) {
            log.info("refusing connection of {} during shutdown", credentials.terminalId());
            response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
            return false;
        }
        attributes.put(TENANT_ATTRIBUTE, tenant);
        attributes.put(TERMINAL_ID_ATTRIBUTE, credentials.terminalId());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("handshake failed for {}", redactor.redactUri(request.getURI().toString()), exception);
        }
    }

    /**
     * Reads the three credentials from the raw query string. Values are percent-decoded; a raw
     * {@code =} inside a value is kept as part of it.
     *
     * @throws AuthenticationException if a value carries a malformed percent escape
     */
    static ConnectionCredentials credentialsOf(ServerHttpRequest request) {
        var params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        return new ConnectionCredentials(
                decoded(params.getFirst(ConnectionCredentials.PARAM_PUBLIC_KEY)),
                decoded(params.getFirst(ConnectionCredentials.PARAM_TERMINAL_ID)),
                decoded(params.getFirst(ConnectionCredentials.PARAM_SIGNATURE)));
    }

    private static String decoded(String value) {
        if (value == null) {
            return null;
        }
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("query string is malformed");
        }
    }
}
