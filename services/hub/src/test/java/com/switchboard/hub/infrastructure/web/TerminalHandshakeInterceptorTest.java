package com.switchboard.hub.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.MessageRouter;
import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TenantBootstrap;
import com.switchboard.hub.domain.TenantRegistry;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.security.ConnectionAuthenticator;
import com.switchboard.security.ConnectionCredentials;
import com.switchboard.security.testing.TestTerminalCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.WebSocketHandler;

/**
 * Unit tests for {@link TerminalHandshakeInterceptor}, driven with mock servlet requests and a
 * real {@link TenantRegistry}.
 *
 * <p>WHY: every rejected upgrade must leave the registry untouched and the body empty, and
 * query strings arrive exactly as clients wrote them, padding and stray {@code =} included.
 * Checking the registry after each rejection catches a tenant created before authentication.
 */
@DisplayName("TerminalHandshakeInterceptor")
class TerminalHandshakeInterceptorTest {

    private MeterRegistry meterRegistry;
    private TenantRegistry registry;
    private TerminalHandshakeInterceptor interceptor;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MetricFactory metrics = new MetricFactory(meterRegistry, "hub-test");
        TenantBootstrap bootstrap = new TenantBootstrap("@host", "ad00", new MessageRouter(metrics),
                mock(TaskScheduler.class), Runnable::run, new HubProperties.Liveness(null, null, 0, null), metrics);
        registry = new TenantRegistry(bootstrap);
        interceptor = new TerminalHandshakeInterceptor(new ConnectionAuthenticator(), registry,
                new SensitiveDataRedactor(), metrics, "@host");
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake(String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setQueryString(query);
        return interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);
    }

    private static String query(ConnectionCredentials credentials) {
        return "public_key=" + credentials.publicKey()
                + "&terminal_id=" + credentials.terminalId()
                + "&signature=" + credentials.signature();
    }

    @Test
    @DisplayName("accepts valid credentials and hands the tenant to the handler")
    void acceptsValid() {
        ConnectionCredentials credentials = TestTerminalCredentials.create("t1");

        assertThat(handshake(query(credentials))).isTrue();

        Tenant tenant = (Tenant) attributes.get(TerminalHandshakeInterceptor.TENANT_ATTRIBUTE);
        assertThat(tenant.publicKey()).isEqualTo(credentials.publicKey());
        assertThat(tenant.signature()).isEqualTo(credentials.signature());
        assertThat(attributes).containsEntry(TerminalHandshakeInterceptor.TERMINAL_ID_ATTRIBUTE, "t1");
    }

    @Test
    @DisplayName("keeps a raw '=' inside the terminal id")
    void acceptsEqualsInTerminalId() {
        ConnectionCredentials credentials = TestTerminalCredentials.create("a=b");

        assertThat(handshake(query(credentials))).isTrue();

        assertThat(attributes).containsEntry(TerminalHandshakeInterceptor.TERMINAL_ID_ATTRIBUTE, "a=b");
    }

    @Test
    @DisplayName("decodes percent-encoded values")
    void decodesEscapes() {
        ConnectionCredentials credentials = TestTerminalCredentials.create("t 1");

        assertThat(handshake("public_key=" + credentials.publicKey() + "&terminal_id=t%201&signature="
                + credentials.signature())).isTrue();

        assertThat(attributes).containsEntry(TerminalHandshakeInterceptor.TERMINAL_ID_ATTRIBUTE, "t 1");
    }

    @Nested
    @DisplayName("rejects with 401 and touches no state")
    class Rejections {

        private void assertRejected(boolean accepted) {
            assertThat(accepted).isFalse();
            assertThat(servletResponse.getStatus()).isEqualTo(401);
            assertThat(servletResponse.getContentAsByteArray()).isEmpty();
            assertThat(registry.tenantCount()).isZero();
            assertThat(attributes).isEmpty();
            assertThat(meterRegistry.get("hub.auth.failures").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("forged signature")
        void forged() {
            assertRejected(handshake(query(TestTerminalCredentials.createForged("t1"))));
        }

        @Test
        @DisplayName("missing signature")
        void missingSignature() {
            ConnectionCredentials credentials = TestTerminalCredentials.create("t1");
            assertRejected(handshake("public_key=" + credentials.publicKey() + "&terminal_id=t1"));
        }

        @Test
        @DisplayName("missing terminal id")
        void missingTerminalId() {
            ConnectionCredentials credentials = TestTerminalCredentials.create("t1");
            assertRejected(handshake("public_key=" + credentials.publicKey() + "&signature=" + credentials.signature()));
        }

        @Test
        @DisplayName("signature with a trailing '='")
        void signatureWithPadding() {
            ConnectionCredentials credentials = TestTerminalCredentials.create("t1");
            assertRejected(handshake("public_key=" + credentials.publicKey() + "&terminal_id=t1&signature="
                    + credentials.signature() + "="));
        }

        @Test
        @DisplayName("no query string at all")
        void noQuery() {
            assertRejected(handshake(null));
        }
    }

    @Test
    @DisplayName("refuses the reserved host terminal id with 403")
    void refusesHostId() {
        ConnectionCredentials credentials = TestTerminalCredentials.create("@host");

        assertThat(handshake(query(credentials).replace("@", "%40"))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(403);
        assertThat(registry.tenantCount()).isZero();
    }

    @Test
    @DisplayName("refuses connections with 503 once the registry is shut down")
    void refusesAfterShutdown() {
        registry.shutdown();

        assertThat(handshake(query(TestTerminalCredentials.create("t1")))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(503);
    }
}
