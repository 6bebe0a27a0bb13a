package com.switchboard.hub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.switchboard.hub.config.HubProperties;
import com.switchboard.hub.domain.HostServices;
import com.switchboard.hub.domain.SweepReport;
import com.switchboard.hub.domain.Tenant;
import com.switchboard.hub.domain.TenantRegistry;
import com.switchboard.protocol.ServiceResponse;
import com.switchboard.protocol.TerminalMessage;
import com.switchboard.security.ConnectionCredentials;
import com.switchboard.security.Ed25519Signatures;
import com.switchboard.security.SigningKeyPair;
import com.switchboard.security.testing.TestTerminalCredentials;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

/**
 * End-to-end behaviour of the hub over real WebSocket connections.
 *
 * <p>Boots the full context on a random port with the {@code test} profile: the liveness
 * interval is an hour, so sweeps only run when a test calls {@code sweep()} directly, and
 * process signal handlers are off. Each test signs in under a fresh tenant key, which keeps
 * tests independent even though they share one registry.
 *
 * <p>WHY: handshake authentication, frame pass-through and supersede-on-reconnect all depend on
 * the servlet container and Spring's WebSocket plumbing. Unit tests with fake sessions cannot
 * show that the 401 is sent before the upgrade or that bytes arrive unmodified.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("Hub application")
class HubApplicationTest {

    private static final String HOST = HubProperties.DEFAULT_HOST_TERMINAL_ID;

    @LocalServerPort private int port;
    @Autowired private TenantRegistry registry;
    @Autowired private TestRestTemplate rest;

    private SigningKeyPair tenantKey;

    @BeforeEach
    void setUp() {
        tenantKey = Ed25519Signatures.generateKeyPair();
    }

    private TestTerminal connect(String terminalId) throws Exception {
        return TestTerminal.connect(port, TestTerminalCredentials.createFor(tenantKey, terminalId));
    }

    /** Retries {@code assertion} for up to five seconds. */
    private static void eventually(Runnable assertion) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (true) {
            try {
                assertion.run();
                return;
            } catch (AssertionError e) {
                if (System.nanoTime() > deadline) {
                    throw e;
                }
                Thread.sleep(50);
            }
        }
    }

    private static void announce(TestTerminal terminal, String name) throws Exception {
        TerminalMessage response = terminal.call(HOST, HostServices.UPDATE_TERMINAL_INFO,
                Map.of("terminal_id", terminal.terminalId(), "name", name));
        assertThat(response.res().get("code").asInt()).isZero();
    }

    @Nested
    @DisplayName("host services")
    class HostServiceCalls {

        @Test
        @DisplayName("UpdateTerminalInfo then ListTerminals returns t1 Alpha")
        void updateAndList() throws Exception {
            try (TestTerminal t1 = connect("t1")) {
                announce(t1, "Alpha");

                TerminalMessage listed = t1.call(HOST, HostServices.LIST_TERMINALS, Map.of());

                assertThat(listed.res().get("code").asInt()).isZero();
                assertThat(listed.res().get("data")).hasSize(1);
                assertThat(listed.res().get("data").get(0).get("terminal_id").asText()).isEqualTo("t1");
                assertThat(listed.res().get("data").get(0).get("name").asText()).isEqualTo("Alpha");
            }
        }

        @Test
        @DisplayName("Terminate is refused with 403")
        void terminateRefused() throws Exception {
            try (TestTerminal t1 = connect("t1")) {
                announce(t1, "Alpha");

                TerminalMessage response = t1.call(HOST, HostServices.TERMINATE, Map.of());

                assertThat(response.res().get("code").asInt()).isEqualTo(ServiceResponse.FORBIDDEN);
                assertThat(t1.isOpen()).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("delivers frames between terminals of one tenant unmodified")
        void deliversBetweenTerminals() throws Exception {
            try (TestTerminal t1 = connect("t1"); TestTerminal t2 = connect("t2")) {
                announce(t2, "Beta");
                String frame = "{\"target_terminal_id\":\"t2\",\"source_terminal_id\":\"t1\",\"any\":{\"k\":[1,2]}}";

                t1.send(frame);

                assertThat(t2.await()).isEqualTo(frame);
            }
        }

        @Test
        @DisplayName("drops frames to an unknown terminal silently")
        void dropsUnknownTarget() throws Exception {
            try (TestTerminal t1 = connect("t1")) {
                announce(t1, "Alpha");

                t1.send("{\"target_terminal_id\":\"t2\",\"hello\":true}");

                assertThat(t1.poll(300)).isNull();
                assertThat(t1.isOpen()).isTrue();
                assertThat(t1.call(HOST, HostServices.LIST_TERMINALS, Map.of()).res().get("code").asInt()).isZero();
            }
        }

        @Test
        @DisplayName("never delivers to a terminal of another tenant")
        void isolatesTenants() throws Exception {
            SigningKeyPair otherKey = Ed25519Signatures.generateKeyPair();
            try (TestTerminal t1 = connect("t1");
                    TestTerminal foreign = TestTerminal.connect(port, TestTerminalCredentials.createFor(otherKey, "t2"))) {
                announce(foreign, "Foreign");

                t1.send("{\"target_terminal_id\":\"t2\"}");

                assertThat(foreign.poll(300)).isNull();
            }
        }
    }

    @Nested
    @DisplayName("connection lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("rejects an invalid signature without registering anything")
        void rejectsInvalidSignature() {
            ConnectionCredentials forged = TestTerminalCredentials.createForged("t1");

            assertThatThrownBy(() -> TestTerminal.connect(port, forged))
                    .isInstanceOf(ExecutionException.class);
            assertThat(registry.find(forged.publicKey())).isEmpty();
        }

        @Test
        @DisplayName("a second connection for the same terminal id replaces the first")
        void replacesConnection() throws Exception {
            try (TestTerminal first = connect("t1"); TestTerminal second = connect("t1")) {
                first.closed().get(5, TimeUnit.SECONDS);
                Tenant tenant = registry.find(tenantKey.publicKey()).orElseThrow();

                eventually(() -> assertThat(tenant.connectionCount()).isEqualTo(1));
                assertThat(second.isOpen()).isTrue();
                announce(second, "Alpha");
            }
        }

        @Test
        @DisplayName("evicts a terminal that does not answer probes")
        void evictsSilentTerminal() throws Exception {
            try (TestTerminal silent = connect("t1")) {
                announce(silent, "Alpha");
                Tenant tenant = registry.find(tenantKey.publicKey()).orElseThrow();

                SweepReport report = tenant.monitor().orElseThrow().sweep().get(10, TimeUnit.SECONDS);

                assertThat(report.evicted()).containsExactly("t1");
                assertThat(tenant.snapshot()).isEmpty();
                silent.closed().get(5, TimeUnit.SECONDS);
            }
        }

        @Test
        @DisplayName("closing a connection removes the terminal")
        void closeUnregisters() throws Exception {
            TestTerminal t1 = connect("t1");
            announce(t1, "Alpha");
            Tenant tenant = registry.find(tenantKey.publicKey()).orElseThrow();

            t1.close();

            eventually(() -> {
                assertThat(tenant.connectionCount()).isZero();
                assertThat(tenant.info("t1")).isEmpty();
            });
        }
    }

    @Nested
    @DisplayName("REST")
    class Rest {

        @Test
        @DisplayName("info endpoint reports name and status")
        @SuppressWarnings("rawtypes")
        void infoEndpoint() {
            ResponseEntity<Map> response = rest.getForEntity("/api/v1/info", Map.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody()).containsEntry("name", "switchboard-hub-test");
            assertThat(response.getBody()).containsEntry("status", "running");
        }

        @Test
        @DisplayName("unknown tenant answers 404 problem detail")
        @SuppressWarnings("rawtypes")
        void unknownTenant() {
            ResponseEntity<Map> response = rest.getForEntity("/api/v1/tenants/ffff", Map.class);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(response.getBody()).containsEntry("title", "Not Found");
        }

        @Test
        @DisplayName("actuator health is up")
        void health() {
            assertThat(rest.getForEntity("/actuator/health", String.class).getStatusCode()).isEqualTo(HttpStatus.OK);
        }
    }
}
