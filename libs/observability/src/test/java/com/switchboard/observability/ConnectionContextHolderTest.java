package com.switchboard.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConnectionContextHolder}: ThreadLocal storage, MDC bridge and
 * scoped execution.
 */
@DisplayName("ConnectionContextHolder")
class ConnectionContextHolderTest {

    @AfterEach
    void cleanup() {
        ConnectionContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(ConnectionContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new ConnectionContext("conn-1", "key-1", "t1");
            ConnectionContextHolder.set(ctx);

            assertThat(ConnectionContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> ConnectionContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank tenant")
        void shouldRejectBlankTenant() {
            assertThatThrownBy(() -> new ConnectionContext("conn-1", " ", "t1"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tenant");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            ConnectionContextHolder.set(new ConnectionContext("conn-1", "key-1", "t1"));

            assertThat(MDC.get("connectionId")).isEqualTo("conn-1");
            assertThat(MDC.get("tenant")).isEqualTo("key-1");
            assertThat(MDC.get("terminalId")).isEqualTo("t1");
        }

        @Test
        @DisplayName("should not leave a terminal id behind for internal work")
        void shouldRemoveNullTerminalId() {
            ConnectionContextHolder.set(new ConnectionContext("conn-1", "key-1", "t1"));
            ConnectionContextHolder.set(ConnectionContext.internal("key-1", null));

            assertThat(MDC.get("connectionId")).isEqualTo("internal");
            assertThat(MDC.get("terminalId")).isNull();
        }

        @Test
        @DisplayName("should remove MDC keys on clear")
        void shouldRemoveMdcOnClear() {
            ConnectionContextHolder.set(new ConnectionContext("conn-1", "key-1", "t1"));
            ConnectionContextHolder.clear();

            assertThat(MDC.get("connectionId")).isNull();
            assertThat(MDC.get("tenant")).isNull();
            assertThat(MDC.get("terminalId")).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class Scoped {

        @Test
        @DisplayName("should restore previous context after runWithContext")
        void shouldRestorePrevious() {
            var outer = new ConnectionContext("conn-1", "key-1", "t1");
            var inner = new ConnectionContext("conn-2", "key-2", "t2");
            ConnectionContextHolder.set(outer);

            ConnectionContextHolder.runWithContext(inner,
                    () -> assertThat(MDC.get("tenant")).isEqualTo("key-2"));

            assertThat(ConnectionContextHolder.get()).contains(outer);
            assertThat(MDC.get("tenant")).isEqualTo("key-1");
        }

        @Test
        @DisplayName("should clear when there was no previous context")
        void shouldClearWithoutPrevious() {
            String result = ConnectionContextHolder.callWithContext(
                    new ConnectionContext("conn-1", "key-1", "t1"),
                    () -> MDC.get("terminalId"));

            assertThat(result).isEqualTo("t1");
            assertThat(ConnectionContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context when the work throws")
        void shouldRestoreOnException() {
            assertThatThrownBy(() -> ConnectionContextHolder.runWithContext(
                    new ConnectionContext("conn-1", "key-1", "t1"),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(ConnectionContextHolder.get()).isEmpty();
            assertThat(MDC.get("tenant")).isNull();
        }
    }
}
