package com.meridian.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: thread-local storage and its MDC bridge,
 * in-place updates and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "alice", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should clear context")
        void shouldClearContext() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "alice", "req-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("alice");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should not leave MDC keys for null values")
        void shouldSkipNullValues() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "alice", null));
            CorrelationContextHolder.set(new CorrelationContext("corr-2", null, null));

            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }

        @Test
        @DisplayName("should remove MDC keys when cleared")
        void shouldRemoveMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "alice", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("update()")
    class Update {

        @Test
        @DisplayName("should attach the username to the current context")
        void shouldAttachUsername() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "req-1"));

            CorrelationContextHolder.update(ctx -> ctx.withUserId("bob"));

            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::userId).isEqualTo("bob");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("bob");
        }

        @Test
        @DisplayName("should do nothing when no context is set")
        void shouldIgnoreMissingContext() {
            CorrelationContextHolder.update(ctx -> ctx.withUserId("bob"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("runWithContext()")
    class RunWithContext {

        @Test
        @DisplayName("should expose the context inside the runnable and restore afterwards")
        void shouldRestorePrevious() {
            var outer = new CorrelationContext("outer", null, null);
            var inner = new CorrelationContext("inner", null, null);
            var seen = new AtomicReference<String>();
            CorrelationContextHolder.set(outer);

            CorrelationContextHolder.runWithContext(inner,
                    () -> seen.set(CorrelationContextHolder.get().orElseThrow().correlationId()));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear when there was no previous context")
        void shouldClearWhenNoPrevious() {
            CorrelationContextHolder.runWithContext(
                    new CorrelationContext("only", null, null), () -> { });

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
