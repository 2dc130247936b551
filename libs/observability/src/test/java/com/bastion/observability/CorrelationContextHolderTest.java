package com.bastion.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and
 * hand-off of the context to pooled worker threads.
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
            var ctx = new CorrelationContext("corr-1", "req-1", "tenant-1", "fp-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should default requestId to correlationId")
        void shouldDefaultRequestId() {
            var ctx = CorrelationContext.of("corr-9");
            assertThat(ctx.requestId()).isEqualTo("corr-9");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "tenant-1", "fp-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("tenantId")).isEqualTo("tenant-1");
            assertThat(MDC.get("credentialFingerprint")).isEqualTo("fp-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "tenant-1", "fp-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("credentialFingerprint")).isNull();
        }

        @Test
        @DisplayName("should remove stale MDC values for null optional fields")
        void shouldRemoveStaleMdcValues() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "tenant-1", "fp-1"));
            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("credentialFingerprint")).isNull();
        }
    }

    @Nested
    @DisplayName("supplyWithContext")
    class SupplyWithContext {

        @Test
        @DisplayName("should restore the outer context afterwards")
        void shouldRestoreOuterContext() {
            var outer = CorrelationContext.of("outer-corr");
            var inner = CorrelationContext.of("inner-corr");
            CorrelationContextHolder.set(outer);

            String captured = CorrelationContextHolder.supplyWithContext(inner,
                    () -> CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null));

            assertThat(captured).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should restore the outer context when the supplier throws")
        void shouldRestoreAfterFailure() {
            var outer = CorrelationContext.of("outer-corr");
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(() -> CorrelationContextHolder.supplyWithContext(CorrelationContext.of("inner-corr"),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).contains(outer);
            assertThat(MDC.get("correlationId")).isEqualTo("outer-corr");
        }

        @Test
        @DisplayName("should clear afterwards when no previous context existed")
        void shouldClearWhenNoPrevious() {
            CorrelationContextHolder.supplyWithContext(CorrelationContext.of("temp"), () -> MDC.get("correlationId"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("correlationId")).isNull();
        }
    }

    @Nested
    @DisplayName("wrap")
    class Wrap {

        @Test
        @DisplayName("should carry the context onto a pooled thread and leave it clean")
        void shouldCarryContextToPooledThread() throws Exception {
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                var ctx = new CorrelationContext("corr-7", "req-7", "tenant-7", "fp-7");
                Callable<String> wrapped = CorrelationContextHolder.wrap(ctx, () -> MDC.get("requestId"));

                Future<String> inside = pool.submit(wrapped);
                assertThat(inside.get(5, TimeUnit.SECONDS)).isEqualTo("req-7");

                Future<Boolean> after = pool.submit(() -> CorrelationContextHolder.get().isEmpty());
                assertThat(after.get(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("should run with no context when given null")
        void shouldRunWithoutContextWhenNull() throws Exception {
            CorrelationContextHolder.set(CorrelationContext.of("caller"));

            Boolean empty = CorrelationContextHolder.wrap(null,
                    () -> CorrelationContextHolder.get().isEmpty()).call();

            assertThat(empty).isTrue();
            assertThat(CorrelationContextHolder.get()).isPresent();
        }
    }
}
