package com.bastion.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.ErrorKind;
import com.bastion.audit.SourceOfTruth;
import com.bastion.audit.UserFacingCategory;
import com.bastion.audit.ValidationOutcome;
import com.bastion.audit.ValidatorName;
import com.bastion.observability.SpanHelper;
import com.bastion.security.AccessLevel;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ParallelValidationOrchestrator")
class ParallelValidationOrchestratorTest {

    private static final GatewaySettings SHORT_DEADLINES =
            new GatewaySettings(true, SelectionPolicy.SHADOW, Duration.ofMillis(500), Duration.ofMillis(100));

    private final EngineFixture fx = new EngineFixture(SHORT_DEADLINES, ExtensionPolicy.DEFAULTS,
            ResourcePolicy.open(), RiskSettings.DEFAULTS);

    @AfterEach
    void tearDown() throws InterruptedException {
        fx.close();
    }

    private ComparisonRecord onlyRecord() {
        List<ComparisonRecord> records = fx.sink.queryWindow(EngineFixture.NOW, EngineFixture.NOW.plusSeconds(1));
        assertThat(records).hasSize(1);
        return records.get(0);
    }

    private static CredentialValidator mockEnhanced() {
        CredentialValidator validator = mock(CredentialValidator.class);
        when(validator.name()).thenReturn(ValidatorName.ENHANCED);
        return validator;
    }

    private static CredentialValidator mockLegacy() {
        CredentialValidator validator = mock(CredentialValidator.class);
        when(validator.name()).thenReturn(ValidatorName.LEGACY);
        return validator;
    }

    /** Single-thread pool that rejects its first submission. */
    private static final class RejectFirstExecutor extends ThreadPoolExecutor {

        private final AtomicBoolean rejectNext = new AtomicBoolean(true);

        RejectFirstExecutor() {
            super(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
        }

        @Override
        public void execute(Runnable command) {
            if (rejectNext.getAndSet(false)) {
                throw new RejectedExecutionException("saturated");
            }
            super.execute(command);
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("legacy and enhanced run at the same time")
        void validatorsOverlap() throws InterruptedException {
            var settings = new GatewaySettings(true, SelectionPolicy.SHADOW, Duration.ofSeconds(2),
                    Duration.ofSeconds(2));
            try (EngineFixture local = new EngineFixture(settings, ExtensionPolicy.DEFAULTS, ResourcePolicy.open(),
                    RiskSettings.DEFAULTS)) {
                CountDownLatch bothRunning = new CountDownLatch(2);
                AtomicBoolean legacySawEnhanced = new AtomicBoolean();
                AtomicBoolean enhancedSawLegacy = new AtomicBoolean();
                CredentialValidator legacy = mockLegacy();
                when(legacy.validate(any())).thenAnswer(invocation -> {
                    bothRunning.countDown();
                    legacySawEnhanced.set(bothRunning.await(1, TimeUnit.SECONDS));
                    return local.legacy.validate(invocation.<ValidationRequest>getArgument(0));
                });
                CredentialValidator enhanced = mockEnhanced();
                when(enhanced.validate(any())).thenAnswer(invocation -> {
                    bothRunning.countDown();
                    enhancedSawLegacy.set(bothRunning.await(1, TimeUnit.SECONDS));
                    return local.enhanced.validate(invocation.getArgument(0));
                });
                String key = local.apiKey("tenant-a", AccessLevel.WRITE);

                GatewayDecision decision = local.orchestrator(legacy, enhanced)
                        .orchestrate(local.request(key, "tenant-a", "orders"));

                assertThat(decision.allowed()).isTrue();
                assertThat(legacySawEnhanced).isTrue();
                assertThat(enhancedSawLegacy).isTrue();
            }
        }

        @Test
        @DisplayName("two slow validators finish in well under the sum of their latencies")
        void latenciesDoNotAdd() {
            Duration latency = Duration.ofMillis(300);
            var settings = new GatewaySettings(true, SelectionPolicy.SHADOW, Duration.ofSeconds(2),
                    Duration.ofSeconds(2));
            CredentialValidator legacy = mockLegacy();
            when(legacy.validate(any())).thenAnswer(invocation -> {
                Thread.sleep(latency.toMillis());
                return fx.legacy.validate(invocation.<ValidationRequest>getArgument(0));
            });
            CredentialValidator enhanced = mockEnhanced();
            when(enhanced.validate(any())).thenAnswer(invocation -> {
                Thread.sleep(latency.toMillis());
                return fx.enhanced.validate(invocation.getArgument(0));
            });
            var orchestrator = new ParallelValidationOrchestrator(legacy, enhanced, fx.translator, fx.recorder,
                    fx.validatorPool, settings, fx.metrics, SpanHelper.noop(), fx.clock);
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            long started = System.nanoTime();
            GatewayDecision decision = orchestrator.orchestrate(fx.request(key, "tenant-a", "orders"));
            Duration took = Duration.ofNanos(System.nanoTime() - started);

            assertThat(decision.allowed()).isTrue();
            assertThat(took).isLessThan(latency.multipliedBy(2));
            assertThat(onlyRecord().bothRan()).isTrue();
        }
    }

    @Nested
    @DisplayName("shadow mode fail-safe")
    class FailSafe {

        @Test
        @DisplayName("a cross-tenant block by enhanced does not change the legacy decision")
        void crossTenantBlockIsShadowed() {
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            GatewayDecision decision = fx.orchestrator().orchestrate(fx.request(key, "tenant-b", "orders"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.decidedBy()).isEqualTo(SourceOfTruth.LEGACY);
            ComparisonRecord record = onlyRecord();
            assertThat(record.crossTenantBlockTriggered()).isTrue();
            assertThat(record.securityDiscrepancy()).isTrue();
            assertThat(record.outcomesAgree()).isFalse();
            assertThat(fx.registry.get("bastion.validation.discrepancies").tag("type", "security").counter().count())
                    .isEqualTo(1.0);
            assertThat(fx.registry.get("bastion.validation.cross_tenant_blocks").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an enhanced validator that throws is recorded as INTERNAL_FAULT")
        void enhancedThrows() {
            CredentialValidator broken = mockEnhanced();
            when(broken.validate(any())).thenThrow(new IllegalStateException("boom"));
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            GatewayDecision decision = fx.orchestrator(fx.legacy, broken)
                    .orchestrate(fx.request(key, "tenant-a", "orders"));

            assertThat(decision.allowed()).isTrue();
            assertThat(onlyRecord().enhanced().errorKind()).isEqualTo(ErrorKind.INTERNAL_FAULT);
        }

        @Test
        @DisplayName("an enhanced validator that hangs is cut off at its deadline")
        void enhancedHangs() {
            CredentialValidator hanging = mockEnhanced();
            when(hanging.validate(any())).thenAnswer(invocation -> {
                Thread.sleep(10_000);
                return null;
            });
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            long started = System.nanoTime();
            GatewayDecision decision = fx.orchestrator(fx.legacy, hanging)
                    .orchestrate(fx.request(key, "tenant-a", "orders"));
            Duration took = Duration.ofNanos(System.nanoTime() - started);

            assertThat(decision.allowed()).isTrue();
            assertThat(took).isLessThan(Duration.ofSeconds(2));
            ComparisonRecord record = onlyRecord();
            assertThat(record.enhanced().errorKind()).isEqualTo(ErrorKind.VALIDATOR_TIMEOUT);
            assertThat(record.legacy().success()).isTrue();
        }

        @Test
        @DisplayName("a legacy denial is what the caller sees even when enhanced allows")
        void legacyDenialWins() {
            CredentialValidator legacyDenies = mock(CredentialValidator.class);
            when(legacyDenies.name()).thenReturn(ValidatorName.LEGACY);
            when(legacyDenies.validate(any())).thenReturn(ValidationOutcome.failure(
                    ValidatorName.LEGACY, ErrorKind.TENANT_INACTIVE, Duration.ofMillis(3), null));
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            GatewayDecision decision = fx.orchestrator(legacyDenies, fx.enhanced)
                    .orchestrate(fx.request(key, "tenant-a", "orders"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.context()).isNull();
            assertThat(decision.error().errorCode()).isEqualTo("TENANT_INACTIVE_001");
            assertThat(onlyRecord().userFacingCategory()).isEqualTo(UserFacingCategory.ACCESS_DENIED);
        }

        @Test
        @DisplayName("a legacy timeout surfaces as temporarily unavailable")
        void legacyTimeout() {
            fx.store.setLatency(Duration.ofMillis(800));
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            GatewayDecision decision = fx.orchestrator().orchestrate(fx.request(key, "tenant-a", "orders"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.error().category()).isEqualTo(UserFacingCategory.TEMPORARILY_UNAVAILABLE);
            assertThat(decision.error().errorCode()).isEqualTo("TIMEOUT_001");
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("with parallel validation disabled only the source of truth runs")
        void parallelDisabled() throws InterruptedException {
            var settings = new GatewaySettings(false, SelectionPolicy.SHADOW, Duration.ofMillis(500),
                    Duration.ofMillis(100));
            try (EngineFixture local = new EngineFixture(settings, ExtensionPolicy.DEFAULTS, ResourcePolicy.open(),
                    RiskSettings.DEFAULTS)) {
                CredentialValidator enhanced = mockEnhanced();
                String key = local.apiKey("tenant-a", AccessLevel.WRITE);

                GatewayDecision decision = local.orchestrator(local.legacy, enhanced)
                        .orchestrate(local.request(key, "tenant-a", "orders"));

                assertThat(decision.allowed()).isTrue();
                verify(enhanced, never()).validate(any());
                ComparisonRecord record = local.sink.queryWindow(EngineFixture.NOW, EngineFixture.NOW.plusSeconds(1))
                        .get(0);
                assertThat(record.shadowSkipped()).isTrue();
                assertThat(record.enhanced()).isNull();
                assertThat(record.outcomesAgree()).isFalse();
            }
        }

        @Test
        @DisplayName("once promoted, the enhanced outcome is caller-visible")
        void enhancedPromoted() throws InterruptedException {
            var settings = new GatewaySettings(true, new SelectionPolicy(2, SourceOfTruth.ENHANCED),
                    Duration.ofMillis(500), Duration.ofMillis(500));
            try (EngineFixture local = new EngineFixture(settings, ExtensionPolicy.DEFAULTS, ResourcePolicy.open(),
                    RiskSettings.DEFAULTS)) {
                String key = local.apiKey("tenant-a", AccessLevel.WRITE);

                GatewayDecision decision = local.orchestrator().orchestrate(local.request(key, "tenant-b", "orders"));

                assertThat(decision.allowed()).isFalse();
                assertThat(decision.decidedBy()).isEqualTo(SourceOfTruth.ENHANCED);
                assertThat(decision.error().message()).isEqualTo("Resource not found");
                ComparisonRecord record = local.sink.queryWindow(EngineFixture.NOW, EngineFixture.NOW.plusSeconds(1))
                        .get(0);
                assertThat(record.selectionPolicyVersion()).isEqualTo(2);
                assertThat(record.sourceOfTruth()).isEqualTo(SourceOfTruth.ENHANCED);
            }
        }

        @Test
        @DisplayName("a saturated validator pool still answers from legacy")
        void saturatedPool() {
            ExecutorService closed = Executors.newSingleThreadExecutor();
            closed.shutdown();
            var orchestrator = new ParallelValidationOrchestrator(fx.legacy, fx.enhanced, fx.translator,
                    fx.recorder, closed, SHORT_DEADLINES, fx.metrics, SpanHelper.noop(), fx.clock);
            String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

            GatewayDecision decision = orchestrator.orchestrate(fx.request(key, "tenant-a", "orders"));

            assertThat(decision.allowed()).isTrue();
            assertThat(onlyRecord().enhanced().errorKind()).isEqualTo(ErrorKind.INTERNAL_FAULT);
        }

        @Test
        @DisplayName("a legacy run rejected by the pool starts only after enhanced was submitted")
        void rejectedLegacyRunsAfterEnhancedSubmit() {
            ExecutorService rejectFirst = new RejectFirstExecutor();
            try {
                CountDownLatch enhancedStarted = new CountDownLatch(1);
                AtomicBoolean enhancedRanFirst = new AtomicBoolean();
                CredentialValidator legacy = mockLegacy();
                when(legacy.validate(any())).thenAnswer(invocation -> {
                    enhancedRanFirst.set(enhancedStarted.await(1, TimeUnit.SECONDS));
                    return fx.legacy.validate(invocation.<ValidationRequest>getArgument(0));
                });
                CredentialValidator enhanced = mockEnhanced();
                when(enhanced.validate(any())).thenAnswer(invocation -> {
                    enhancedStarted.countDown();
                    return fx.enhanced.validate(invocation.getArgument(0));
                });
                var settings = new GatewaySettings(true, SelectionPolicy.SHADOW, Duration.ofSeconds(2),
                        Duration.ofSeconds(2));
                var orchestrator = new ParallelValidationOrchestrator(legacy, enhanced, fx.translator, fx.recorder,
                        rejectFirst, settings, fx.metrics, SpanHelper.noop(), fx.clock);
                String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

                GatewayDecision decision = orchestrator.orchestrate(fx.request(key, "tenant-a", "orders"));

                assertThat(decision.allowed()).isTrue();
                assertThat(enhancedRanFirst).isTrue();
                ComparisonRecord record = onlyRecord();
                assertThat(record.legacy().success()).isTrue();
                assertThat(record.enhanced().success()).isTrue();
            } finally {
                rejectFirst.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("times both validators by outcome")
    void durationMetrics() {
        String key = fx.apiKey("tenant-a", AccessLevel.WRITE);

        fx.orchestrator().orchestrate(fx.request(key, "tenant-a", "orders"));

        assertThat(fx.registry.get("bastion.validation.duration").tag("validator", "legacy")
                .tag("outcome", "allowed").timer().count()).isEqualTo(1);
        assertThat(fx.registry.get("bastion.validation.duration").tag("validator", "enhanced")
                .tag("outcome", "allowed").timer().count()).isEqualTo(1);
    }
}
