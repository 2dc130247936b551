package com.bastion.validation.readiness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.bastion.audit.CacheStatus;
import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.UserFacingCategory;
import com.bastion.validation.ExtensionStats;
import com.bastion.validation.audit.InMemoryAuditSink;
import com.bastion.validation.testing.RecordFixtures;
import com.bastion.validation.translation.ErrorTranslationService;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReadinessEvaluator")
class ReadinessEvaluatorTest {

    private static final Instant T0 = RecordFixtures.START;
    private static final Instant T1 = T0.plusSeconds(3600);

    private final InMemoryAuditSink sink = new InMemoryAuditSink();
    private final AtomicReference<ExtensionStats> extensionStats =
            new AtomicReference<>(new ExtensionStats(0, 0, 0, 0, 0));
    private final ErrorTranslationService translator = ErrorTranslationService.withDefaults();
    private final ReadinessEvaluator evaluator = new ReadinessEvaluator(sink, SuccessCriteriaTargets.DEFAULTS,
            extensionStats::get, translator::coverage);

    private void append(ComparisonRecord... records) {
        for (ComparisonRecord record : records) {
            sink.appendComparisonRecord(record);
        }
    }

    @Test
    @DisplayName("an empty window is never ready")
    void emptyWindow() {
        ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

        assertThat(snapshot.recordCount()).isZero();
        assertThat(snapshot.readyForPromotion()).isFalse();
        assertThat(snapshot.result(SuccessCriterion.ZERO_USER_DISRUPTION).passed()).isTrue();
        assertThat(snapshot.result(SuccessCriterion.ENHANCED_VALIDATION_SUCCESS).actual()).isZero();
        assertThat(snapshot.criteria()).hasSize(SuccessCriterion.values().length);
    }

    @Test
    @DisplayName("a clean window with a faster enhanced path is ready")
    void readyWindow() {
        append(RecordFixtures.agreeing("r1", T0.plusSeconds(1)),
                RecordFixtures.agreeing("r2", T0.plusSeconds(2), CacheStatus.HIT),
                RecordFixtures.crossTenantBlocked("r3", T0.plusSeconds(3)),
                RecordFixtures.bothDenied("r4", T0.plusSeconds(4)));

        ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

        assertThat(snapshot.readyForPromotion()).isTrue();
        assertThat(snapshot.recordCount()).isEqualTo(4);
        assertThat(snapshot.crossTenantBlocks()).isEqualTo(1);
        assertThat(snapshot.securityDiscrepancies()).isEqualTo(1);
        assertThat(snapshot.cacheHitRatePercent()).isEqualTo(25.0);
        assertThat(snapshot.result(SuccessCriterion.CROSS_TENANT_PROTECTION).actual()).isEqualTo(100.0);
        assertThat(snapshot.criteria().values()).allMatch(CriterionResult::passed);
    }

    @Nested
    @DisplayName("criteria")
    class Criteria {

        @Test
        @DisplayName("performance improvement compares mean durations where both ran")
        void performance() {
            // legacy 40/40/30 ms, enhanced 25/20/10 ms
            append(RecordFixtures.agreeing("r1", T0), RecordFixtures.crossTenantBlocked("r2", T0),
                    RecordFixtures.bothDenied("r3", T0));

            ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

            double legacyMean = (40 + 40 + 30) / 3.0;
            double enhancedMean = (25 + 20 + 10) / 3.0;
            assertThat(snapshot.result(SuccessCriterion.PERFORMANCE_IMPROVEMENT).actual())
                    .isCloseTo((legacyMean - enhancedMean) * 100.0 / legacyMean, within(1e-9));
            assertThat(snapshot.averagePerformanceDeltaMillis()).isCloseTo(55.0 / 3.0, within(1e-9));
        }

        @Test
        @DisplayName("enhanced faults and timeouts lower enhanced validation success")
        void enhancedSuccess() {
            append(RecordFixtures.agreeing("r1", T0), RecordFixtures.enhancedTimedOut("r2", T0));

            ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

            assertThat(snapshot.result(SuccessCriterion.ENHANCED_VALIDATION_SUCCESS).actual()).isEqualTo(50.0);
            assertThat(snapshot.readyForPromotion()).isFalse();
        }

        @Test
        @DisplayName("an unblocked cross-tenant grant fails cross-tenant protection")
        void unblockedCrossTenant() {
            append(RecordFixtures.crossTenantBlocked("r1", T0), RecordFixtures.crossTenantUnblocked("r2", T0));

            CriterionResult result = evaluator.evaluate(T0, T1).result(SuccessCriterion.CROSS_TENANT_PROTECTION);

            assertThat(result.actual()).isEqualTo(50.0);
            assertThat(result.passed()).isFalse();
        }

        @Test
        @DisplayName("admin access across tenants is not an attempt")
        void adminIsNotAnAttempt() {
            append(RecordFixtures.adminAcrossTenants("r1", T0));

            assertThat(evaluator.evaluate(T0, T1).result(SuccessCriterion.CROSS_TENANT_PROTECTION).actual())
                    .isEqualTo(100.0);
        }

        @Test
        @DisplayName("a caller decision that diverges from legacy counts as disruption")
        void disruption() {
            ComparisonRecord agreeing = RecordFixtures.agreeing("r1", T0);
            ComparisonRecord diverging = new ComparisonRecord("r2", T0, "tenant-a", "orders",
                    RecordFixtures.FINGERPRINT, agreeing.legacy(), agreeing.enhanced(), false,
                    agreeing.sourceOfTruth(), 1, false, UserFacingCategory.ACCESS_DENIED,
                    true, 15.0, true, false, false, false);

            ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1, List.of(agreeing, diverging));

            assertThat(snapshot.result(SuccessCriterion.ZERO_USER_DISRUPTION).actual()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("structurally incomplete records fail complete logging")
        void incompleteLogging() {
            ComparisonRecord valid = RecordFixtures.agreeing("r1", T0);
            ComparisonRecord notSkipped = new ComparisonRecord("r2", T0, "tenant-a", "orders",
                    RecordFixtures.FINGERPRINT, valid.legacy(), null, false, valid.sourceOfTruth(), 1, true, null,
                    false, 0.0, false, false, false, false);

            ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1, List.of(valid, notSkipped));

            assertThat(snapshot.result(SuccessCriterion.COMPLETE_LOGGING).actual()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("extension success and translation coverage come from the live services")
        void suppliedCriteria() {
            append(RecordFixtures.agreeing("r1", T0));
            extensionStats.set(new ExtensionStats(10, 7, 1, 0, 2));

            ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

            assertThat(snapshot.result(SuccessCriterion.TOKEN_EXTENSION_SUCCESS).actual()).isEqualTo(80.0);
            assertThat(snapshot.result(SuccessCriterion.TOKEN_EXTENSION_SUCCESS).passed()).isFalse();
            assertThat(snapshot.result(SuccessCriterion.ERROR_TRANSLATION_COVERAGE).actual()).isEqualTo(100.0);
        }
    }

    @Test
    @DisplayName("only records inside the window count")
    void windowed() {
        append(RecordFixtures.enhancedTimedOut("old", T0.minusSeconds(1)), RecordFixtures.agreeing("r1", T0));

        ReadinessSnapshot snapshot = evaluator.evaluate(T0, T1);

        assertThat(snapshot.recordCount()).isEqualTo(1);
        assertThat(snapshot.readyForPromotion()).isTrue();
    }
}
