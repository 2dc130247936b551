package com.bastion.validation.readiness;

import com.bastion.audit.CacheStatus;
import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.ComparisonRecordValidator;
import com.bastion.audit.SourceOfTruth;
import com.bastion.audit.ValidationOutcome;
import com.bastion.security.AccessLevel;
import com.bastion.validation.ExtensionStats;
import com.bastion.validation.audit.AuditSink;
import com.bastion.validation.translation.TranslationCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Aggregates comparison records into a {@link ReadinessSnapshot}. Read-only.
 *
 * <p>Extension success and translation coverage are not recoverable from records alone and
 * come from the live services through the supplied views.
 */
public class ReadinessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReadinessEvaluator.class);

    private final AuditSink sink;
    private final SuccessCriteriaTargets targets;
    private final Supplier<ExtensionStats> extensionStats;
    private final Supplier<TranslationCoverage> translationCoverage;

    public ReadinessEvaluator(AuditSink sink, SuccessCriteriaTargets targets,
                              Supplier<ExtensionStats> extensionStats,
                              Supplier<TranslationCoverage> translationCoverage) {
        if (sink == null || targets == null || extensionStats == null || translationCoverage == null) {
            throw new IllegalArgumentException("sink, targets, extensionStats and translationCoverage must not be null");
        }
        this.sink = sink;
        this.targets = targets;
        this.extensionStats = extensionStats;
        this.translationCoverage = translationCoverage;
    }

    public ReadinessSnapshot evaluate(Instant start, Instant end) {
        return evaluate(start, end, sink.queryWindow(start, end));
    }

    ReadinessSnapshot evaluate(Instant start, Instant end, List<ComparisonRecord> windowRecords) {
        List<ComparisonRecord> records = dedupe(windowRecords);

        Map<SuccessCriterion, CriterionResult> criteria = new EnumMap<>(SuccessCriterion.class);
        put(criteria, SuccessCriterion.ZERO_USER_DISRUPTION, disruptionFree(records));
        put(criteria, SuccessCriterion.ENHANCED_VALIDATION_SUCCESS, enhancedSuccess(records));
        put(criteria, SuccessCriterion.PERFORMANCE_IMPROVEMENT, performanceImprovement(records));
        put(criteria, SuccessCriterion.COMPLETE_LOGGING, completeLogging(records));
        put(criteria, SuccessCriterion.CROSS_TENANT_PROTECTION, crossTenantProtection(records));
        put(criteria, SuccessCriterion.TOKEN_EXTENSION_SUCCESS, extensionStats.get().successPercent());
        put(criteria, SuccessCriterion.ERROR_TRANSLATION_COVERAGE, translationCoverage.get().mappedPercent());

        boolean ready = !records.isEmpty() && criteria.values().stream().allMatch(CriterionResult::passed);
        long blocks = records.stream().filter(ComparisonRecord::crossTenantBlockTriggered).count();
        long discrepancies = records.stream().filter(ComparisonRecord::securityDiscrepancy).count();

        ReadinessSnapshot snapshot = new ReadinessSnapshot(start, end, records.size(), cacheHitRate(records),
                averageDelta(records), blocks, discrepancies, Collections.unmodifiableMap(criteria), ready);
        log.info("Readiness over [{}, {}): {} records, ready={}", start, end, records.size(), ready);
        return snapshot;
    }

    private void put(Map<SuccessCriterion, CriterionResult> criteria, SuccessCriterion criterion, double actual) {
        criteria.put(criterion, CriterionResult.of(criterion, targets.target(criterion), actual));
    }

    private static List<ComparisonRecord> dedupe(List<ComparisonRecord> records) {
        Map<String, ComparisonRecord> byRequest = new LinkedHashMap<>();
        for (ComparisonRecord record : records) {
            byRequest.putIfAbsent(record.requestId(), record);
        }
        return List.copyOf(byRequest.values());
    }

    private static double disruptionFree(List<ComparisonRecord> records) {
        List<ComparisonRecord> legacyDecided = records.stream()
                .filter(r -> r.sourceOfTruth() == SourceOfTruth.LEGACY && r.legacy() != null)
                .toList();
        if (legacyDecided.isEmpty()) {
            return 100.0;
        }
        long matching = legacyDecided.stream()
                .filter(r -> r.callerVisibleAllowed() == r.legacy().success())
                .count();
        return percent(matching, legacyDecided.size());
    }

    private static double enhancedSuccess(List<ComparisonRecord> records) {
        List<ValidationOutcome> runs = records.stream()
                .map(ComparisonRecord::enhanced)
                .filter(o -> o != null)
                .toList();
        if (runs.isEmpty()) {
            return 0.0;
        }
        long completed = runs.stream().filter(o -> o.success() || !o.errorKind().fault()).count();
        return percent(completed, runs.size());
    }

    private static double performanceImprovement(List<ComparisonRecord> records) {
        List<ComparisonRecord> paired = records.stream().filter(ComparisonRecord::bothRan).toList();
        if (paired.isEmpty()) {
            return 0.0;
        }
        double legacyMean = paired.stream().mapToDouble(r -> r.legacy().durationMillis()).average().orElse(0.0);
        double enhancedMean = paired.stream().mapToDouble(r -> r.enhanced().durationMillis()).average().orElse(0.0);
        if (legacyMean <= 0.0) {
            return 0.0;
        }
        return (legacyMean - enhancedMean) * 100.0 / legacyMean;
    }

    private static double completeLogging(List<ComparisonRecord> records) {
        if (records.isEmpty()) {
            return 0.0;
        }
        long complete = records.stream().filter(r -> ComparisonRecordValidator.validate(r).valid()).count();
        return percent(complete, records.size());
    }

    /**
     * A cross-tenant attempt is a request whose resolved tenant (by either validator) differs
     * from the requested tenant for a non-admin credential. Vacuously 100 without attempts.
     */
    private static double crossTenantProtection(List<ComparisonRecord> records) {
        List<ComparisonRecord> attempts = records.stream()
                .filter(r -> r.enhanced() != null)
                .filter(r -> r.crossTenantBlockTriggered() || crossTenantGrant(r.legacy(), r.requestedTenant())
                        || crossTenantGrant(r.enhanced(), r.requestedTenant()))
                .toList();
        if (attempts.isEmpty()) {
            return 100.0;
        }
        long blocked = attempts.stream().filter(ComparisonRecord::crossTenantBlockTriggered).count();
        return percent(blocked, attempts.size());
    }

    private static boolean crossTenantGrant(ValidationOutcome outcome, String requestedTenant) {
        return outcome != null && outcome.success()
                && outcome.context().accessLevel() != AccessLevel.ADMIN
                && !outcome.context().tenantId().equals(requestedTenant);
    }

    private static double cacheHitRate(List<ComparisonRecord> records) {
        long hits = 0;
        long lookups = 0;
        for (ComparisonRecord record : records) {
            if (record.enhanced() == null || record.enhanced().cacheStatus() == CacheStatus.NOT_APPLICABLE) {
                continue;
            }
            lookups++;
            if (record.enhanced().cacheStatus() == CacheStatus.HIT) {
                hits++;
            }
        }
        return lookups == 0 ? 0.0 : percent(hits, lookups);
    }

    private static double averageDelta(List<ComparisonRecord> records) {
        return records.stream()
                .filter(ComparisonRecord::bothRan)
                .mapToDouble(ComparisonRecord::performanceDeltaMillis)
                .average()
                .orElse(0.0);
    }

    private static double percent(long part, long whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }
}
