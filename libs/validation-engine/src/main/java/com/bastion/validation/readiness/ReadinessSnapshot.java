package com.bastion.validation.readiness;

import java.time.Instant;
import java.util.Map;

/**
 * Rollout readiness over one time window.
 *
 * @param windowStart                   inclusive start
 * @param windowEnd                     exclusive end
 * @param recordCount                   comparison records in the window, one per request
 * @param cacheHitRatePercent           enhanced cache hits over enhanced cache lookups
 * @param averagePerformanceDeltaMillis mean of legacy minus enhanced duration where both ran
 * @param crossTenantBlocks             requests the enhanced validator blocked as cross-tenant
 * @param securityDiscrepancies         cross-tenant blocks where legacy allowed the request
 * @param criteria                      one result per criterion, in declaration order
 * @param readyForPromotion             at least one record and every criterion passed
 */
public record ReadinessSnapshot(
        Instant windowStart,
        Instant windowEnd,
        int recordCount,
        double cacheHitRatePercent,
        double averagePerformanceDeltaMillis,
        long crossTenantBlocks,
        long securityDiscrepancies,
        Map<SuccessCriterion, CriterionResult> criteria,
        boolean readyForPromotion) {

    public CriterionResult result(SuccessCriterion criterion) {
        return criteria.get(criterion);
    }
}
