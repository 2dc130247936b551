package com.bastion.validation;

import com.bastion.validation.audit.RecorderStats;
import com.bastion.validation.cache.CacheStats;
import com.bastion.validation.translation.TranslationCoverage;

/**
 * Operational counters of one gateway instance.
 */
public record GatewayMetricsSnapshot(
        long requestsProcessed,
        boolean parallelEnabled,
        SelectionPolicy selectionPolicy,
        CacheStats cache,
        TranslationCoverage translation,
        RecorderStats audit,
        ExtensionStats extensions) {
}
