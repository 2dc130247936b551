package com.bastion.validation.readiness;

/**
 * Target percentages for each {@link SuccessCriterion}.
 */
public record SuccessCriteriaTargets(
        double zeroUserDisruption,
        double enhancedValidationSuccess,
        double performanceImprovement,
        double completeLogging,
        double crossTenantProtection,
        double tokenExtensionSuccess,
        double errorTranslationCoverage) {

    public static final SuccessCriteriaTargets DEFAULTS =
            new SuccessCriteriaTargets(100, 95, 20, 100, 100, 90, 100);

    public double target(SuccessCriterion criterion) {
        return switch (criterion) {
            case ZERO_USER_DISRUPTION -> zeroUserDisruption;
            case ENHANCED_VALIDATION_SUCCESS -> enhancedValidationSuccess;
            case PERFORMANCE_IMPROVEMENT -> performanceImprovement;
            case COMPLETE_LOGGING -> completeLogging;
            case CROSS_TENANT_PROTECTION -> crossTenantProtection;
            case TOKEN_EXTENSION_SUCCESS -> tokenExtensionSuccess;
            case ERROR_TRANSLATION_COVERAGE -> errorTranslationCoverage;
        };
    }
}
