package com.bastion.validation.readiness;

/**
 * Conditions that must all hold before the enhanced validator may become the source of truth.
 * Every actual value and target is a percentage.
 */
public enum SuccessCriterion {

    ZERO_USER_DISRUPTION("Zero user disruption",
            "caller-visible decisions that matched the legacy outcome while legacy decided"),
    ENHANCED_VALIDATION_SUCCESS("Enhanced validation success",
            "enhanced runs that completed without an internal fault or timeout"),
    PERFORMANCE_IMPROVEMENT("Performance improvement",
            "reduction of mean enhanced duration relative to mean legacy duration"),
    COMPLETE_LOGGING("Complete logging",
            "comparison records that pass structural validation"),
    CROSS_TENANT_PROTECTION("Cross-tenant protection",
            "cross-tenant attempts blocked by the enhanced validator"),
    TOKEN_EXTENSION_SUCCESS("Token extension success",
            "due extensions that left the credential extended"),
    ERROR_TRANSLATION_COVERAGE("Error translation coverage",
            "error kinds with a user-facing translation");

    private final String title;
    private final String measures;

    SuccessCriterion(String title, String measures) {
        this.title = title;
        this.measures = measures;
    }

    public String title() {
        return title;
    }

    public String measures() {
        return measures;
    }
}
