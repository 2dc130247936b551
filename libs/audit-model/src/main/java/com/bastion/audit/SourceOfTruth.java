package com.bastion.audit;

/**
 * Which validator's outcome determines the caller-visible decision.
 */
public enum SourceOfTruth {
    LEGACY,
    ENHANCED;

    public ValidatorName validator() {
        return this == LEGACY ? ValidatorName.LEGACY : ValidatorName.ENHANCED;
    }
}
