package com.bastion.validation;

/**
 * Per-request lifecycle of {@link ParallelValidationOrchestrator}.
 */
public enum OrchestrationState {
    START,
    RUNNING_BOTH,
    SELECTING,
    RECORDING,
    DONE
}
