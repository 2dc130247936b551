package com.bastion.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a {@link ComparisonRecord} carries everything a reviewer needs.
 *
 * <p>A record that fails here does not count as "completely logged" when rollout readiness is
 * evaluated. All problems are collected in one pass.
 */
public final class ComparisonRecordValidator {

    private ComparisonRecordValidator() {
        // utility class
    }

    public static RecordValidationResult validate(ComparisonRecord record) {
        if (record == null) {
            return RecordValidationResult.fail(List.of("record must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(record.requestId())) {
            errors.add("requestId must not be null or blank");
        }
        if (record.recordedAt() == null) {
            errors.add("recordedAt must not be null");
        }
        if (isBlank(record.requestedTenant())) {
            errors.add("requestedTenant must not be null or blank");
        }
        if (isBlank(record.credentialFingerprint())) {
            errors.add("credentialFingerprint must not be null or blank");
        }
        if (record.sourceOfTruth() == null) {
            errors.add("sourceOfTruth must not be null");
        } else if (record.selectedOutcome() == null) {
            errors.add("outcome of the source of truth (" + record.sourceOfTruth() + ") is missing");
        }
        if (record.selectionPolicyVersion() < 1) {
            errors.add("selectionPolicyVersion must be >= 1");
        }
        if (!record.shadowSkipped() && !record.bothRan()) {
            errors.add("both outcomes are required unless the shadow validator was skipped");
        }
        checkOutcome("legacy", record.legacy(), ValidatorName.LEGACY, errors);
        checkOutcome("enhanced", record.enhanced(), ValidatorName.ENHANCED, errors);
        if (!record.callerVisibleAllowed() && record.userFacingCategory() == null) {
            errors.add("userFacingCategory must be set when the request was denied");
        }
        if (record.bothRan() && record.outcomesAgree() != record.legacy().agreesWith(record.enhanced())) {
            errors.add("outcomesAgree is inconsistent with the recorded outcomes");
        }

        return errors.isEmpty() ? RecordValidationResult.ok() : RecordValidationResult.fail(errors);
    }

    private static void checkOutcome(String field, ValidationOutcome outcome, ValidatorName expected,
                                     List<String> errors) {
        if (outcome != null && outcome.validator() != expected) {
            errors.add(field + " outcome was produced by " + outcome.validator());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
