package com.bastion.audit;

import java.util.List;

/**
 * Result of checking a {@link ComparisonRecord} for completeness.
 *
 * @param valid  true if the record is complete and internally consistent
 * @param errors human-readable problems (empty when valid)
 */
public record RecordValidationResult(boolean valid, List<String> errors) {

    public static RecordValidationResult ok() {
        return new RecordValidationResult(true, List.of());
    }

    public static RecordValidationResult fail(List<String> errors) {
        return new RecordValidationResult(false, List.copyOf(errors));
    }
}
