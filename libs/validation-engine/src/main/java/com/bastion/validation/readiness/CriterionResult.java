package com.bastion.validation.readiness;

/**
 * Evaluation of one {@link SuccessCriterion}.
 *
 * @param criterion the criterion
 * @param target    minimum percentage required
 * @param actual    measured percentage
 * @param passed    {@code actual >= target}
 */
public record CriterionResult(SuccessCriterion criterion, double target, double actual, boolean passed) {

    public static CriterionResult of(SuccessCriterion criterion, double target, double actual) {
        return new CriterionResult(criterion, target, actual, actual >= target);
    }
}
