package com.bastion.validation;

import com.bastion.security.ValidationContext;
import com.bastion.validation.store.CredentialRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes and refines the risk score carried by a {@link ValidationContext}.
 *
 * <p>Stateless and thread-safe.
 */
public class RiskScorer {

    private final RiskSettings settings;

    public RiskScorer(RiskSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    /**
     * Initial score at resolution time: a weighted blend of the consumed lifetime fraction and the
     * saturated failure count. A store that does not track failures contributes
     * {@link ValidationContext#NEUTRAL_RISK} for that signal only; the score itself is neutral only
     * when both weights are zero.
     */
    public double initialScore(CredentialRecord record, Instant now) {
        double failureSignal = record.priorFailures() == null
                ? ValidationContext.NEUTRAL_RISK
                : Math.min(1.0, record.priorFailures() / (double) settings.failureSaturation());
        double weighted = settings.ageWeight() * ageFraction(record, now) + settings.failureWeight() * failureSignal;
        double totalWeight = settings.ageWeight() + settings.failureWeight();
        return totalWeight == 0.0 ? ValidationContext.NEUTRAL_RISK : clamp(weighted / totalWeight);
    }

    /**
     * Adds resource sensitivity and requested-access weights. When the refined score exceeds the
     * ceiling the access level is degraded one step. Refinement never fails a request by itself.
     */
    public ValidationContext refine(ValidationContext context, ResourcePolicy.Requirement requirement) {
        double accessSignal = requirement.requiredLevel().ordinal() / 2.0;
        double score = clamp(context.riskScore()
                + settings.resourceSensitivityWeight() * requirement.sensitivity()
                + settings.requestedAccessWeight() * accessSignal);

        ValidationContext refined = context.withRiskScore(score);
        if (score > settings.riskCeiling()) {
            refined = refined.withAccessLevel(context.accessLevel().degrade());
        }
        return refined;
    }

    public RiskSettings settings() {
        return settings;
    }

    private static double ageFraction(CredentialRecord record, Instant now) {
        Duration lifetime = Duration.between(record.issuedAt(), record.expiresAt());
        if (lifetime.isZero() || lifetime.isNegative()) {
            return 1.0;
        }
        Duration age = Duration.between(record.issuedAt(), now);
        return clamp(age.toMillis() / (double) lifetime.toMillis());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
