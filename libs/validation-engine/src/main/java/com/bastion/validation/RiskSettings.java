package com.bastion.validation;

/**
 * Weights for {@link RiskScorer}. All weights are in [0.0, 1.0].
 *
 * @param ageWeight                  weight of the credential's consumed lifetime fraction
 * @param failureWeight              weight of the prior failure signal
 * @param failureSaturation          failure count at which the failure signal saturates to 1.0
 * @param resourceSensitivityWeight  weight of the requested resource's sensitivity
 * @param requestedAccessWeight      weight of the access level the resource requires
 * @param riskCeiling                scores above this degrade the granted access level one step
 */
public record RiskSettings(
        double ageWeight,
        double failureWeight,
        int failureSaturation,
        double resourceSensitivityWeight,
        double requestedAccessWeight,
        double riskCeiling) {

    public static final RiskSettings DEFAULTS = new RiskSettings(0.4, 0.6, 5, 0.2, 0.1, 0.8);

    public RiskSettings {
        requireUnit("ageWeight", ageWeight);
        requireUnit("failureWeight", failureWeight);
        requireUnit("resourceSensitivityWeight", resourceSensitivityWeight);
        requireUnit("requestedAccessWeight", requestedAccessWeight);
        requireUnit("riskCeiling", riskCeiling);
        if (failureSaturation < 1) {
            throw new IllegalArgumentException("failureSaturation must be >= 1");
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0.0, 1.0] but was " + value);
        }
    }
}
