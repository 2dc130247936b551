package com.bastion.audit;

import java.time.Instant;

/**
 * Durable evidence of one request's side-by-side validation.
 *
 * <p>Records are append-only and never mutated. Derived fields are computed once by
 * {@link #of} and stored alongside the raw outcomes so readers of the audit log do not need to
 * re-derive them. When the shadow validator did not run ({@code shadowSkipped}), the outcome of
 * the validator that did not run is null.
 *
 * @param requestId                 unique id of the request (deduplication key)
 * @param recordedAt                when the record was built
 * @param requestedTenant           tenant the caller asked to act on
 * @param requestedResource         resource the caller asked to access
 * @param credentialFingerprint     fingerprint of the presented credential, never the raw value
 * @param legacy                    legacy validator outcome
 * @param enhanced                  enhanced validator outcome
 * @param shadowSkipped             true when parallel validation was disabled for this request
 * @param sourceOfTruth             which outcome the caller saw
 * @param selectionPolicyVersion    version of the selection policy in force
 * @param callerVisibleAllowed      the decision returned to the caller
 * @param userFacingCategory        category of the error returned to the caller, null when allowed
 * @param outcomesAgree             both succeeded with the same grant, or both failed
 * @param performanceDeltaMillis    legacy minus enhanced duration; positive means enhanced was faster
 * @param enhancedFaster            convenience flag for a positive delta
 * @param crossTenantBlockTriggered enhanced blocked a cross-tenant request
 * @param securityDiscrepancy       enhanced blocked cross-tenant while legacy allowed the request
 * @param extensionApplied          enhanced extended the credential
 */
public record ComparisonRecord(
        String requestId,
        Instant recordedAt,
        String requestedTenant,
        String requestedResource,
        String credentialFingerprint,
        ValidationOutcome legacy,
        ValidationOutcome enhanced,
        boolean shadowSkipped,
        SourceOfTruth sourceOfTruth,
        int selectionPolicyVersion,
        boolean callerVisibleAllowed,
        UserFacingCategory userFacingCategory,
        boolean outcomesAgree,
        double performanceDeltaMillis,
        boolean enhancedFaster,
        boolean crossTenantBlockTriggered,
        boolean securityDiscrepancy,
        boolean extensionApplied) {

    /**
     * Builds a record and computes its derived fields.
     */
    public static ComparisonRecord of(String requestId,
                                      Instant recordedAt,
                                      String requestedTenant,
                                      String requestedResource,
                                      String credentialFingerprint,
                                      ValidationOutcome legacy,
                                      ValidationOutcome enhanced,
                                      SourceOfTruth sourceOfTruth,
                                      int selectionPolicyVersion,
                                      boolean callerVisibleAllowed,
                                      UserFacingCategory userFacingCategory) {
        boolean bothRan = legacy != null && enhanced != null;
        boolean agree = bothRan && legacy.agreesWith(enhanced);
        double delta = bothRan ? legacy.durationMillis() - enhanced.durationMillis() : 0.0;
        boolean blocked = enhanced != null && enhanced.crossTenantBlockTriggered();
        boolean discrepancy = blocked && legacy != null && legacy.success();
        boolean extended = enhanced != null && enhanced.extensionApplied();

        return new ComparisonRecord(requestId, recordedAt, requestedTenant, requestedResource,
                credentialFingerprint, legacy, enhanced, !bothRan, sourceOfTruth, selectionPolicyVersion,
                callerVisibleAllowed, userFacingCategory, agree, delta, delta > 0, blocked, discrepancy,
                extended);
    }

    /** The outcome of the validator that was the source of truth. */
    public ValidationOutcome selectedOutcome() {
        return sourceOfTruth == SourceOfTruth.ENHANCED ? enhanced : legacy;
    }

    /** True when both validators ran for this request. */
    public boolean bothRan() {
        return legacy != null && enhanced != null;
    }
}
