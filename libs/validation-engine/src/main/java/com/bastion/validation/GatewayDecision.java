package com.bastion.validation;

import com.bastion.audit.SourceOfTruth;
import com.bastion.security.ValidationContext;
import com.bastion.validation.translation.UserFacingError;

/**
 * What the caller gets back for one request.
 *
 * @param requestId       id of the request, also the key of its comparison record
 * @param allowed         whether the request may proceed
 * @param context         resolved identity (allowed only)
 * @param error           user-facing error (denied only)
 * @param decidedBy       whose outcome this is
 */
public record GatewayDecision(String requestId, boolean allowed, ValidationContext context, UserFacingError error,
                              SourceOfTruth decidedBy) {

    public GatewayDecision {
        if (allowed && context == null) {
            throw new IllegalArgumentException("an allowed decision carries a context");
        }
        if (!allowed && error == null) {
            throw new IllegalArgumentException("a denied decision carries a user-facing error");
        }
    }
}
