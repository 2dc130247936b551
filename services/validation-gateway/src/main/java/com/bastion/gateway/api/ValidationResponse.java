package com.bastion.gateway.api;

import com.bastion.audit.SourceOfTruth;
import com.bastion.audit.UserFacingCategory;
import com.bastion.security.AccessLevel;
import com.bastion.security.ValidationContext;
import com.bastion.validation.GatewayDecision;
import com.bastion.validation.translation.UserFacingError;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response of {@code POST /api/v1/validate}. Exactly one of {@code identity} and {@code error}
 * is present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(String requestId, boolean allowed, SourceOfTruth decidedBy, Identity identity,
                                 Error error) {

    public record Identity(String tenantId, String userId, AccessLevel accessLevel, String expiresAt) {
    }

    public record Error(UserFacingCategory category, String message, String helpfulAction, String errorCode) {
    }

    public static ValidationResponse from(GatewayDecision decision) {
        if (decision.allowed()) {
            ValidationContext ctx = decision.context();
            return new ValidationResponse(decision.requestId(), true, decision.decidedBy(),
                    new Identity(ctx.tenantId(), ctx.userId(), ctx.accessLevel(), ctx.expiresAt().toString()), null);
        }
        UserFacingError e = decision.error();
        return new ValidationResponse(decision.requestId(), false, decision.decidedBy(), null,
                new Error(e.category(), e.message(), e.helpfulAction(), e.errorCode()));
    }
}
