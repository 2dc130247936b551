package com.bastion.gateway.api;

import com.bastion.audit.UserFacingCategory;
import com.bastion.security.BearerTokenExtractor;
import com.bastion.validation.GatewayDecision;
import com.bastion.validation.ValidationGateway;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Validates a bearer credential for a tenant and resource.
 *
 * <p>A missing or unreadable credential is validated like any other value and comes back as an
 * invalid-credentials denial, so every call produces a comparison record.
 */
@RestController
@RequestMapping("/api/v1")
public class ValidationController {

    private final ValidationGateway gateway;

    public ValidationController(ValidationGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(
            @RequestHeader(value = BearerTokenExtractor.AUTHORIZATION_HEADER, required = false) String authorization,
            @RequestHeader(value = BearerTokenExtractor.API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody ValidateRequestBody body) {
        String credential = BearerTokenExtractor.extract(authorization, apiKey).orElse("");
        GatewayDecision decision = gateway.validateRequest(credential, body.tenantId(), body.resource());
        return ResponseEntity.status(statusOf(decision)).body(ValidationResponse.from(decision));
    }

    static HttpStatus statusOf(GatewayDecision decision) {
        if (decision.allowed()) {
            return HttpStatus.OK;
        }
        UserFacingCategory category = decision.error().category();
        return switch (category) {
            case INVALID_CREDENTIALS -> HttpStatus.UNAUTHORIZED;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case TEMPORARILY_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
