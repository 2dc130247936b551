package com.bastion.validation;

import com.bastion.security.Credential;

/**
 * One inbound request to validate.
 *
 * @param requestId         unique id, shared by both validators and the comparison record
 * @param credential        the presented credential
 * @param requestedTenant   tenant the caller wants to act on
 * @param requestedResource resource the caller wants to access
 */
public record ValidationRequest(String requestId, Credential credential, String requestedTenant,
                                String requestedResource) {

    public ValidationRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        if (credential == null) {
            throw new IllegalArgumentException("credential must not be null");
        }
    }
}
