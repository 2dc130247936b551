package com.bastion.gateway.api;

/**
 * Body of {@code POST /api/v1/credentials/revocations}. Exactly one field identifies what was
 * revoked.
 *
 * @param credential  the raw revoked credential
 * @param fingerprint fingerprint of the revoked credential, when the raw value is not at hand
 * @param tenantId    a tenant whose credentials were all revoked
 */
public record RevocationRequest(String credential, String fingerprint, String tenantId) {

    public RevocationRequest {
        int given = (present(credential) ? 1 : 0) + (present(fingerprint) ? 1 : 0) + (present(tenantId) ? 1 : 0);
        if (given != 1) {
            throw new IllegalArgumentException("exactly one of credential, fingerprint or tenantId is required");
        }
    }

    static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
