package com.bastion.gateway.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/validate}. The credential travels in the Authorization header.
 *
 * @param tenantId tenant the caller wants to act on
 * @param resource resource the caller wants to access
 */
public record ValidateRequestBody(@NotBlank String tenantId, @NotBlank String resource) {
}
