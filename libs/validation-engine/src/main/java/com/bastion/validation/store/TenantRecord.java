package com.bastion.validation.store;

/**
 * Tenant status as held by the backing store.
 */
public record TenantRecord(String tenantId, boolean active) {

    public TenantRecord {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }
}
