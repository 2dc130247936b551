package com.bastion.security;

/**
 * Enforces tenant isolation by comparing a resolved context's tenant with the tenant a
 * request targets.
 * <p>
 * Comparison is exact {@link String#equals(Object)}: no trimming, case folding or prefix
 * matching, so {@code "acme"} never matches {@code "acme-eu"} or {@code "ACME"}. ADMIN
 * contexts are exempt.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Returns true if the context may act on the requested tenant.
     *
     * @param context         the resolved validation context
     * @param requestedTenant the tenant the request targets (null never matches)
     */
    public static boolean permits(ValidationContext context, String requestedTenant) {
        if (context.accessLevel() == AccessLevel.ADMIN) {
            return true;
        }
        return context.tenantId().equals(requestedTenant);
    }
}
