package com.bastion.validation.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Port to the multi-tenant credential store.
 *
 * <p>Implementations must be safe for concurrent use. Reads are side-effect free; the only
 * write is the conditional expiry extension, which must be atomic per credential so that among
 * concurrent callers passing the same {@code expectedCurrentExpiry} exactly one observes
 * {@link ExtensionResult#EXTENDED}.
 *
 * <p>Infrastructure failures are reported as {@link StoreUnavailableException}.
 */
public interface CredentialStore {

    /**
     * Looks up a credential by its raw presented value.
     */
    Optional<CredentialRecord> lookupCredential(String rawValue);

    /**
     * Looks up tenant status.
     */
    Optional<TenantRecord> lookupTenant(String tenantId);

    /**
     * Sets the credential's expiry to {@code newExpiry} if its current expiry equals
     * {@code expectedCurrentExpiry}.
     */
    ExtensionResult extendCredential(String rawValue, Instant newExpiry, Instant expectedCurrentExpiry);

    /**
     * Cheap liveness check used by health checks. The default performs a tenant lookup that is
     * expected to miss.
     */
    default boolean ping() {
        lookupTenant("__bastion_health_check__");
        return true;
    }
}
