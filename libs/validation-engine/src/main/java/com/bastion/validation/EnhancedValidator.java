package com.bastion.validation;

import com.bastion.audit.CacheStatus;
import com.bastion.audit.ErrorKind;
import com.bastion.audit.ValidatorName;
import com.bastion.audit.ValidationOutcome;
import com.bastion.security.Credential;
import com.bastion.security.TenantIsolationEnforcer;
import com.bastion.security.ValidationContext;
import com.bastion.validation.cache.ValidationCache;
import com.bastion.validation.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The stricter validation path.
 *
 * <ol>
 *   <li>Look up the cache on (fingerprint, resource).</li>
 *   <li>On a miss, resolve the credential and require an active tenant. Hits are not rechecked:
 *       a deactivated tenant stays allowed until its entries expire or
 *       {@link ValidationCache#invalidateTenant(String)} drops them.</li>
 *   <li>Enforce tenant isolation, on cache hits as well.</li>
 *   <li>Extend the credential when it is close to expiry.</li>
 *   <li>Refine the risk score, possibly degrading the access level, and check the level the
 *       resource requires.</li>
 *   <li>Cache the resolved identity for min(cache TTL, remaining lifetime).</li>
 * </ol>
 *
 * Unexpected exceptions become {@code INTERNAL_FAULT} or {@code STORE_UNAVAILABLE} outcomes and
 * are never rethrown.
 */
public class EnhancedValidator implements CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(EnhancedValidator.class);

    private final CredentialResolver resolver;
    private final ValidationCache cache;
    private final TokenExtensionService extensionService;
    private final RiskScorer riskScorer;
    private final ResourcePolicy resourcePolicy;

    /**
     * @param cache the decision cache, or null to validate without caching
     */
    public EnhancedValidator(CredentialResolver resolver, ValidationCache cache, TokenExtensionService extensionService,
                             RiskScorer riskScorer, ResourcePolicy resourcePolicy) {
        if (resolver == null || extensionService == null || riskScorer == null || resourcePolicy == null) {
            throw new IllegalArgumentException("resolver, extensionService, riskScorer and resourcePolicy must not be null");
        }
        this.resolver = resolver;
        this.cache = cache != null && cache.settings().enabled() ? cache : null;
        this.extensionService = extensionService;
        this.riskScorer = riskScorer;
        this.resourcePolicy = resourcePolicy;
    }

    @Override
    public ValidatorName name() {
        return ValidatorName.ENHANCED;
    }

    @Override
    public ValidationOutcome validate(ValidationRequest request) {
        return validate(request.credential(), request.requestedTenant(), request.requestedResource());
    }

    public ValidationOutcome validate(Credential credential, String requestedTenant, String requestedResource) {
        long started = System.nanoTime();
        CacheStatus cacheStatus = cache == null ? CacheStatus.NOT_APPLICABLE : CacheStatus.MISS;
        try {
            long epoch = cache == null ? 0L : cache.revocationEpoch();
            Optional<ValidationContext> cached = cache != null && credential.recognized()
                    ? cache.get(credential.fingerprint(), requestedResource)
                    : Optional.empty();
            ValidationContext context;
            if (cached.isPresent()) {
                cacheStatus = CacheStatus.HIT;
                context = cached.get();
            } else {
                context = resolver.resolve(credential);
                if (!resolver.tenantActive(context.tenantId())) {
                    return failure(ErrorKind.TENANT_INACTIVE, started, cacheStatus);
                }
            }

            if (!TenantIsolationEnforcer.permits(context, requestedTenant)) {
                log.warn(SecurityMarkers.SECURITY,
                        "Cross-tenant access blocked: credential {} of tenant {} requested tenant {} resource {}",
                        credential.fingerprint().shortForm(), context.tenantId(), requestedTenant, requestedResource);
                return failure(ErrorKind.CROSS_TENANT_DENIED, started, cacheStatus);
            }

            TokenExtensionService.Decision extension = extensionService.maybeExtend(credential, context);
            context = extension.context();

            if (cache != null && (cached.isEmpty() || extension.applied())) {
                Instant now = resolver.clock().instant();
                cache.put(credential.fingerprint(), requestedResource, context, context.remainingAt(now), epoch);
            }

            ResourcePolicy.Requirement requirement = resourcePolicy.requirementFor(requestedResource);
            ValidationContext refined = riskScorer.refine(context, requirement);
            if (refined.accessLevel() != context.accessLevel()) {
                log.info(SecurityMarkers.SECURITY, "Access level of credential {} degraded from {} to {} (risk {})",
                        credential.fingerprint().shortForm(), context.accessLevel(), refined.accessLevel(),
                        refined.riskScore());
            }
            if (!refined.accessLevel().implies(requirement.requiredLevel())) {
                log.debug("Resource {} requires {}, credential grants {}", requestedResource,
                        requirement.requiredLevel(), refined.accessLevel());
                return failure(ErrorKind.ACCESS_LEVEL_INSUFFICIENT, started, cacheStatus);
            }

            return ValidationOutcome.success(ValidatorName.ENHANCED, refined, LegacyValidator.elapsedSince(started),
                    cacheStatus, extension.applied());
        } catch (CredentialResolutionException e) {
            return failure(e.errorKind(), started, cacheStatus);
        } catch (StoreUnavailableException e) {
            log.error("Enhanced validation could not reach the credential store", e);
            return failure(ErrorKind.STORE_UNAVAILABLE, started, cacheStatus);
        } catch (RuntimeException e) {
            log.error("Enhanced validation failed unexpectedly", e);
            return failure(ErrorKind.INTERNAL_FAULT, started, cacheStatus);
        }
    }

    private static ValidationOutcome failure(ErrorKind kind, long started, CacheStatus cacheStatus) {
        Duration elapsed = LegacyValidator.elapsedSince(started);
        return ValidationOutcome.failure(ValidatorName.ENHANCED, kind, elapsed, cacheStatus);
    }
}
