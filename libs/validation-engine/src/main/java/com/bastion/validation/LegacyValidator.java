package com.bastion.validation;

import com.bastion.audit.CacheStatus;
import com.bastion.audit.ErrorKind;
import com.bastion.audit.ValidatorName;
import com.bastion.audit.ValidationOutcome;
import com.bastion.security.Credential;
import com.bastion.security.ValidationContext;
import com.bastion.validation.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * The trusted validation path: resolve the credential and require an active tenant.
 *
 * <p>No tenant isolation, no extension, no cache. Its outcome is what callers see until the
 * selection policy is switched.
 */
public class LegacyValidator implements CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(LegacyValidator.class);

    private final CredentialResolver resolver;

    public LegacyValidator(CredentialResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    @Override
    public ValidatorName name() {
        return ValidatorName.LEGACY;
    }

    @Override
    public ValidationOutcome validate(ValidationRequest request) {
        return validate(request.credential());
    }

    public ValidationOutcome validate(Credential credential) {
        long started = System.nanoTime();
        try {
            ValidationContext context = resolver.resolve(credential);
            if (!resolver.tenantActive(context.tenantId())) {
                return failure(ErrorKind.TENANT_INACTIVE, started);
            }
            return ValidationOutcome.success(ValidatorName.LEGACY, context, elapsedSince(started),
                    CacheStatus.NOT_APPLICABLE, false);
        } catch (CredentialResolutionException e) {
            return failure(e.errorKind(), started);
        } catch (StoreUnavailableException e) {
            log.error("Legacy validation could not reach the credential store", e);
            return failure(ErrorKind.STORE_UNAVAILABLE, started);
        } catch (RuntimeException e) {
            log.error("Legacy validation failed unexpectedly", e);
            return failure(ErrorKind.INTERNAL_FAULT, started);
        }
    }

    private static ValidationOutcome failure(ErrorKind kind, long started) {
        return ValidationOutcome.failure(ValidatorName.LEGACY, kind, elapsedSince(started), CacheStatus.NOT_APPLICABLE);
    }

    static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
