package com.bastion.validation;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.Credential;
import com.bastion.security.CredentialFingerprint;
import com.bastion.security.CredentialParser;
import com.bastion.validation.audit.AuditRecorder;
import com.bastion.validation.cache.ValidationCache;
import com.bastion.validation.translation.ErrorTranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for callers: validate a request, invalidate credentials, inspect counters.
 */
public class ValidationGateway {

    private static final Logger log = LoggerFactory.getLogger(ValidationGateway.class);

    private final CredentialParser parser;
    private final ParallelValidationOrchestrator orchestrator;
    private final ValidationCache cache;
    private final ErrorTranslationService translator;
    private final AuditRecorder recorder;
    private final TokenExtensionService extensionService;
    private final AtomicLong requestsProcessed = new AtomicLong();

    public ValidationGateway(CredentialParser parser,
                             ParallelValidationOrchestrator orchestrator,
                             ValidationCache cache,
                             ErrorTranslationService translator,
                             AuditRecorder recorder,
                             TokenExtensionService extensionService) {
        if (parser == null || orchestrator == null || cache == null || translator == null || recorder == null
                || extensionService == null) {
            throw new IllegalArgumentException("all gateway collaborators are required");
        }
        this.parser = parser;
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.translator = translator;
        this.recorder = recorder;
        this.extensionService = extensionService;
    }

    /**
     * Validates a raw credential for access to {@code requestedResource} of {@code requestedTenant}.
     * Never throws for credential, authorization or store problems; those are reported in the
     * decision.
     */
    public GatewayDecision validateRequest(String rawCredential, String requestedTenant, String requestedResource) {
        return validateRequest(parser.parse(rawCredential), requestedTenant, requestedResource);
    }

    public GatewayDecision validateRequest(Credential credential, String requestedTenant, String requestedResource) {
        String requestId = UUID.randomUUID().toString();
        CorrelationContext base = CorrelationContextHolder.get().orElseGet(() -> CorrelationContext.of(requestId));
        CorrelationContext scoped = base.forRequest(requestId, requestedTenant, credential.fingerprint().shortForm());

        requestsProcessed.incrementAndGet();
        return CorrelationContextHolder.supplyWithContext(scoped, () -> {
            GatewayDecision decision = orchestrator.orchestrate(
                    new ValidationRequest(requestId, credential, requestedTenant, requestedResource));
            log.info("Request {} for tenant {} resource {}: {}", requestId, requestedTenant, requestedResource,
                    decision.allowed() ? "allowed" : "denied " + decision.error().errorCode());
            return decision;
        });
    }

    /** Drops cached decisions of a revoked credential. Returns the number of entries removed. */
    public int invalidateCredential(CredentialFingerprint fingerprint) {
        int removed = cache.invalidate(fingerprint);
        log.info("Invalidated {} cached decisions for credential {}", removed, fingerprint.shortForm());
        return removed;
    }

    /**
     * Drops cached decisions of every credential of a tenant. Cache hits skip the tenant-active
     * check, so deactivating a tenant in the store takes effect on the enhanced path only after this
     * call or once the cached entries expire.
     */
    public int invalidateTenant(String tenantId) {
        int removed = cache.invalidateTenant(tenantId);
        log.info("Invalidated {} cached decisions for tenant {}", removed, tenantId);
        return removed;
    }

    public GatewayMetricsSnapshot metricsSnapshot() {
        GatewaySettings settings = orchestrator.settings();
        return new GatewayMetricsSnapshot(requestsProcessed.get(), settings.parallelEnabled(),
                settings.selectionPolicy(), cache.stats(), translator.coverage(), recorder.stats(),
                extensionService.stats());
    }

    public CredentialParser parser() {
        return parser;
    }
}
