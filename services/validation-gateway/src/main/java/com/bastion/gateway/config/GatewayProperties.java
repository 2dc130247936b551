package com.bastion.gateway.config;

import com.bastion.audit.ErrorKind;
import com.bastion.audit.SourceOfTruth;
import com.bastion.security.AccessLevel;
import com.bastion.security.CredentialKind;
import com.bastion.security.CredentialParser;
import com.bastion.validation.ExtensionPolicy;
import com.bastion.validation.GatewaySettings;
import com.bastion.validation.ResourcePolicy;
import com.bastion.validation.RiskSettings;
import com.bastion.validation.SelectionPolicy;
import com.bastion.validation.audit.AuditRetrySettings;
import com.bastion.validation.cache.CacheSettings;
import com.bastion.validation.readiness.SuccessCriteriaTargets;
import com.bastion.validation.translation.TranslationOverride;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the validation gateway, bound from {@code bastion.gateway.*}.
 *
 * <p>Every group is optional; compact constructors fill in defaults before Bean Validation
 * runs. The engine never sees this class: the {@code to*} methods turn each group into the
 * immutable settings record the engine consumes.
 *
 * <pre>
 * bastion:
 *   gateway:
 *     service-name: validation-gateway
 *     parallel-enabled: true
 *     selection-policy:
 *       version: 1
 *       source-of-truth: LEGACY
 *     extension:
 *       threshold-fraction: 0.25
 * </pre>
 *
 * @param serviceName     service name used in metrics tags and logs
 * @param environment     deployment environment
 * @param parallelEnabled run the shadow validator alongside the source of truth
 * @param selectionPolicy whose outcome callers see
 * @param timeouts        per-validator deadlines
 * @param pools           validator and audit thread pools
 * @param credentials     credential prefixes and fingerprint pepper
 * @param cache           decision cache
 * @param extension       credential extension policy
 * @param risk            risk scoring weights and per-resource requirements
 * @param audit           comparison record sink
 * @param readiness       promotion targets
 * @param translations    user-facing text overrides per error kind
 */
@ConfigurationProperties(prefix = "bastion.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String serviceName,
        String environment,
        Boolean parallelEnabled,
        @Valid Selection selectionPolicy,
        @Valid Timeouts timeouts,
        @Valid Pools pools,
        @Valid Credentials credentials,
        @Valid Cache cache,
        @Valid Extension extension,
        @Valid Risk risk,
        @Valid Audit audit,
        @Valid Readiness readiness,
        Map<ErrorKind, Translation> translations) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (parallelEnabled == null) {
            parallelEnabled = Boolean.TRUE;
        }
        selectionPolicy = selectionPolicy == null ? new Selection(0, null) : selectionPolicy;
        timeouts = timeouts == null ? new Timeouts(null, null) : timeouts;
        pools = pools == null ? new Pools(0, 0, 0, 0) : pools;
        credentials = credentials == null ? new Credentials(null, null, null) : credentials;
        cache = cache == null ? new Cache(null, null, 0) : cache;
        extension = extension == null ? new Extension(null, null, null, null, null) : extension;
        risk = risk == null ? new Risk(null, null, null, null, null, null, null, null, null) : risk;
        audit = audit == null ? new Audit(null, 0, null, null) : audit;
        readiness = readiness == null ? new Readiness(null, null, null, null, null, null, null) : readiness;
        translations = translations == null ? Map.of() : Map.copyOf(translations);
    }

    /** Orchestrator settings. */
    public GatewaySettings toGatewaySettings() {
        return new GatewaySettings(parallelEnabled, new SelectionPolicy(selectionPolicy.version(),
                selectionPolicy.sourceOfTruth()), timeouts.legacy(), timeouts.enhanced());
    }

    /** Translation overrides keyed by error kind. */
    public Map<ErrorKind, TranslationOverride> translationOverrides() {
        Map<ErrorKind, TranslationOverride> overrides = new EnumMap<>(ErrorKind.class);
        translations.forEach((kind, t) ->
                overrides.put(kind, new TranslationOverride(t.message(), t.helpfulAction(), t.errorCode())));
        return overrides;
    }

    public record Selection(int version, SourceOfTruth sourceOfTruth) {

        public Selection {
            if (version <= 0) {
                version = 1;
            }
            if (sourceOfTruth == null) {
                sourceOfTruth = SourceOfTruth.LEGACY;
            }
        }
    }

    public record Timeouts(Duration legacy, Duration enhanced) {

        public Timeouts {
            legacy = legacy == null ? GatewaySettings.DEFAULTS.legacyTimeout() : legacy;
            enhanced = enhanced == null ? GatewaySettings.DEFAULTS.enhancedTimeout() : enhanced;
        }
    }

    /**
     * @param validatorThreads       threads running validators; each request uses up to two
     * @param validatorQueueCapacity queued validator runs before legacy falls back to the request thread
     * @param auditThreads           threads appending comparison records
     * @param auditQueueCapacity     queued records before new ones are dropped
     */
    public record Pools(int validatorThreads, int validatorQueueCapacity, int auditThreads,
                            int auditQueueCapacity) {

        public Pools {
            if (validatorThreads <= 0) {
                validatorThreads = 16;
            }
            if (validatorQueueCapacity <= 0) {
                validatorQueueCapacity = 1000;
            }
            if (auditThreads <= 0) {
                auditThreads = 2;
            }
            if (auditQueueCapacity <= 0) {
                auditQueueCapacity = 10_000;
            }
        }
    }

    /**
     * @param apiKeyPrefix      prefix identifying API keys
     * @param sessionPrefix     prefix identifying session tokens
     * @param fingerprintPepper optional secret mixed into credential fingerprints
     */
    public record Credentials(String apiKeyPrefix, String sessionPrefix, String fingerprintPepper) {

        public Credentials {
            if (apiKeyPrefix == null || apiKeyPrefix.isBlank()) {
                apiKeyPrefix = CredentialParser.DEFAULT_API_KEY_PREFIX;
            }
            if (sessionPrefix == null || sessionPrefix.isBlank()) {
                sessionPrefix = CredentialParser.DEFAULT_SESSION_PREFIX;
            }
        }

        public boolean peppered() {
            return fingerprintPepper != null && !fingerprintPepper.isBlank();
        }
    }

    public record Cache(Boolean enabled, Duration ttl, int maxEntries) {

        public Cache {
            if (enabled == null) {
                enabled = CacheSettings.DEFAULTS.enabled();
            }
            if (ttl == null) {
                ttl = CacheSettings.DEFAULTS.ttl();
            }
            if (maxEntries <= 0) {
                maxEntries = CacheSettings.DEFAULTS.maxEntries();
            }
        }

        public CacheSettings toSettings() {
            return new CacheSettings(enabled, ttl, maxEntries);
        }
    }

    public record Extension(Boolean enabled, Double thresholdFraction, Duration extension,
                            Set<CredentialKind> allowedKinds, Set<String> excludedTenants) {

        public Extension {
            ExtensionPolicy defaults = ExtensionPolicy.DEFAULTS;
            if (enabled == null) {
                enabled = defaults.enabled();
            }
            if (thresholdFraction == null) {
                thresholdFraction = defaults.thresholdFraction();
            }
            if (extension == null) {
                extension = defaults.extension();
            }
            if (allowedKinds == null || allowedKinds.isEmpty()) {
                allowedKinds = EnumSet.allOf(CredentialKind.class);
            }
            if (excludedTenants == null) {
                excludedTenants = Set.of();
            }
        }

        public ExtensionPolicy toPolicy() {
            return new ExtensionPolicy(enabled, thresholdFraction, extension, allowedKinds, excludedTenants);
        }
    }

    /**
     * @param resources            per-resource requirements; resources not listed use the defaults
     * @param defaultRequiredLevel level required by unlisted resources
     * @param defaultSensitivity   sensitivity of unlisted resources
     */
    public record Risk(Double ageWeight, Double failureWeight, Integer failureSaturation,
                       Double resourceSensitivityWeight, Double requestedAccessWeight, Double ceiling,
                       AccessLevel defaultRequiredLevel, Double defaultSensitivity,
                       Map<String, ResourceRule> resources) {

        public Risk {
            RiskSettings defaults = RiskSettings.DEFAULTS;
            ageWeight = ageWeight == null ? defaults.ageWeight() : ageWeight;
            failureWeight = failureWeight == null ? defaults.failureWeight() : failureWeight;
            failureSaturation = failureSaturation == null ? defaults.failureSaturation() : failureSaturation;
            resourceSensitivityWeight = resourceSensitivityWeight == null
                    ? defaults.resourceSensitivityWeight() : resourceSensitivityWeight;
            requestedAccessWeight = requestedAccessWeight == null
                    ? defaults.requestedAccessWeight() : requestedAccessWeight;
            ceiling = ceiling == null ? defaults.riskCeiling() : ceiling;
            defaultRequiredLevel = defaultRequiredLevel == null ? AccessLevel.READ : defaultRequiredLevel;
            defaultSensitivity = defaultSensitivity == null ? 0.0 : defaultSensitivity;
            resources = resources == null ? Map.of() : Map.copyOf(resources);
        }

        public RiskSettings toSettings() {
            return new RiskSettings(ageWeight, failureWeight, failureSaturation, resourceSensitivityWeight,
                    requestedAccessWeight, ceiling);
        }

        public ResourcePolicy toResourcePolicy() {
            Map<String, ResourcePolicy.Requirement> requirements = new LinkedHashMap<>();
            resources.forEach((name, rule) -> requirements.put(name,
                    new ResourcePolicy.Requirement(rule.requiredLevel(), rule.sensitivity())));
            return new ResourcePolicy(requirements,
                    new ResourcePolicy.Requirement(defaultRequiredLevel, defaultSensitivity));
        }
    }

    public record ResourceRule(AccessLevel requiredLevel, double sensitivity) {

        public ResourceRule {
            if (requiredLevel == null) {
                requiredLevel = AccessLevel.READ;
            }
        }
    }

    /**
     * @param path              JSON-lines file for comparison records; blank keeps them in memory
     * @param maxAttempts       append attempts per record
     * @param initialBackoff    wait before the first retry
     * @param backoffMultiplier growth of the wait between retries
     */
    public record Audit(String path, int maxAttempts, Duration initialBackoff, Double backoffMultiplier) {

        public Audit {
            AuditRetrySettings defaults = AuditRetrySettings.DEFAULTS;
            if (maxAttempts <= 0) {
                maxAttempts = defaults.maxAttempts();
            }
            if (initialBackoff == null) {
                initialBackoff = defaults.initialBackoff();
            }
            if (backoffMultiplier == null) {
                backoffMultiplier = defaults.backoffMultiplier();
            }
        }

        public boolean durable() {
            return path != null && !path.isBlank();
        }

        public AuditRetrySettings toRetrySettings() {
            return new AuditRetrySettings(maxAttempts, initialBackoff, backoffMultiplier);
        }
    }

    /** Target percentages; unset targets keep their defaults. */
    public record Readiness(Double zeroUserDisruption, Double enhancedValidationSuccess,
                            Double performanceImprovement, Double completeLogging, Double crossTenantProtection,
                            Double tokenExtensionSuccess, Double errorTranslationCoverage) {

        public SuccessCriteriaTargets toTargets() {
            SuccessCriteriaTargets d = SuccessCriteriaTargets.DEFAULTS;
            return new SuccessCriteriaTargets(
                    or(zeroUserDisruption, d.zeroUserDisruption()),
                    or(enhancedValidationSuccess, d.enhancedValidationSuccess()),
                    or(performanceImprovement, d.performanceImprovement()),
                    or(completeLogging, d.completeLogging()),
                    or(crossTenantProtection, d.crossTenantProtection()),
                    or(tokenExtensionSuccess, d.tokenExtensionSuccess()),
                    or(errorTranslationCoverage, d.errorTranslationCoverage()));
        }

        private static double or(Double value, double fallback) {
            return value == null ? fallback : value;
        }
    }

    public record Translation(String message, String helpfulAction, String errorCode) {
    }
}
