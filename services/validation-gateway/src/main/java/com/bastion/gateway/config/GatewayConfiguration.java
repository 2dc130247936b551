package com.bastion.gateway.config;

import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.observability.SpanHelper;
import com.bastion.security.CredentialParser;
import com.bastion.security.Fingerprinter;
import com.bastion.security.Sha256Fingerprinter;
import com.bastion.validation.CredentialResolver;
import com.bastion.validation.EnhancedValidator;
import com.bastion.validation.GatewayMetrics;
import com.bastion.validation.LegacyValidator;
import com.bastion.validation.ParallelValidationOrchestrator;
import com.bastion.validation.RiskScorer;
import com.bastion.validation.TokenExtensionService;
import com.bastion.validation.ValidationGateway;
import com.bastion.validation.audit.AuditRecorder;
import com.bastion.validation.audit.AuditSink;
import com.bastion.validation.audit.InMemoryAuditSink;
import com.bastion.validation.audit.JsonLinesAuditSink;
import com.bastion.validation.cache.ValidationCache;
import com.bastion.validation.readiness.ReadinessEvaluator;
import com.bastion.validation.store.CredentialStore;
import com.bastion.validation.testing.InMemoryCredentialStore;
import com.bastion.validation.translation.ErrorTranslationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: wires the resolver, both validators, the cache, the translation table and
 * the audit pipeline into one {@link ValidationGateway}.
 *
 * <p>Each collaborator is created once and shared by reference. A deployment provides its own
 * {@link CredentialStore} bean; without one the gateway runs against an empty in-memory store.
 */
@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialStore credentialStore() {
        log.warn("No CredentialStore bean configured, using an empty in-memory store");
        return new InMemoryCredentialStore();
    }

    @Bean
    public CredentialParser credentialParser(GatewayProperties properties) {
        GatewayProperties.Credentials credentials = properties.credentials();
        Fingerprinter fingerprinter = credentials.peppered()
                ? new Sha256Fingerprinter(credentials.fingerprintPepper())
                : new Sha256Fingerprinter();
        return new CredentialParser(credentials.apiKeyPrefix(), credentials.sessionPrefix(), fingerprinter);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GatewayProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MetricFactory metricFactory) {
        return new GatewayMetrics(metricFactory);
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("bastion-validation-gateway"));
    }

    @Bean
    public RiskScorer riskScorer(GatewayProperties properties) {
        return new RiskScorer(properties.risk().toSettings());
    }

    @Bean
    public CredentialResolver credentialResolver(CredentialStore store, RiskScorer riskScorer, Clock clock) {
        return new CredentialResolver(store, riskScorer, clock);
    }

    @Bean
    public ValidationCache validationCache(GatewayProperties properties, Clock clock, GatewayMetrics metrics) {
        ValidationCache cache = new ValidationCache(properties.cache().toSettings(), clock);
        metrics.bindCache(cache);
        return cache;
    }

    @Bean
    public TokenExtensionService tokenExtensionService(CredentialStore store, GatewayProperties properties,
                                                       ValidationCache cache, Clock clock) {
        return new TokenExtensionService(store, properties.extension().toPolicy(), cache, clock);
    }

    @Bean
    public LegacyValidator legacyValidator(CredentialResolver resolver) {
        return new LegacyValidator(resolver);
    }

    @Bean
    public EnhancedValidator enhancedValidator(CredentialResolver resolver, ValidationCache cache,
                                               TokenExtensionService extensionService, RiskScorer riskScorer,
                                               GatewayProperties properties) {
        return new EnhancedValidator(resolver, cache, extensionService, riskScorer,
                properties.risk().toResourcePolicy());
    }

    @Bean
    public ErrorTranslationService errorTranslationService(GatewayProperties properties) {
        return ErrorTranslationService.withOverrides(properties.translationOverrides());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink(GatewayProperties properties) {
        if (properties.audit().durable()) {
            return new JsonLinesAuditSink(Path.of(properties.audit().path()));
        }
        log.warn("bastion.gateway.audit.path is not set, comparison records are kept in memory only");
        return new InMemoryAuditSink();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService auditExecutor(GatewayProperties properties) {
        GatewayProperties.Pools pools = properties.pools();
        return boundedPool("audit", pools.auditThreads(), pools.auditQueueCapacity());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService validatorExecutor(GatewayProperties properties) {
        GatewayProperties.Pools pools = properties.pools();
        return boundedPool("validator", pools.validatorThreads(), pools.validatorQueueCapacity());
    }

    @Bean
    public AuditRecorder auditRecorder(AuditSink sink, @Qualifier("auditExecutor") ExecutorService auditExecutor,
                                       GatewayProperties properties, MetricFactory metricFactory) {
        return new AuditRecorder(sink, auditExecutor, properties.audit().toRetrySettings(), metricFactory);
    }

    @Bean
    public ParallelValidationOrchestrator parallelValidationOrchestrator(
            LegacyValidator legacy, EnhancedValidator enhanced, ErrorTranslationService translator,
            AuditRecorder recorder, @Qualifier("validatorExecutor") ExecutorService validatorExecutor,
            GatewayProperties properties, GatewayMetrics metrics, SpanHelper spanHelper, Clock clock) {
        return new ParallelValidationOrchestrator(legacy, enhanced, translator, recorder, validatorExecutor,
                properties.toGatewaySettings(), metrics, spanHelper, clock);
    }

    @Bean
    public ValidationGateway validationGateway(CredentialParser parser, ParallelValidationOrchestrator orchestrator,
                                               ValidationCache cache, ErrorTranslationService translator,
                                               AuditRecorder recorder, TokenExtensionService extensionService,
                                               GatewayProperties properties) {
        logEffectiveConfiguration(properties);
        return new ValidationGateway(parser, orchestrator, cache, translator, recorder, extensionService);
    }

    @Bean
    public ReadinessEvaluator readinessEvaluator(AuditSink sink, GatewayProperties properties,
                                                 TokenExtensionService extensionService,
                                                 ErrorTranslationService translator) {
        return new ReadinessEvaluator(sink, properties.readiness().toTargets(), extensionService::stats,
                translator::coverage);
    }

    private static ExecutorService boundedPool(String name, int threads, int queueCapacity) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "bastion-" + name + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), factory, new ThreadPoolExecutor.AbortPolicy());
    }

    private static void logEffectiveConfiguration(GatewayProperties properties) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("environment", properties.environment());
        summary.put("parallelEnabled", properties.parallelEnabled());
        summary.put("selectionPolicy", properties.selectionPolicy());
        summary.put("timeouts", properties.timeouts());
        summary.put("cache", properties.cache());
        summary.put("extension", properties.extension());
        summary.put("fingerprintPepper", properties.credentials().peppered() ? "set" : "unset");
        summary.put("auditPath", properties.audit().durable() ? properties.audit().path() : "in-memory");
        log.info("Validation gateway configuration: {}", new SensitiveDataRedactor().redact(summary));
    }
}
