package com.bastion.validation;

import com.bastion.audit.ComparisonRecord;
import com.bastion.audit.ErrorKind;
import com.bastion.audit.SourceOfTruth;
import com.bastion.audit.ValidatorName;
import com.bastion.audit.ValidationOutcome;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.SpanHelper;
import com.bastion.validation.audit.AuditRecorder;
import com.bastion.validation.translation.ErrorTranslationService;
import com.bastion.validation.translation.UserFacingError;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the legacy and enhanced validators side by side for one request, returns the outcome
 * chosen by the {@link SelectionPolicy}, and records both.
 *
 * <p>Under the shadow policy the caller-visible decision is derived from the legacy outcome
 * alone: whatever the enhanced validator does (deny, throw, hang) cannot change it. Each
 * validator has its own deadline; a late validator is cancelled and reported as
 * {@code VALIDATOR_TIMEOUT}. Recording is asynchronous and never delays the response.
 */
public class ParallelValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelValidationOrchestrator.class);

    private final CredentialValidator legacy;
    private final CredentialValidator enhanced;
    private final ErrorTranslationService translator;
    private final AuditRecorder recorder;
    private final ExecutorService executor;
    private final GatewaySettings settings;
    private final GatewayMetrics metrics;
    private final SpanHelper spans;
    private final Clock clock;

    public ParallelValidationOrchestrator(CredentialValidator legacy,
                                          CredentialValidator enhanced,
                                          ErrorTranslationService translator,
                                          AuditRecorder recorder,
                                          ExecutorService executor,
                                          GatewaySettings settings,
                                          GatewayMetrics metrics,
                                          SpanHelper spans,
                                          Clock clock) {
        if (legacy == null || enhanced == null || translator == null || recorder == null || executor == null
                || settings == null || metrics == null || spans == null || clock == null) {
            throw new IllegalArgumentException("all orchestrator collaborators are required");
        }
        this.legacy = legacy;
        this.enhanced = enhanced;
        this.translator = translator;
        this.recorder = recorder;
        this.executor = executor;
        this.settings = settings;
        this.metrics = metrics;
        this.spans = spans;
        this.clock = clock;
    }

    public GatewayDecision orchestrate(ValidationRequest request) {
        String requestId = request.requestId();
        transition(requestId, OrchestrationState.START);
        SelectionPolicy policy = settings.selectionPolicy();

        ValidationOutcome legacyOutcome;
        ValidationOutcome enhancedOutcome;
        if (settings.parallelEnabled()) {
            transition(requestId, OrchestrationState.RUNNING_BOTH);
            Pending legacyRun = start(legacy, request, settings.legacyTimeout());
            Pending enhancedRun = start(enhanced, request, settings.enhancedTimeout());
            legacyOutcome = legacyRun.await();
            enhancedOutcome = enhancedRun.await();
        } else if (policy.sourceOfTruth() == SourceOfTruth.LEGACY) {
            legacyOutcome = start(legacy, request, settings.legacyTimeout()).await();
            enhancedOutcome = null;
        } else {
            legacyOutcome = null;
            enhancedOutcome = start(enhanced, request, settings.enhancedTimeout()).await();
        }

        transition(requestId, OrchestrationState.SELECTING);
        ValidationOutcome selected = policy.sourceOfTruth() == SourceOfTruth.LEGACY ? legacyOutcome : enhancedOutcome;
        boolean allowed = selected.success();
        UserFacingError error = allowed ? null : translator.translate(selected.errorKind(), selected.validator());

        transition(requestId, OrchestrationState.RECORDING);
        ComparisonRecord record = ComparisonRecord.of(requestId, clock.instant(), request.requestedTenant(),
                request.requestedResource(), request.credential().fingerprint().value(), legacyOutcome,
                enhancedOutcome, policy.sourceOfTruth(), policy.version(), allowed,
                error == null ? null : error.category());
        observe(record);
        recorder.submit(record);

        transition(requestId, OrchestrationState.DONE);
        return new GatewayDecision(requestId, allowed, allowed ? selected.context() : null, error,
                policy.sourceOfTruth());
    }

    public GatewaySettings settings() {
        return settings;
    }

    private void observe(ComparisonRecord record) {
        metrics.recordOutcome(record.legacy());
        metrics.recordOutcome(record.enhanced());
        metrics.recordComparison(record);
        if (record.securityDiscrepancy()) {
            log.warn(SecurityMarkers.SECURITY,
                    "Security discrepancy on request {}: legacy allowed tenant {} where enhanced blocked cross-tenant access",
                    record.requestId(), record.requestedTenant());
        } else if (record.bothRan() && !record.outcomesAgree()) {
            log.info("Validators disagree on request {}: legacy {} enhanced {}", record.requestId(),
                    describe(record.legacy()), describe(record.enhanced()));
        }
    }

    private Pending start(CredentialValidator validator, ValidationRequest request, Duration timeout) {
        long startedNanos = System.nanoTime();
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        Callable<ValidationOutcome> task = CorrelationContextHolder.wrap(context, () -> traced(validator, request));
        try {
            return new Pending(validator.name(), executor.submit(task), timeout, startedNanos);
        } catch (RejectedExecutionException e) {
            if (validator.name() == ValidatorName.LEGACY) {
                // the caller-visible path must still be answered; it runs when awaited, after enhanced is submitted
                log.warn("Validator pool saturated, running legacy validation on the request thread");
                return Pending.inline(validator.name(), task, startedNanos);
            }
            log.warn("Validator pool saturated, enhanced validation skipped for request {}", request.requestId());
            return Pending.completed(validator.name(),
                    ValidationOutcome.fault(validator.name(), ErrorKind.INTERNAL_FAULT, elapsed(startedNanos)));
        }
    }

    private ValidationOutcome traced(CredentialValidator validator, ValidationRequest request) throws Exception {
        return spans.withSpan("validate." + validator.name().tagValue(), SpanKind.INTERNAL,
                Map.of("bastion.validator", validator.name().tagValue()),
                () -> validator.validate(request));
    }

    private static ValidationOutcome runInline(Callable<ValidationOutcome> task, ValidatorName name, long startedNanos) {
        try {
            return task.call();
        } catch (Exception e) {
            log.error("{} validator threw", name, e);
            return ValidationOutcome.fault(name, ErrorKind.INTERNAL_FAULT, elapsed(startedNanos));
        }
    }

    private static void transition(String requestId, OrchestrationState state) {
        log.debug("Request {} -> {}", requestId, state);
    }

    private static String describe(ValidationOutcome outcome) {
        return outcome.success()
                ? "allowed " + outcome.context().tenantId() + "/" + outcome.context().accessLevel()
                : "denied " + outcome.errorKind();
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    /**
     * A validator run awaiting its own deadline, or one to be run on the awaiting thread.
     */
    private static final class Pending {

        private final ValidatorName name;
        private final Future<ValidationOutcome> future;
        private final Callable<ValidationOutcome> inlineTask;
        private final Duration timeout;
        private final long startedNanos;
        private final ValidationOutcome completed;

        private Pending(ValidatorName name, Future<ValidationOutcome> future, Callable<ValidationOutcome> inlineTask,
                        Duration timeout, long startedNanos, ValidationOutcome completed) {
            this.name = name;
            this.future = future;
            this.inlineTask = inlineTask;
            this.timeout = timeout;
            this.startedNanos = startedNanos;
            this.completed = completed;
        }

        Pending(ValidatorName name, Future<ValidationOutcome> future, Duration timeout, long startedNanos) {
            this(name, future, null, timeout, startedNanos, null);
        }

        static Pending completed(ValidatorName name, ValidationOutcome outcome) {
            return new Pending(name, null, null, Duration.ZERO, 0L, outcome);
        }

        static Pending inline(ValidatorName name, Callable<ValidationOutcome> task, long startedNanos) {
            return new Pending(name, null, task, Duration.ZERO, startedNanos, null);
        }

        ValidationOutcome await() {
            if (completed != null) {
                return completed;
            }
            if (inlineTask != null) {
                return runInline(inlineTask, name, startedNanos);
            }
            long remaining = timeout.toNanos() - (System.nanoTime() - startedNanos);
            try {
                return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} validator exceeded its {} ms deadline", name, timeout.toMillis());
                return ValidationOutcome.fault(name, ErrorKind.VALIDATOR_TIMEOUT, elapsed(startedNanos));
            } catch (ExecutionException e) {
                log.error("{} validator threw", name, e.getCause());
                return ValidationOutcome.fault(name, ErrorKind.INTERNAL_FAULT, elapsed(startedNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("Interrupted while waiting for the {} validator", name);
                return ValidationOutcome.fault(name, ErrorKind.INTERNAL_FAULT, elapsed(startedNanos));
            }
        }
    }
}
