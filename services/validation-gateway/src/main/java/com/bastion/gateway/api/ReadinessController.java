package com.bastion.gateway.api;

import com.bastion.validation.readiness.ReadinessEvaluator;
import com.bastion.validation.readiness.ReadinessReportRenderer;
import com.bastion.validation.readiness.ReadinessSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rollout readiness over a window of comparison records. Without parameters the window is the
 * last 24 hours.
 */
@RestController
@RequestMapping("/api/v1/readiness")
public class ReadinessController {

    static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private final ReadinessEvaluator evaluator;
    private final Clock clock;

    public ReadinessController(ReadinessEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    @GetMapping
    public ReadinessSnapshot readiness(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return evaluate(from, to);
    }

    @GetMapping(value = "/report", produces = "text/markdown")
    public String report(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ReadinessReportRenderer.render(evaluate(from, to));
    }

    private ReadinessSnapshot evaluate(Instant from, Instant to) {
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_WINDOW);
        return evaluator.evaluate(start, end);
    }
}
