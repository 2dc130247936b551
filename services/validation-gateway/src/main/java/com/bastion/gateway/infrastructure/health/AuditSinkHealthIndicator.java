package com.bastion.gateway.infrastructure.health;

import com.bastion.validation.audit.AuditRecorder;
import com.bastion.validation.audit.RecorderStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Audit pipeline health. A sink that cannot accept appends is DOWN; dropped records alone only
 * show up as details, since validation keeps working without them.
 */
@Component
public class AuditSinkHealthIndicator implements HealthIndicator {

    private final AuditRecorder recorder;

    public AuditSinkHealthIndicator(AuditRecorder recorder) {
        this.recorder = recorder;
    }

    @Override
    public Health health() {
        RecorderStats stats = recorder.stats();
        Health.Builder builder = recorder.sink().healthy() ? Health.up() : Health.down();
        return builder
                .withDetail("sink", recorder.sink().getClass().getSimpleName())
                .withDetail("appended", stats.appended())
                .withDetail("dropped", stats.dropped())
                .withDetail("pending", stats.pending())
                .build();
    }
}
