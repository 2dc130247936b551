package com.bastion.validation.audit;

/**
 * Counters of an {@link AuditRecorder}.
 *
 * @param submitted records handed to the recorder
 * @param appended  records the sink accepted
 * @param retries   append attempts that were retried
 * @param dropped   records given up on after the last retry or rejected by a saturated executor
 */
public record RecorderStats(long submitted, long appended, long retries, long dropped) {

    public long pending() {
        return Math.max(0, submitted - appended - dropped);
    }
}
