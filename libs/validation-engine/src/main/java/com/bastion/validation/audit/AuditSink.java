package com.bastion.validation.audit;

import com.bastion.audit.ComparisonRecord;

import java.time.Instant;
import java.util.List;

/**
 * Durable destination of comparison records.
 *
 * <p>Appends may be retried, so a record can be stored more than once; readers deduplicate by
 * request id.
 */
public interface AuditSink {

    /**
     * @throws AuditSinkException if the record could not be stored
     */
    void appendComparisonRecord(ComparisonRecord record);

    /**
     * Records with {@code start <= recordedAt < end}, one per request id, in append order.
     */
    List<ComparisonRecord> queryWindow(Instant start, Instant end);

    /** Whether the sink can currently accept appends. */
    default boolean healthy() {
        return true;
    }
}
