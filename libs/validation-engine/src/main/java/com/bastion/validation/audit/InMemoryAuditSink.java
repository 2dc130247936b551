package com.bastion.validation.audit;

import com.bastion.audit.ComparisonRecord;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only in-memory sink. Stores duplicates as given and removes them on read.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<ComparisonRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void appendComparisonRecord(ComparisonRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        records.add(record);
    }

    @Override
    public List<ComparisonRecord> queryWindow(Instant start, Instant end) {
        WindowFilter.requireValidWindow(start, end);
        return WindowFilter.dedupe(records.stream()
                .filter(r -> WindowFilter.inWindow(r, start, end))
                .toList());
    }

    /** Number of appends, duplicates included. */
    public int rawSize() {
        return records.size();
    }
}
