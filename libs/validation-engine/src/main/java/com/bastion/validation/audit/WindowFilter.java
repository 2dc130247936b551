package com.bastion.validation.audit;

import com.bastion.audit.ComparisonRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class WindowFilter {

    private WindowFilter() {
    }

    static void requireValidWindow(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not precede start");
        }
    }

    static boolean inWindow(ComparisonRecord record, Instant start, Instant end) {
        Instant at = record.recordedAt();
        return at != null && !at.isBefore(start) && at.isBefore(end);
    }

    /** Keeps the first record per request id. */
    static List<ComparisonRecord> dedupe(Iterable<ComparisonRecord> records) {
        Map<String, ComparisonRecord> byRequest = new LinkedHashMap<>();
        for (ComparisonRecord record : records) {
            byRequest.putIfAbsent(record.requestId(), record);
        }
        return new ArrayList<>(byRequest.values());
    }
}
