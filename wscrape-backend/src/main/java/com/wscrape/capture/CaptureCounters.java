package com.wscrape.capture;

import com.wscrape.model.CaptureStatistics;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters updated by the capture thread and read by anyone.
 */
class CaptureCounters {
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicLong recordsParsed = new AtomicLong();
    private final AtomicLong recordsSaved = new AtomicLong();
    private final AtomicLong duplicateRecords = new AtomicLong();
    private final AtomicLong failedRecords = new AtomicLong();
    private volatile OffsetDateTime lastSuccessAt;
    private volatile Long lastCycleDurationMs;

    void cycleSucceeded(int parsed, long durationMs) {
        cycles.incrementAndGet();
        recordsParsed.addAndGet(parsed);
        lastSuccessAt = OffsetDateTime.now();
        lastCycleDurationMs = durationMs;
    }

    void cycleFailed(long durationMs) {
        cycles.incrementAndGet();
        failedCycles.incrementAndGet();
        lastCycleDurationMs = durationMs;
    }

    void recordSaved() {
        recordsSaved.incrementAndGet();
    }

    void recordDuplicate() {
        duplicateRecords.incrementAndGet();
    }

    void recordFailed() {
        failedRecords.incrementAndGet();
    }

    CaptureStatistics snapshot() {
        return CaptureStatistics.builder()
                .cycles(cycles.get())
                .failedCycles(failedCycles.get())
                .recordsParsed(recordsParsed.get())
                .recordsSaved(recordsSaved.get())
                .duplicateRecords(duplicateRecords.get())
                .failedRecords(failedRecords.get())
                .lastSuccessAt(lastSuccessAt)
                .lastCycleDurationMs(lastCycleDurationMs)
                .build();
    }
}
