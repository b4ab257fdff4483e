package com.wscrape.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Point-in-time view of capture loop counters.
 */
@Data
@Builder
public class CaptureStatistics {
    private long cycles;
    private long failedCycles;
    private long recordsParsed;
    private long recordsSaved;
    private long duplicateRecords;
    private long failedRecords;
    private OffsetDateTime lastSuccessAt;
    private Long lastCycleDurationMs;
}
