package com.wscrape.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wscrape.model.CaptureStatistics;
import lombok.Builder;
import lombok.Data;

/**
 * Response payload that describes the scraper's lifecycle state and counters.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScrapeStatusResponse {
    private String sshHost;
    private String status;
    private CaptureStatistics statistics;
}
