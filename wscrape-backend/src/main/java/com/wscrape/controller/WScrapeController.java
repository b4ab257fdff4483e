package com.wscrape.controller;

import com.wscrape.api.ScrapeStatusResponse;
import com.wscrape.capture.WScrape;
import com.wscrape.model.LoginEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/scrape")
public class WScrapeController {

    private final WScrape wScrape;

    public WScrapeController(WScrape wScrape) {
        this.wScrape = wScrape;
    }

    /**
     * GET /v1/scrape/status
     *
     * @return lifecycle state and capture counters
     */
    @GetMapping("/status")
    public ResponseEntity<ScrapeStatusResponse> getStatus() {
        return ResponseEntity.ok(buildStatus());
    }

    /**
     * GET /v1/scrape/latest
     *
     * @return entries from the most recent successful capture
     */
    @GetMapping("/latest")
    public ResponseEntity<List<LoginEntry>> getLatest() {
        return ResponseEntity.ok(wScrape.getLatestBatch());
    }

    /**
     * POST /v1/scrape/start
     *
     * @return status after starting; 409 if the scraper was already stopped or disposed
     */
    @PostMapping("/start")
    public ResponseEntity<ScrapeStatusResponse> start() {
        wScrape.start();
        return ResponseEntity.ok(buildStatus());
    }

    /**
     * POST /v1/scrape/stop
     *
     * @return status after stopping
     */
    @PostMapping("/stop")
    public ResponseEntity<ScrapeStatusResponse> stop() {
        wScrape.stop();
        return ResponseEntity.ok(buildStatus());
    }

    private ScrapeStatusResponse buildStatus() {
        return ScrapeStatusResponse.builder()
                .sshHost(wScrape.getSshHost())
                .status(wScrape.getState().name())
                .statistics(wScrape.getStatistics())
                .build();
    }
}
