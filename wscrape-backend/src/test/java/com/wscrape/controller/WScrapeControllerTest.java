package com.wscrape.controller;

import com.wscrape.capture.CaptureState;
import com.wscrape.capture.WScrape;
import com.wscrape.model.CaptureStatistics;
import com.wscrape.model.LoginEntry;
import com.wscrape.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WScrapeControllerTest {

    private WScrape wScrape;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        wScrape = mock(WScrape.class);
        when(wScrape.getSshHost()).thenReturn("example.org");
        when(wScrape.getState()).thenReturn(CaptureState.RUNNING);
        when(wScrape.getStatistics()).thenReturn(CaptureStatistics.builder().cycles(3).recordsSaved(5).build());
        mockMvc = MockMvcBuilders.standaloneSetup(new WScrapeController(wScrape))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void getStatus_ReturnsStateAndCounters() throws Exception {
        mockMvc.perform(get("/v1/scrape/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ssh_host").value("example.org"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.statistics.cycles").value(3))
                .andExpect(jsonPath("$.statistics.recordsSaved").value(5));
    }

    @Test
    void getLatest_ReturnsLatestBatch() throws Exception {
        when(wScrape.getLatestBatch()).thenReturn(List.of(LoginEntry.builder()
                .recordTime("2024-03-07 10:15:32")
                .user("alice")
                .tty("pts/0")
                .from("10.0.0.5")
                .loginAt("09:00")
                .idle("0.00s")
                .jcpu("0.10s")
                .pcpu("0.01s")
                .what("-bash")
                .build()));

        mockMvc.perform(get("/v1/scrape/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].user").value("alice"))
                .andExpect(jsonPath("$[0].what").value("-bash"));
    }

    @Test
    void start_DelegatesToScraper() throws Exception {
        mockMvc.perform(post("/v1/scrape/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
        verify(wScrape).start();
    }

    @Test
    void start_AfterStop_ReturnsConflict() throws Exception {
        doThrow(new IllegalStateException("Scraper for example.org cannot be started from state STOPPED"))
                .when(wScrape).start();

        mockMvc.perform(post("/v1/scrape/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));
    }

    @Test
    void stop_DelegatesToScraper() throws Exception {
        when(wScrape.getState()).thenReturn(CaptureState.STOPPED);

        mockMvc.perform(post("/v1/scrape/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("STOPPED"));
        verify(wScrape).stop();
    }
}
