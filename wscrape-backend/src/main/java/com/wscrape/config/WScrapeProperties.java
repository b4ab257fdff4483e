package com.wscrape.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Settings for one {@link com.wscrape.capture.WScrape} instance.
 */
@Data
@Builder
public class WScrapeProperties {
    /** JDBC URL of the store. */
    private String sqlUrl;
    /** SSH host; the port is always 22. */
    private String sshHost;
    /** Delay between the end of one capture and the start of the next, in milliseconds. */
    private long captureIntervalMs;
    /** {@link Login} JSON file for the store. */
    private Path sqlLoginFile;
    /** {@link Login} JSON file for SSH. */
    private Path sshLoginFile;
    @Builder.Default
    private int sshConnectTimeoutMs = 10_000;
    /** Upper bound on one run of the status command, from channel open to close. */
    @Builder.Default
    private long commandTimeoutMs = 60_000;
    /** Interval between SSH keepalive messages. */
    @Builder.Default
    private int sshServerAliveIntervalMs = 15_000;
    /** Unanswered keepalives after which the session is dropped. */
    @Builder.Default
    private int sshServerAliveCountMax = 3;
}
