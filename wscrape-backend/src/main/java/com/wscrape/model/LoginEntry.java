package com.wscrape.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the {@code w} report, stamped with the capture time.
 *
 * <p>Persisted into the {@code LoginEntry} table keyed by (user, record_time, tty).
 */
@Value
@Builder
public class LoginEntry {
    /**
     * Capture date ({@code yyyy-MM-dd}) followed by the report's {@code HH:mm:ss}, or the date alone
     * when the report header carried no time.
     */
    String recordTime;
    String user;
    String tty;
    String from;
    String loginAt;
    String idle;
    String jcpu;
    String pcpu;
    String what;
}
