package com.wscrape.parser;

import com.wscrape.model.LoginEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text report printed by {@code w} into {@link LoginEntry} rows.
 *
 * <p>The first line is the uptime summary, which is only consulted for its {@code HH:MM:SS} time of day.
 * The second line holds column headers. Every following line that has at least eight whitespace separated
 * columns becomes an entry; the last column keeps the remainder of the line. Anything else is dropped.
 *
 * <p>The date part of {@link LoginEntry#getRecordTime()} comes from the local clock, not the remote host.
 */
public class WOutputParser {
    private static final Logger log = LoggerFactory.getLogger(WOutputParser.class);

    private static final Pattern TIME_OF_DAY_PATTERN = Pattern.compile("(\\d{2}:\\d{2}:\\d{2})");
    private static final Pattern ROW_PATTERN = Pattern.compile(
            "(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(.+)");
    private static final Pattern LINE_SEPARATOR = Pattern.compile("\r?\n");
    private static final int HEADER_LINES = 2;

    private final Clock clock;

    public WOutputParser() {
        this(Clock.systemDefaultZone());
    }

    public WOutputParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parses a report using the parser's clock for the capture date.
     *
     * @param rawOutput verbatim {@code w} output
     * @return parsed entries in report order
     */
    public List<LoginEntry> parse(String rawOutput) {
        return parse(rawOutput, LocalDateTime.now(clock));
    }

    /**
     * Parses a report using an explicit capture time.
     *
     * @param rawOutput verbatim {@code w} output, may be null
     * @param now capture wall-clock time; only its date is used
     * @return parsed entries in report order, never null
     */
    public List<LoginEntry> parse(String rawOutput, LocalDateTime now) {
        if (rawOutput == null || rawOutput.isEmpty()) {
            return List.of();
        }

        String[] lines = LINE_SEPARATOR.split(rawOutput, -1);
        String recordTime = buildRecordTime(now, findTimeOfDay(lines[0]));

        List<LoginEntry> entries = new ArrayList<>();
        int dropped = 0;
        for (int i = HEADER_LINES; i < lines.length; i++) {
            Matcher m = ROW_PATTERN.matcher(lines[i]);
            if (!m.find()) {
                dropped++;
                continue;
            }
            entries.add(LoginEntry.builder()
                    .recordTime(recordTime)
                    .user(m.group(1))
                    .tty(m.group(2))
                    .from(m.group(3))
                    .loginAt(m.group(4))
                    .idle(m.group(5))
                    .jcpu(m.group(6))
                    .pcpu(m.group(7))
                    .what(m.group(8))
                    .build());
        }

        if (dropped > 0) {
            log.debug("Dropped {} unparseable line(s) from w output", dropped);
        }
        return entries;
    }

    private static String findTimeOfDay(String summaryLine) {
        Matcher m = TIME_OF_DAY_PATTERN.matcher(summaryLine);
        return m.find() ? m.group(1) : null;
    }

    private static String buildRecordTime(LocalDateTime now, String timeOfDay) {
        String date = DateTimeFormatter.ISO_LOCAL_DATE.format(now);
        if (timeOfDay == null) {
            return date;
        }
        return date + " " + timeOfDay;
    }
}
