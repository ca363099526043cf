package com.profileparser.parser;

import com.profileparser.model.LogMetadata;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Puppet Server log lines written with the default logback layout
 * {@code %d %-5p [%t] [%c{2}] %m%n} into metadata and PROFILE message.
 */
public class LogLineParser {

    // ISO 8601, also accepting a space between date and time and a comma before the fraction
    static final String ISO_8601 = "(?:\\d+)-(?:\\d\\d)-(?:\\d\\d)"
            + "[Tt\\s]"
            + "(?:\\d\\d):(?:\\d\\d):(?:\\d\\d)"
            + "(?:[.,]\\d+)?"
            + "(?:[Zz]|[+-]\\d\\d:\\d\\d)?";

    static final Pattern DEFAULT_LAYOUT = Pattern.compile(
            "^\\s*"
                    + "(?<timestamp>" + ISO_8601 + ")\\s+"
                    + "(?<level>[A-Z]+)\\s+"
                    + "\\[(?<thread>\\S+)]\\s+"
                    + "\\[(?<javaClass>\\S+)]\\s+"
                    + "(?:Puppet\\s+)?PROFILE\\s+\\[(?<requestId>[^\\]]+)]\\s+"
                    + "(?<message>.*)$");

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private final ZoneId zone;

    public LogLineParser() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone zone for timestamps that carry no offset
     */
    public LogLineParser(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @return the parsed line, or empty if it does not follow the layout
     * @throws ProfileParseException if the timestamp matches the layout but is not a valid time
     */
    public Optional<LogLine> parse(String line) {
        Matcher matcher = DEFAULT_LAYOUT.matcher(stripLineEnding(line));
        if (!matcher.matches()) {
            return Optional.empty();
        }

        LogMetadata metadata = LogMetadata.builder()
                .timestamp(parseTimestamp(matcher.group("timestamp")))
                .logLevel(matcher.group("level"))
                .threadId(matcher.group("thread"))
                .javaClass(matcher.group("javaClass"))
                .requestId(matcher.group("requestId"))
                .build();

        return Optional.of(new LogLine(metadata, matcher.group("message")));
    }

    OffsetDateTime parseTimestamp(String value) {
        // The Java %d format prints "2018-02-18 18:43:53,501"
        String normalized = value.toUpperCase(Locale.ROOT).replace(' ', 'T').replace(',', '.');
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            return ((LocalDateTime) parsed).atZone(zone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            throw new ProfileParseException("Invalid timestamp " + value + ": " + e.getMessage(), e);
        }
    }

    private static String stripLineEnding(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
