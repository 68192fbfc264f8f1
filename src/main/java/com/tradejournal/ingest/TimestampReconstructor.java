package com.tradejournal.ingest;

import com.tradejournal.config.ImportConfig;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs a row's entry instant from whichever timestamp column the broker exported.
 *
 * <p>Candidate columns are tried in a fixed order; the first one that parses wins. When none
 * parses, a separate {@code date} and {@code time} pair is joined and tried. Values without an
 * explicit zone are read as UTC. Results carry millisecond precision.
 */
@Component
public class TimestampReconstructor {

    private static final Logger log = LoggerFactory.getLogger(TimestampReconstructor.class);

    static final List<String> TIMESTAMP_COLUMNS = List.of(
            "entry_ts",
            "timestamp",
            "fill_time",
            "closing_time",
            "placing_time",
            "close_time",
            "open_time",
            "trade_time");

    private static final DateTimeFormatter ISO_WITH_ZONE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final List<DateTimeFormatter> fallbackFormats;

    public TimestampReconstructor(ImportConfig importConfig) {
        this.fallbackFormats = importConfig.getTimestampPatterns().stream()
                .map(pattern -> DateTimeFormatter.ofPattern(pattern, Locale.ROOT))
                .toList();
    }

    /**
     * Returns the first parseable timestamp among the known columns, then the date/time pair.
     */
    public Optional<Instant> reconstruct(RawRecord record) {
        for (String column : TIMESTAMP_COLUMNS) {
            Optional<Instant> parsed = record.get(column).flatMap(this::parse);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Optional<String> date = record.get("date");
        Optional<String> time = record.get("time");
        if (date.isPresent() && time.isPresent()) {
            return parse(date.get() + " " + time.get());
        }
        return Optional.empty();
    }

    /**
     * Parses one timestamp cell. A single space between date and time is accepted in place of
     * 'T', and a missing zone designator means UTC. An explicit offset is honoured.
     */
    public Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        String isoCandidate = trimmed.indexOf('T') >= 0 ? trimmed : trimmed.replaceFirst(" ", "T");
        String withZone = isoCandidate.endsWith("Z") || isoCandidate.endsWith("z") ? isoCandidate : isoCandidate + "Z";
        for (String candidate : List.of(withZone, isoCandidate)) {
            try {
                return Optional.of(truncate(OffsetDateTime.parse(candidate, ISO_WITH_ZONE).toInstant()));
            } catch (DateTimeParseException e) {
                log.trace("Not an ISO timestamp: value={}", candidate);
            }
        }
        for (DateTimeFormatter format : fallbackFormats) {
            try {
                return Optional.of(truncate(LocalDateTime.parse(trimmed, format).toInstant(ZoneOffset.UTC)));
            } catch (DateTimeParseException e) {
                log.trace("Timestamp did not match pattern: value={}, pattern={}", trimmed, format);
            }
        }
        log.debug("Unparseable timestamp ignored: value={}", trimmed);
        return Optional.empty();
    }

    public static String formatDate(Instant instant) {
        return DATE_FORMAT.format(instant);
    }

    public static String formatTime(Instant instant) {
        return TIME_FORMAT.format(instant);
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
