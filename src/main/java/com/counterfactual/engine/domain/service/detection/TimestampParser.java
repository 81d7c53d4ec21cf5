package com.counterfactual.engine.domain.service.detection;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient timestamp parsing shared by schema detection and cleaning. Zone-less values are read in
 * the supplied zone. Numbers are never treated as timestamps.
 */
public final class TimestampParser {

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter SLASH_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy/MM/dd")
            .optionalStart()
            .appendLiteral(' ')
            .appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private static final DateTimeFormatter LOCAL_DATE_TIME_OFFSET = new DateTimeFormatterBuilder()
            .append(LOCAL_DATE_TIME)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();

    private TimestampParser() {
    }

    public static Optional<Instant> parse(Object raw, ZoneId zone) {
        if (raw == null) return Optional.empty();
        if (raw instanceof Instant instant) return Optional.of(instant);
        if (raw instanceof ZonedDateTime zoned) return Optional.of(zoned.toInstant());
        if (raw instanceof OffsetDateTime offset) return Optional.of(offset.toInstant());
        if (raw instanceof LocalDateTime local) return Optional.of(local.atZone(zone).toInstant());
        if (raw instanceof LocalDate date) return Optional.of(date.atStartOfDay(zone).toInstant());
        if (raw instanceof Date date) return Optional.of(date.toInstant());
        if (!(raw instanceof CharSequence)) return Optional.empty();

        String text = raw.toString().trim();
        if (text.isEmpty() || !Character.isDigit(text.charAt(0)) || isPlainNumber(text)) {
            return Optional.empty();
        }
        return parseText(text, zone);
    }

    public static Instant parseRequired(String text, ZoneId zone) {
        return parse(text, zone).orElseThrow(() ->
                new IllegalArgumentException("unparseable timestamp: '" + text + "'"));
    }

    private static Optional<Instant> parseText(String text, ZoneId zone) {
        List<Function<String, Instant>> attempts = List.of(
                Instant::parse,
                t -> OffsetDateTime.parse(t, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
                t -> OffsetDateTime.parse(t, LOCAL_DATE_TIME_OFFSET).toInstant(),
                t -> LocalDateTime.parse(t, LOCAL_DATE_TIME).atZone(zone).toInstant(),
                t -> LocalDate.parse(t, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone).toInstant(),
                t -> LocalDateTime.parse(t, SLASH_DATE_TIME).atZone(zone).toInstant());
        for (Function<String, Instant> attempt : attempts) {
            Optional<Instant> parsed = tryParse(attempt, text);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> attempt, String text) {
        try {
            return Optional.of(attempt.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean isPlainNumber(String text) {
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
