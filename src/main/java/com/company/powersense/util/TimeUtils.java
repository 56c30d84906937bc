package com.company.powersense.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public class TimeUtils {

    public static final DateTimeFormatter KEY_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    public static final DateTimeFormatter KEY_TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    // 2025-01-31, optionally followed by anything
    private static final Pattern DATE_LIKE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");
    // 13:45 or 13:45:30
    private static final Pattern TIME_LIKE = Pattern.compile("^\\d{2}:\\d{2}(:\\d{2})?$");

    private static final DateTimeFormatter FLEXIBLE_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimeUtils() {
    }

    /**
     * Parse an upstream timestamp into a UTC instant.
     * <p>
     * Accepts ISO-8601 with offset or {@code Z}, ISO local date-time (taken as UTC), the same with a
     * space instead of {@code T}, and a bare ISO date (midnight UTC).
     *
     * @return empty when the text matches none of the accepted forms
     */
    public static Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String s = text.trim().replaceFirst(" ", "T");

        try {
            TemporalAccessor parsed = FLEXIBLE_TIMESTAMP.parseBest(s,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.toInstant());
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isDateLike(String text) {
        return text != null && DATE_LIKE.matcher(text).matches();
    }

    public static boolean isTimeLike(String text) {
        return text != null && TIME_LIKE.matcher(text).matches();
    }

    /**
     * Combine a separate date ({@code yyyy-MM-dd}) and time ({@code HH:mm[:ss]}) into a UTC instant.
     */
    public static Optional<Instant> combineDateAndTime(String date, String time) {
        if (date == null || time == null) {
            return Optional.empty();
        }
        String t = time.trim();
        if (t.length() == 5) {
            t = t + ":00";
        }
        String d = date.trim();
        if (d.length() > 10) {
            d = d.substring(0, 10);
        }
        return parseTimestamp(d + "T" + t + "Z");
    }

    /**
     * Split [start, end) into consecutive half-open windows no longer than {@code step}.
     */
    public static List<Instant[]> chunkTimeRange(Instant start, Instant end, Duration step) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        List<Instant[]> ranges = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            Instant next = cursor.plus(step);
            if (next.isAfter(end)) {
                next = end;
            }
            ranges.add(new Instant[]{cursor, next});
            cursor = next;
        }
        return ranges;
    }

    public static String toIsoSeconds(Instant instant) {
        return ISO_SECONDS.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
