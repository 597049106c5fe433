package com.railwise.backend.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses published clock strings such as {@code "7:05 am BST"}. Times carry
 * no date; callers anchor them on the current service day.
 */
@Slf4j
public final class ScheduleTimeUtils {

    public static final String NOT_APPLICABLE = "---";

    private static final DateTimeFormatter CLOCK_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm a")
            .toFormatter(Locale.ENGLISH);

    private ScheduleTimeUtils() {
    }

    public static Optional<LocalTime> parse(String clock) {
        if (clock == null || clock.isBlank() || NOT_APPLICABLE.equals(clock.trim())) {
            return Optional.empty();
        }
        String timePart = clock.replaceAll("(?i)\\s*BST\\s*$", "").trim();
        try {
            return Optional.of(LocalTime.parse(timePart, CLOCK_FORMAT));
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Unparseable clock time '{}'", clock);
            return Optional.empty();
        }
    }

    public static Optional<LocalDateTime> parseOn(String clock, LocalDate day) {
        return parse(clock).map(day::atTime);
    }
}
