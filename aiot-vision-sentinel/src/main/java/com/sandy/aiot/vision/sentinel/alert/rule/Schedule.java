package com.sandy.aiot.vision.sentinel.alert.rule;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Daily active window in local wall-clock time, minute precision, both ends inclusive.
 * When {@code start > end} the window wraps midnight (19:00-07:00).
 */
public record Schedule(LocalTime start, LocalTime end) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public Schedule {
        if (start == null || end == null) throw new InvalidRuleException("schedule needs start and end");
        start = start.truncatedTo(ChronoUnit.MINUTES);
        end = end.truncatedTo(ChronoUnit.MINUTES);
    }

    public static Schedule of(String start, String end) {
        return new Schedule(parse(start, "start"), parse(end, "end"));
    }

    public boolean isOvernight() {
        return start.isAfter(end);
    }

    public boolean contains(LocalTime now) {
        LocalTime t = now.truncatedTo(ChronoUnit.MINUTES);
        if (isOvernight()) {
            return !t.isBefore(start) || !t.isAfter(end);
        }
        return !t.isBefore(start) && !t.isAfter(end);
    }

    public String startText() {
        return HH_MM.format(start);
    }

    public String endText() {
        return HH_MM.format(end);
    }

    private static LocalTime parse(String text, String field) {
        if (text == null || text.isBlank()) throw new InvalidRuleException("schedule." + field + " is required");
        try {
            return LocalTime.parse(text.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new InvalidRuleException("schedule." + field + " must be HH:MM, got '" + text + "'", e);
        }
    }
}
