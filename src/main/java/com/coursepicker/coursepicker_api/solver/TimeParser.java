package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.exception.TimeFormatException;
import com.coursepicker.coursepicker_api.solver.domain.TimeInterval;
import com.coursepicker.coursepicker_api.solver.domain.TimeSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses weekly time patterns of the form {@code "<day>. <hh:mm>-<hh:mm>"}, several entries
 * separated by {@code ';'}, into intervals on a single minutes-since-Monday-00:00 axis.
 */
public final class TimeParser {

    public static final int MINUTES_PER_DAY = 24 * 60;
    public static final String ENTRY_SEPARATOR = ";";

    // day token -> index in the week; thu/thurs accepted next to thur
    private static final Map<String, Integer> DAY_INDEX = Map.of(
            "mon", 0,
            "tue", 1,
            "wed", 2,
            "thur", 3,
            "thu", 3,
            "thurs", 3,
            "fri", 4,
            "sat", 5,
            "sun", 6
    );
    private static final String[] CANONICAL_DAYS = {"mon", "tue", "wed", "thur", "fri", "sat", "sun"};

    private TimeParser() {
    }

    /**
     * Parses a non-empty pattern. Fails on the first malformed entry.
     *
     * @throws TimeFormatException if the pattern is blank or any entry is malformed
     */
    public static List<TimeSlot> parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new TimeFormatException(String.valueOf(pattern), "time pattern is empty");
        }
        List<TimeSlot> slots = new ArrayList<>();
        for (String rawEntry : pattern.split(ENTRY_SEPARATOR, -1)) {
            slots.add(parseEntry(rawEntry));
        }
        return slots;
    }

    /**
     * Same as {@link #parse(String)}, except that a null or blank pattern yields no slots.
     * Used for the busy schedule, which may legitimately be empty.
     */
    public static List<TimeSlot> parseOptional(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return List.of();
        }
        return parse(pattern);
    }

    public static List<TimeInterval> parseIntervals(String pattern) {
        List<TimeInterval> intervals = new ArrayList<>();
        for (TimeSlot slot : parse(pattern)) {
            intervals.add(slot.getInterval());
        }
        return intervals;
    }

    static TimeSlot parseEntry(String rawEntry) {
        String entry = rawEntry.trim().toLowerCase(Locale.ROOT);
        if (entry.isEmpty()) {
            throw new TimeFormatException(rawEntry, "empty entry");
        }

        int dot = entry.indexOf('.');
        if (dot < 0) {
            throw new TimeFormatException(rawEntry, "missing '.' between day and duration");
        }
        String dayToken = entry.substring(0, dot).trim();
        String duration = entry.substring(dot + 1).trim();

        Integer dayIndex = DAY_INDEX.get(dayToken);
        if (dayIndex == null) {
            throw new TimeFormatException(rawEntry, "unknown day '" + dayToken + "'");
        }

        String[] bounds = duration.split("-", -1);
        if (bounds.length != 2) {
            throw new TimeFormatException(rawEntry, "duration must look like hh:mm-hh:mm");
        }
        int startClock = clockToMinutes(bounds[0], rawEntry);
        int endClock = clockToMinutes(bounds[1], rawEntry);
        if (endClock <= startClock) {
            throw new TimeFormatException(rawEntry, "end time must be after start time");
        }

        int offset = dayIndex * MINUTES_PER_DAY;
        TimeInterval interval = new TimeInterval(offset + startClock, offset + endClock);
        return new TimeSlot(CANONICAL_DAYS[dayIndex], bounds[0].trim() + "-" + bounds[1].trim(), interval);
    }

    /**
     * Maps {@code h:mm} / {@code hh:mm} to minutes after midnight. {@code 24:00} is allowed.
     */
    static int clockToMinutes(String clock, String rawEntry) {
        String[] parts = clock.trim().split(":", -1);
        if (parts.length != 2) {
            throw new TimeFormatException(rawEntry, "clock value '" + clock.trim() + "' is not hh:mm");
        }
        int hours;
        int minutes;
        try {
            hours = Integer.parseInt(parts[0].trim());
            minutes = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new TimeFormatException(rawEntry, "clock value '" + clock.trim() + "' is not numeric", e);
        }
        if (hours < 0 || hours > 24 || minutes < 0 || minutes > 59 || (hours == 24 && minutes != 0)) {
            throw new TimeFormatException(rawEntry, "clock value '" + clock.trim() + "' is out of range");
        }
        return hours * 60 + minutes;
    }
}
