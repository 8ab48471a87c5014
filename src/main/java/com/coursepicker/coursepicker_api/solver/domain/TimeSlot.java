package com.coursepicker.coursepicker_api.solver.domain;

import java.util.Objects;

/**
 * One parsed entry of a weekly time pattern, e.g. {@code wed. 09:00-10:30}.
 * Keeps the text the user typed next to the interval it maps to, since the
 * presentation layer shows the former and the solver only looks at the latter.
 */
public final class TimeSlot {
    private final String day;
    private final String duration;
    private final TimeInterval interval;

    public TimeSlot(String day, String duration, TimeInterval interval) {
        this.day = Objects.requireNonNull(day, "day");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    // Getters
    public String getDay() { return day; }
    public String getDuration() { return duration; }
    public TimeInterval getInterval() { return interval; }
    public int getStartMinute() { return interval.getStart(); }
    public int getEndMinute() { return interval.getEnd(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSlot timeSlot = (TimeSlot) o;
        return day.equals(timeSlot.day) && duration.equals(timeSlot.duration) && interval.equals(timeSlot.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, duration, interval);
    }

    @Override
    public String toString() {
        return day + ". " + duration;
    }
}
