package com.coursepicker.coursepicker_api.solver.domain;

import java.util.Objects;

/**
 * Closed interval on the week axis, in minutes since Monday 00:00.
 */
public final class TimeInterval {
    private final int start;
    private final int end;

    public TimeInterval(int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException("Interval end must be after start: " + start + "-" + end);
        }
        this.start = start;
        this.end = end;
    }

    // Getters
    public int getStart() { return start; }
    public int getEnd() { return end; }

    /**
     * Overlap length in minutes, zero when the intervals only touch or are disjoint.
     */
    public int overlapMinutes(TimeInterval other) {
        return Math.max(0, Math.min(end, other.end) - Math.max(start, other.start));
    }

    public boolean overlaps(TimeInterval other) {
        return overlapMinutes(other) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeInterval that = (TimeInterval) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
