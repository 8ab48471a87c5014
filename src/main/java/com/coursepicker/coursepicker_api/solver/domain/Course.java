package com.coursepicker.coursepicker_api.solver.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Normalized candidate course. Created once per candidate pool and never mutated.
 */
public final class Course {
    private final String name;
    private final int credit;
    private final String field;
    private final String format;
    private final List<TimeSlot> timeSlots;

    public Course(String name, int credit, String field, String format, List<TimeSlot> timeSlots) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Course name must not be empty.");
        }
        if (credit <= 0) {
            throw new IllegalArgumentException("Course " + name + " has non-positive credit " + credit + ".");
        }
        this.name = name;
        this.credit = credit;
        this.field = field == null ? "" : field;
        this.format = format == null ? "" : format;
        this.timeSlots = List.copyOf(timeSlots);
    }

    // Getters
    public String getName() { return name; }
    public int getCredit() { return credit; }
    public String getField() { return field; }
    public String getFormat() { return format; }
    public List<TimeSlot> getTimeSlots() { return timeSlots; }

    public List<TimeInterval> getIntervals() {
        return timeSlots.stream().map(TimeSlot::getInterval).collect(Collectors.toList());
    }

    public String getDisplayTime() {
        return timeSlots.stream().map(TimeSlot::toString).collect(Collectors.joining("; "));
    }

    // Names are unique within a candidate pool
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Course) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Course{" +
               "name='" + name + '\'' +
               ", credit=" + credit +
               ", field='" + field + '\'' +
               ", format='" + format + '\'' +
               ", time='" + getDisplayTime() + '\'' +
               '}';
    }
}
