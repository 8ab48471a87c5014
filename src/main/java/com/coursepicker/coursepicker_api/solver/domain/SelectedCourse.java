package com.coursepicker.coursepicker_api.solver.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One course inside a returned solution, with the time and credit information the
 * presentation layer shows next to the name.
 */
public final class SelectedCourse {
    private final String name;
    private final List<TimeSlot> timeSlots;
    private final int credit;

    public SelectedCourse(String name, List<TimeSlot> timeSlots, int credit) {
        this.name = name;
        this.timeSlots = List.copyOf(timeSlots);
        this.credit = credit;
    }

    public static SelectedCourse of(Course course) {
        return new SelectedCourse(course.getName(), course.getTimeSlots(), course.getCredit());
    }

    // Getters
    public String getName() { return name; }
    public List<TimeSlot> getTimeSlots() { return timeSlots; }
    public int getCredit() { return credit; }

    public String getDisplayTime() {
        return timeSlots.stream().map(TimeSlot::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "(" + name + ", " + getDisplayTime() + ", " + credit + ")";
    }
}
