package com.coursepicker.coursepicker_api.solver.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A feasible solution: conflict-free courses whose credits add up exactly to the target.
 */
public final class CourseSelection {
    private final List<SelectedCourse> courses;

    public CourseSelection(List<SelectedCourse> courses) {
        this.courses = List.copyOf(courses);
    }

    public List<SelectedCourse> getCourses() { return courses; }

    public int getTotalCredits() {
        return courses.stream().mapToInt(SelectedCourse::getCredit).sum();
    }

    public Set<String> getCourseNames() {
        return courses.stream().map(SelectedCourse::getName).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        return courses.toString();
    }
}
