package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;

import java.util.function.Function;

/**
 * Course attribute a user preference can target.
 */
public enum PreferenceSlot {
    FIELD(Course::getField),
    FORMAT(Course::getFormat);

    private final Function<Course, String> extractor;

    PreferenceSlot(Function<Course, String> extractor) {
        this.extractor = extractor;
    }

    public String valueOf(Course course) {
        return extractor.apply(course);
    }
}
