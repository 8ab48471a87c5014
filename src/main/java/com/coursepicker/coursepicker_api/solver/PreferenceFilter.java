package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class PreferenceFilter {

    private PreferenceFilter() {
    }

    /**
     * Names of the courses whose {@code slot} value contains, case-insensitively, at least one
     * of {@code terms}. No terms means no preference was expressed, so nothing matches.
     */
    public static Set<String> filterByPreference(List<Course> courses, PreferenceSlot slot, Collection<String> terms) {
        Set<String> matches = new LinkedHashSet<>();
        if (slot == null || terms == null || terms.isEmpty()) {
            return matches;
        }
        List<String> needles = terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        for (Course course : courses) {
            String value = slot.valueOf(course);
            if (value == null || value.isEmpty()) {
                continue;
            }
            String haystack = value.toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (haystack.contains(needle)) {
                    matches.add(course.getName());
                    break;
                }
            }
        }
        return matches;
    }
}
