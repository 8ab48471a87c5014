package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.coursepicker.coursepicker_api.solver.TestCourses.course;
import static org.assertj.core.api.Assertions.assertThat;

class PreferenceFilterTest {

    private final List<Course> pool = List.of(
            course("Dialog Systems", 6, "Computational Linguistics", "Lecture", "mon. 09:00-10:30"),
            course("Team Lab", 9, "Speech Technology", "Project", "tue. 09:00-12:00"),
            course("Deep Learning", 3, "Machine Learning", "Seminar", "wed. 09:00-10:30"),
            course("Parsing", 3, "computational linguistics", "Seminar", "thur. 09:00-10:30")
    );

    @Test
    void matchesCaseInsensitiveSubstrings() {
        Set<String> matches = PreferenceFilter.filterByPreference(pool, PreferenceSlot.FIELD, List.of("LINGUISTICS"));

        assertThat(matches).containsExactly("Dialog Systems", "Parsing");
    }

    @Test
    void anyTermIsEnough() {
        Set<String> matches = PreferenceFilter.filterByPreference(pool, PreferenceSlot.FORMAT, List.of("project", "seminar"));

        assertThat(matches).containsExactlyInAnyOrder("Team Lab", "Deep Learning", "Parsing");
    }

    @Test
    void noTermsMeansNoMatches() {
        assertThat(PreferenceFilter.filterByPreference(pool, PreferenceSlot.FIELD, List.of())).isEmpty();
        assertThat(PreferenceFilter.filterByPreference(pool, PreferenceSlot.FIELD, null)).isEmpty();
        assertThat(PreferenceFilter.filterByPreference(pool, null, List.of("Lecture"))).isEmpty();
    }

    @Test
    void emptyAttributeNeverMatches() {
        List<Course> bare = List.of(course("Anonymous", 3, "mon. 09:00-10:00"));

        assertThat(PreferenceFilter.filterByPreference(bare, PreferenceSlot.FORMAT, List.of("lecture"))).isEmpty();
    }
}
