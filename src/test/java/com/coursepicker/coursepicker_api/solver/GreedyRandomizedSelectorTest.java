package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.TestCourses.IdentityShuffleRandom;
import com.coursepicker.coursepicker_api.solver.domain.Course;
import com.coursepicker.coursepicker_api.solver.domain.GreedyResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.coursepicker.coursepicker_api.solver.TestCourses.course;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GreedyRandomizedSelectorTest {

    @Test
    void emptyCandidatesYieldZeroWithoutTrials() {
        ConflictGraph graph = ConflictGraph.build(List.of());
        GreedyRandomizedSelector selector = new GreedyRandomizedSelector(graph, new Random(1), 10);

        GreedyResult result = selector.approximate(List.of(), 6);

        assertThat(result.getAchievedCredits()).isZero();
        assertThat(result.getChosenNames()).isEmpty();
    }

    @Test
    void neverAcceptsTwoConflictingCourses() {
        List<Course> pool = List.of(
                course("A", 3, "mon. 09:00-10:30"),
                course("B", 3, "mon. 09:00-10:30"),
                course("C", 3, "tue. 09:00-10:30"));
        ConflictGraph graph = ConflictGraph.build(pool);

        for (long seed = 0; seed < 20; seed++) {
            GreedyResult result = new GreedyRandomizedSelector(graph, new Random(seed), 10).approximate(pool, 6);

            assertThat(result.getAchievedCredits()).isEqualTo(6);
            assertThat(result.getChosenNames()).hasSize(2).contains("C");
            assertThat(result.getChosenNames().containsAll(List.of("A", "B"))).isFalse();
        }
    }

    @Test
    void stopsAtFirstCourseThatDoesNotFit() {
        List<Course> pool = List.of(
                course("G", 1, "mon. 09:00-10:00"),
                course("F", 5, "tue. 09:00-10:00"),
                course("H", 4, "wed. 09:00-10:00"));
        ConflictGraph graph = ConflictGraph.build(pool);
        GreedyRandomizedSelector selector = new GreedyRandomizedSelector(graph, new IdentityShuffleRandom(), 1);

        GreedyResult result = selector.approximate(pool, 5);

        // G fits, F does not and ends the walk before H is looked at
        assertThat(result.getAchievedCredits()).isEqualTo(1);
        assertThat(result.getChosenNames()).containsExactly("G");
    }

    @Test
    void conflictsAreCheckedAgainstAcceptedCoursesOnly() {
        List<Course> pool = List.of(
                course("A", 3, "mon. 09:00-10:00"),
                course("B", 3, "mon. 09:30-11:00"),
                course("C", 3, "mon. 10:30-12:00"));
        ConflictGraph graph = ConflictGraph.build(pool);
        GreedyRandomizedSelector selector = new GreedyRandomizedSelector(graph, new IdentityShuffleRandom(), 1);

        GreedyResult result = selector.approximate(pool, 9);

        // B is skipped because of A; C only overlaps the skipped B
        assertThat(result.getChosenNames()).containsExactly("A", "C");
        assertThat(result.getAchievedCredits()).isEqualTo(6);
    }

    @Test
    void doesNotReorderCallersList() {
        List<Course> pool = new ArrayList<>(List.of(
                course("A", 1, "mon. 09:00-10:00"),
                course("B", 1, "tue. 09:00-10:00"),
                course("C", 1, "wed. 09:00-10:00"),
                course("D", 1, "thur. 09:00-10:00")));
        List<Course> before = List.copyOf(pool);
        ConflictGraph graph = ConflictGraph.build(pool);

        new GreedyRandomizedSelector(graph, new Random(7), 10).approximate(pool, 2);

        assertThat(pool).containsExactlyElementsOf(before);
    }

    @Test
    void sameSeedSameResult() {
        List<Course> pool = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            pool.add(course("C" + i, 1 + i % 4, (i % 2 == 0 ? "mon" : "tue") + ". " + (8 + i) + ":00-" + (9 + i) + ":30"));
        }
        ConflictGraph graph = ConflictGraph.build(pool);

        GreedyResult first = new GreedyRandomizedSelector(graph, new Random(99), 10).approximate(pool, 10);
        GreedyResult second = new GreedyRandomizedSelector(graph, new Random(99), 10).approximate(pool, 10);

        assertThat(first.getAchievedCredits()).isEqualTo(second.getAchievedCredits());
        assertThat(first.getChosenNames()).containsExactlyElementsOf(second.getChosenNames());
    }

    @Test
    void rejectsNonPositiveTrialCount() {
        ConflictGraph graph = ConflictGraph.build(List.of());

        assertThatThrownBy(() -> new GreedyRandomizedSelector(graph, new Random(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void earliestTrialWinsAmongEqualSums() {
        List<Course> pool = List.of(
                course("A", 3, "mon. 09:00-10:30"),
                course("B", 3, "tue. 09:00-10:30"),
                course("C", 3, "wed. 09:00-10:30"));
        ConflictGraph graph = ConflictGraph.build(pool);
        // trial 1 keeps A B C, trial 2 swaps the first and last course: C B A
        ScriptedRandom random = new ScriptedRandom(2, 1, 0, 1);

        GreedyResult result = new GreedyRandomizedSelector(graph, random, 2).approximate(pool, 7);

        // both trials reach 6 of 7, the later one must not replace the first
        assertThat(result.getAchievedCredits()).isEqualTo(6);
        assertThat(result.getChosenNames()).containsExactly("A", "B");
        assertThat(random.calls()).isEqualTo(4);
    }

    @Test
    void hittingTheTargetEndsTheTrials() {
        List<Course> pool = List.of(
                course("A", 3, "mon. 09:00-10:30"),
                course("B", 3, "tue. 09:00-10:30"),
                course("C", 3, "wed. 09:00-10:30"));
        ConflictGraph graph = ConflictGraph.build(pool);
        ScriptedRandom random = new ScriptedRandom(2, 1, 0, 1);

        GreedyResult result = new GreedyRandomizedSelector(graph, random, 5).approximate(pool, 6);

        assertThat(result.getChosenNames()).containsExactly("A", "B");
        // only the first trial shuffled
        assertThat(random.calls()).isEqualTo(2);
    }

    /**
     * Replays fixed {@code nextInt} answers, so each {@code Collections.shuffle} call produces a
     * chosen order.
     */
    private static final class ScriptedRandom extends Random {
        private final int[] answers;
        private int next;

        ScriptedRandom(int... answers) {
            this.answers = answers;
        }

        @Override
        public int nextInt(int bound) {
            int answer = answers[next++];
            if (answer >= bound) {
                throw new IllegalStateException("Scripted value " + answer + " is out of range for bound " + bound);
            }
            return answer;
        }

        int calls() {
            return next;
        }
    }
}
