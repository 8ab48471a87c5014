package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.coursepicker.coursepicker_api.solver.TestCourses.course;
import static org.assertj.core.api.Assertions.assertThat;

class ExactBacktrackingSolverTest {

    private final List<Course> scenarioPool = List.of(
            course("CS101", 3, "mon. 09:00-10:30"),
            course("CS102", 3, "wed. 09:00-10:30"),
            course("CS103", 6, "mon. 09:00-10:30"));

    @Test
    void findsFirstExactSubsetInCandidateOrder() {
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(scenarioPool));

        Optional<List<String>> result = solver.solveExact(scenarioPool, 6);

        assertThat(result).contains(List.of("CS101", "CS102"));
    }

    @Test
    void singleCourseCanCloseTheGap() {
        List<Course> reordered = List.of(scenarioPool.get(2), scenarioPool.get(0), scenarioPool.get(1));
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(reordered));

        assertThat(solver.solveExact(reordered, 6)).contains(List.of("CS103"));
    }

    @Test
    void reportsNothingWhenNoSubsetSumsToTarget() {
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(scenarioPool));

        assertThat(solver.solveExact(scenarioPool, 5)).isEmpty();
        assertThat(solver.solveExact(scenarioPool, 13)).isEmpty();
    }

    @Test
    void clashWithPathLeavesCourseOutInsteadOfFailingTheBranch() {
        List<Course> pool = List.of(
                course("A", 3, "mon. 09:00-10:30"),
                course("B", 3, "mon. 10:00-11:00"),
                course("C", 3, "tue. 09:00-10:30"));
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(pool));

        // failing the whole branch at B would backtrack out of A and report B C
        assertThat(solver.solveExact(pool, 6)).contains(List.of("A", "C"));
    }

    @Test
    void neverReturnsConflictingCourses() {
        List<Course> pool = List.of(
                course("A", 2, "mon. 09:00-10:30"),
                course("B", 2, "mon. 10:00-11:00"),
                course("C", 2, "mon. 10:45-12:00"));
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(pool));

        // A+B and B+C both overlap; only A+C is feasible
        assertThat(solver.solveExact(pool, 4)).contains(List.of("A", "C"));
        assertThat(solver.solveExact(pool, 6)).isEmpty();
    }

    @Test
    void nonPositiveTargetOrEmptyPoolFindsNothing() {
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(scenarioPool));

        assertThat(solver.solveExact(scenarioPool, 0)).isEmpty();
        assertThat(solver.solveExact(scenarioPool, -3)).isEmpty();
        assertThat(solver.solveExact(List.of(), 3)).isEmpty();
    }

    @Test
    void exhaustedBudgetReportsNoSolution() {
        List<Course> pool = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            pool.add(course("E" + i, 2, "mon. " + (6 + i) + ":00-" + (6 + i) + ":30"));
        }
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(pool));
        SearchBudget budget = new SearchBudget(10, 0);

        // odd target with even credits: unreachable, so the search would run long
        assertThat(solver.solveExact(pool, 7, budget)).isEmpty();
        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.tryConsume()).isFalse();
    }

    @Test
    void unlimitedBudgetCompletesTheSameSearch() {
        List<Course> pool = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            pool.add(course("E" + i, 2, "mon. " + (6 + i) + ":00-" + (6 + i) + ":30"));
        }
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(pool));
        SearchBudget budget = SearchBudget.unlimited();

        assertThat(solver.solveExact(pool, 7, budget)).isEmpty();
        assertThat(budget.isExhausted()).isFalse();
        assertThat(solver.solveExact(pool, 8)).contains(List.of("E0", "E1", "E2", "E3"));
    }

    @Test
    void oneSolverServesConcurrentSearches() throws Exception {
        List<Course> pool = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            pool.add(course("P" + i, 1 + i % 3, (i % 2 == 0 ? "mon" : "tue") + ". " + (7 + i) + ":00-" + (8 + i) + ":00"));
        }
        ExactBacktrackingSolver solver = new ExactBacktrackingSolver(ConflictGraph.build(pool));
        Optional<List<String>> expected = solver.solveExact(pool, 9);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Optional<List<String>>>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> solver.solveExact(pool, 9));
            }
            for (Future<Optional<List<String>>> future : executor.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(expected).isPresent();
    }
}
