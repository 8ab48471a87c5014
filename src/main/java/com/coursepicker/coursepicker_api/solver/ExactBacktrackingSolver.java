package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Depth-first include/exclude search for a conflict-free subset whose credits sum exactly to a
 * target. Exponential in the worst case; meant for the residual gap left by the greedy stages.
 * <p>
 * All search state lives in a {@link Search} created per call, so one solver instance can be
 * used by concurrent or nested callers.
 */
public class ExactBacktrackingSolver {

    private static final Logger logger = LoggerFactory.getLogger(ExactBacktrackingSolver.class);

    private final ConflictGraph conflictGraph;

    public ExactBacktrackingSolver(ConflictGraph conflictGraph) {
        this.conflictGraph = Objects.requireNonNull(conflictGraph, "conflictGraph");
    }

    public Optional<List<String>> solveExact(List<Course> candidates, int targetCredits) {
        return solveExact(candidates, targetCredits, SearchBudget.unlimited());
    }

    /**
     * Returns the names of the first exact subset found, in candidate order, or empty when none
     * exists or the budget ran out first.
     */
    public Optional<List<String>> solveExact(List<Course> candidates, int targetCredits, SearchBudget budget) {
        if (targetCredits <= 0 || candidates.isEmpty()) {
            return Optional.empty();
        }
        Search search = new Search(candidates, targetCredits, budget);
        if (!search.run(0, 0)) {
            if (budget.isExhausted()) {
                logger.warn("Exact search gave up after {} steps ({} candidates, target {})",
                        budget.getSteps(), candidates.size(), targetCredits);
            }
            return Optional.empty();
        }
        List<String> names = new ArrayList<>(search.path.size());
        for (Course course : search.path) {
            names.add(course.getName());
        }
        logger.debug("Exact search hit {} credits with {} after {} steps", targetCredits, names, budget.getSteps());
        return Optional.of(names);
    }

    private final class Search {
        private final List<Course> courses;
        private final int target;
        private final SearchBudget budget;
        // suffixCredits[i] = credits of courses[i..n)
        private final int[] suffixCredits;
        private final List<Course> path = new ArrayList<>();

        Search(List<Course> courses, int target, SearchBudget budget) {
            this.courses = List.copyOf(courses);
            this.target = target;
            this.budget = budget;
            this.suffixCredits = new int[this.courses.size() + 1];
            for (int i = this.courses.size() - 1; i >= 0; i--) {
                suffixCredits[i] = suffixCredits[i + 1] + this.courses.get(i).getCredit();
            }
        }

        boolean run(int index, int sum) {
            if (!budget.tryConsume()) {
                return false;
            }
            if (index == courses.size() || sum + suffixCredits[index] < target) {
                return false;
            }

            Course current = courses.get(index);
            int withCurrent = sum + current.getCredit();
            // a course clashing with the path is only left out; the exclude branch below still runs
            if (withCurrent <= target && !conflictGraph.conflictsWithAny(current, path)) {
                path.add(current);
                if (withCurrent == target || run(index + 1, withCurrent)) {
                    return true;
                }
                path.remove(path.size() - 1);
                if (budget.isExhausted()) {
                    return false;
                }
            }
            return run(index + 1, sum);
        }
    }
}
