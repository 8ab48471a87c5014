package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;
import com.coursepicker.coursepicker_api.solver.domain.GreedyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Randomized greedy approximation of a credit target under the conflict relation.
 * <p>
 * Each trial shuffles the candidates, then walks them in order: a course that overlaps something
 * already accepted in the trial is skipped, and the walk stops at the first course that would
 * push the sum past the target. Because the outcome depends heavily on order, several trials are
 * run and the one with the highest sum wins (earliest trial on ties). No optimality guarantee;
 * the exact solver closes whatever gap is left.
 */
public class GreedyRandomizedSelector {

    private static final Logger logger = LoggerFactory.getLogger(GreedyRandomizedSelector.class);

    private final ConflictGraph conflictGraph;
    private final Random random;
    private final int trials;

    public GreedyRandomizedSelector(ConflictGraph conflictGraph, Random random, int trials) {
        if (trials <= 0) {
            throw new IllegalArgumentException("trials must be positive, got " + trials);
        }
        this.conflictGraph = Objects.requireNonNull(conflictGraph, "conflictGraph");
        this.random = Objects.requireNonNull(random, "random");
        this.trials = trials;
    }

    /**
     * The caller's list is not reordered.
     */
    public GreedyResult approximate(List<Course> candidates, int targetCredits) {
        if (candidates.isEmpty() || targetCredits <= 0) {
            return GreedyResult.EMPTY;
        }

        List<Course> order = new ArrayList<>(candidates);
        int bestCredits = 0;
        List<Course> bestAccepted = List.of();

        for (int trial = 0; trial < trials; trial++) {
            Collections.shuffle(order, random);
            List<Course> accepted = new ArrayList<>();
            int sum = 0;
            for (Course course : order) {
                if (conflictGraph.conflictsWithAny(course, accepted)) {
                    continue;
                }
                if (sum + course.getCredit() > targetCredits) {
                    break;
                }
                accepted.add(course);
                sum += course.getCredit();
            }
            if (sum > bestCredits) {
                bestCredits = sum;
                bestAccepted = accepted;
                if (sum == targetCredits) {
                    // later trials can only tie
                    break;
                }
            }
        }

        Set<String> names = new LinkedHashSet<>();
        for (Course course : bestAccepted) {
            names.add(course.getName());
        }
        logger.debug("Greedy over {} candidates reached {}/{} credits with {}", candidates.size(), bestCredits, targetCredits, names);
        return new GreedyResult(bestCredits, names);
    }
}
