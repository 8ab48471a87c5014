package com.coursepicker.coursepicker_api.solver.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Best trial of a greedy approximation: the credits it reached and the courses it accepted,
 * in acceptance order.
 */
public final class GreedyResult {
    public static final GreedyResult EMPTY = new GreedyResult(0, Set.of());

    private final int achievedCredits;
    private final Set<String> chosenNames;

    public GreedyResult(int achievedCredits, Set<String> chosenNames) {
        this.achievedCredits = achievedCredits;
        this.chosenNames = Collections.unmodifiableSet(new LinkedHashSet<>(chosenNames));
    }

    public int getAchievedCredits() { return achievedCredits; }
    public Set<String> getChosenNames() { return chosenNames; }

    @Override
    public String toString() {
        return "GreedyResult{credits=" + achievedCredits + ", names=" + chosenNames + '}';
    }
}
