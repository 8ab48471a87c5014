package com.coursepicker.coursepicker_api.solver;

/**
 * Tuning knobs for one {@link SelectionOrchestrator}. Immutable.
 */
public final class SolverSettings {

    public static final int DEFAULT_GREEDY_TRIALS = 10;
    public static final int DEFAULT_PASSES = 3;
    public static final int DEFAULT_STAGE_A_MIN_CREDITS = 3;
    public static final long DEFAULT_MAX_SEARCH_STEPS = 2_000_000L;

    private final int greedyTrials;
    private final int passes;
    private final int stageAMinCredits;
    private final long maxSearchSteps;
    private final long maxSearchMillis;

    public SolverSettings(int greedyTrials, int passes, int stageAMinCredits, long maxSearchSteps, long maxSearchMillis) {
        if (greedyTrials <= 0) {
            throw new IllegalArgumentException("greedyTrials must be positive, got " + greedyTrials);
        }
        if (passes <= 0) {
            throw new IllegalArgumentException("passes must be positive, got " + passes);
        }
        if (stageAMinCredits < 0) {
            throw new IllegalArgumentException("stageAMinCredits must not be negative, got " + stageAMinCredits);
        }
        this.greedyTrials = greedyTrials;
        this.passes = passes;
        this.stageAMinCredits = stageAMinCredits;
        this.maxSearchSteps = maxSearchSteps;
        this.maxSearchMillis = maxSearchMillis;
    }

    public static SolverSettings defaults() {
        return new SolverSettings(DEFAULT_GREEDY_TRIALS, DEFAULT_PASSES, DEFAULT_STAGE_A_MIN_CREDITS,
                DEFAULT_MAX_SEARCH_STEPS, 0L);
    }

    public int getGreedyTrials() { return greedyTrials; }
    public int getPasses() { return passes; }
    public int getStageAMinCredits() { return stageAMinCredits; }
    /** Zero or negative means unlimited. */
    public long getMaxSearchSteps() { return maxSearchSteps; }
    /** Zero or negative means unlimited. */
    public long getMaxSearchMillis() { return maxSearchMillis; }

    public SearchBudget newSearchBudget() {
        return new SearchBudget(maxSearchSteps, maxSearchMillis);
    }

    @Override
    public String toString() {
        return "SolverSettings{" +
               "greedyTrials=" + greedyTrials +
               ", passes=" + passes +
               ", stageAMinCredits=" + stageAMinCredits +
               ", maxSearchSteps=" + maxSearchSteps +
               ", maxSearchMillis=" + maxSearchMillis +
               '}';
    }
}
