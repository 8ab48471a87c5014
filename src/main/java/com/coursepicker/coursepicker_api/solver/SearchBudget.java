package com.coursepicker.coursepicker_api.solver;

/**
 * Step and wall-clock allowance for one exact search. A fresh budget is created for every
 * search call; it is not thread-safe and must not be shared.
 */
public final class SearchBudget {

    private final long maxSteps;
    private final long deadlineMs;
    private long steps;
    private boolean exhausted;

    public SearchBudget(long maxSteps, long maxMillis) {
        this.maxSteps = maxSteps;
        this.deadlineMs = maxMillis > 0 ? System.currentTimeMillis() + maxMillis : Long.MAX_VALUE;
    }

    public static SearchBudget unlimited() {
        return new SearchBudget(0L, 0L);
    }

    /**
     * Charges one search step. Returns false once the step or time allowance is used up,
     * and keeps returning false afterwards.
     */
    public boolean tryConsume() {
        if (exhausted) {
            return false;
        }
        steps++;
        if (maxSteps > 0 && steps > maxSteps) {
            exhausted = true;
        } else if (deadlineMs != Long.MAX_VALUE && (steps & 0x3FF) == 0 && System.currentTimeMillis() > deadlineMs) {
            // clock is only sampled every 1024 steps
            exhausted = true;
        }
        return !exhausted;
    }

    public boolean isExhausted() { return exhausted; }
    public long getSteps() { return steps; }
}
