package com.coursepicker.coursepicker_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.coursepicker.coursepicker_api.solver.SolverSettings;

/**
 * Binds solver and request settings from application properties.
 */
@Component
public class SolverProperties {

    @Value("${coursepicker.solver.greedy-trials:10}")
    private int greedyTrials;

    @Value("${coursepicker.solver.passes:3}")
    private int passes;

    @Value("${coursepicker.solver.stage-a-min-credits:3}")
    private int stageAMinCredits;

    @Value("${coursepicker.solver.max-search-steps:2000000}")
    private long maxSearchSteps;

    @Value("${coursepicker.solver.max-search-millis:0}")
    private long maxSearchMillis;

    @Value("${coursepicker.request.credit-step:1}")
    private int creditStep;

    public SolverSettings toSettings() {
        return new SolverSettings(greedyTrials, passes, stageAMinCredits, maxSearchSteps, maxSearchMillis);
    }

    public int getCreditStep() {
        return creditStep;
    }
}
