package com.coursepicker.coursepicker_api.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coursepicker.coursepicker_api.config.SolverProperties;
import com.coursepicker.coursepicker_api.solver.SolverSettings;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check: catalog connectivity and the solver settings in effect.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final MongoTemplate mongoTemplate;
    private final SolverProperties solverProperties;

    public HealthController(MongoTemplate mongoTemplate, SolverProperties solverProperties) {
        this.mongoTemplate = mongoTemplate;
        this.solverProperties = solverProperties;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "coursepicker-api");

        Map<String, Object> catalog = new HashMap<>();
        try {
            catalog.put("database", mongoTemplate.getDb().getName());
            catalog.put("connected", true);
        } catch (Exception e) {
            catalog.put("connected", false);
            catalog.put("error", e.getMessage());
            logger.error("Catalog health check failed: {}", e.getMessage(), e);
        }
        health.put("catalog", catalog);

        SolverSettings settings = solverProperties.toSettings();
        Map<String, Object> solver = new HashMap<>();
        solver.put("greedyTrials", settings.getGreedyTrials());
        solver.put("passes", settings.getPasses());
        solver.put("stageAMinCredits", settings.getStageAMinCredits());
        solver.put("maxSearchSteps", settings.getMaxSearchSteps());
        solver.put("maxSearchMillis", settings.getMaxSearchMillis());
        solver.put("creditStep", solverProperties.getCreditStep());
        health.put("solver", solver);

        return ResponseEntity.ok(health);
    }
}
