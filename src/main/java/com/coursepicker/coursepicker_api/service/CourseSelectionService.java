package com.coursepicker.coursepicker_api.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.coursepicker.coursepicker_api.config.SolverProperties;
import com.coursepicker.coursepicker_api.model.CourseRecord;
import com.coursepicker.coursepicker_api.model.SelectionRequest;
import com.coursepicker.coursepicker_api.solver.SelectionOrchestrator;
import com.coursepicker.coursepicker_api.solver.domain.Constraints;
import com.coursepicker.coursepicker_api.solver.domain.CourseSelection;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CourseSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(CourseSelectionService.class);

    private final SolverProperties solverProperties;
    private final CourseCatalogService courseCatalogService;

    /**
     * Solves against the candidates carried in the request body.
     */
    public List<CourseSelection> select(SelectionRequest request) {
        Constraints constraints = toConstraints(request);
        List<CourseRecord> candidates = request.getCandidates() == null ? List.of() : request.getCandidates();
        validateCandidates(candidates);
        return solve(candidates, constraints, request);
    }

    /**
     * Solves against the catalog's courses for {@code semester}.
     */
    public List<CourseSelection> selectFromCatalog(String semester, SelectionRequest request) {
        Constraints constraints = toConstraints(request);
        List<CourseRecord> candidates = distinctByName(courseCatalogService.findCandidates(semester, constraints.getTargetCredits()));
        return solve(candidates, constraints, request);
    }

    /**
     * Keeps the first catalog record per course name; later duplicates are logged and dropped.
     */
    private List<CourseRecord> distinctByName(List<CourseRecord> records) {
        Map<String, CourseRecord> byName = new LinkedHashMap<>();
        for (CourseRecord candidate : records) {
            if (candidate == null || candidate.getName() == null || candidate.getName().isBlank()) {
                logger.warn("Ignoring catalog record without a name: {}", candidate);
                continue;
            }
            CourseRecord kept = byName.putIfAbsent(candidate.getName(), candidate);
            if (kept != null) {
                logger.warn("Catalog holds course {} more than once (ids {} and {}); using {}",
                        candidate.getName(), kept.getId(), candidate.getId(), kept.getId());
            }
        }
        return new ArrayList<>(byName.values());
    }

    private List<CourseSelection> solve(List<CourseRecord> candidates, Constraints constraints, SelectionRequest request) {
        logger.info("Solving {} with {} candidate(s), busy schedule '{}', seed {}",
                constraints, candidates.size(), request.busySchedulePattern(), request.getSeed());
        // fresh orchestrator and random source per request, nothing is shared between requests
        Random random = request.getSeed() != null ? new Random(request.getSeed()) : new Random();
        SelectionOrchestrator orchestrator = new SelectionOrchestrator(solverProperties.toSettings(), random);
        List<CourseSelection> solutions = orchestrator.selectCourses(candidates, constraints, request.busySchedulePattern());
        if (solutions.isEmpty()) {
            logger.info("No course combination reaches exactly {} credits.", constraints.getTargetCredits());
        }
        return solutions;
    }

    Constraints toConstraints(SelectionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body must not be empty.");
        }
        Integer target = request.getTargetCredits();
        if (target == null || target <= 0) {
            throw new IllegalArgumentException("targetCredits must be a positive integer.");
        }
        int step = Math.max(1, solverProperties.getCreditStep());
        if (target % step != 0) {
            throw new IllegalArgumentException("targetCredits must be a multiple of " + step + ".");
        }
        return new Constraints(target, request.getFields(), request.getFormats());
    }

    private void validateCandidates(List<CourseRecord> candidates) {
        Set<String> names = new HashSet<>();
        for (CourseRecord candidate : candidates) {
            if (candidate == null || candidate.getName() == null || candidate.getName().isBlank()) {
                throw new IllegalArgumentException("Every candidate needs a name.");
            }
            if (!names.add(candidate.getName())) {
                throw new IllegalArgumentException("Duplicate candidate name: " + candidate.getName());
            }
        }
    }
}
