package com.coursepicker.coursepicker_api.controller;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coursepicker.coursepicker_api.model.SelectionRequest;
import com.coursepicker.coursepicker_api.service.CourseSelectionService;
import com.coursepicker.coursepicker_api.solver.domain.CourseSelection;

@RestController
@RequestMapping("/api/selections")
public class SelectionController {

    private static final Logger logger = LoggerFactory.getLogger(SelectionController.class);

    private final CourseSelectionService courseSelectionService;

    public SelectionController(CourseSelectionService courseSelectionService) {
        this.courseSelectionService = courseSelectionService;
    }

    @PostMapping("/solve")
    public ResponseEntity<Map<String, Object>> solve(@RequestBody SelectionRequest request) {
        String requestId = UUID.randomUUID().toString();
        logger.info(">>> Received /solve request {} for {} credits.", requestId, request.getTargetCredits());
        List<CourseSelection> solutions = courseSelectionService.select(request);
        return ResponseEntity.ok(toBody(requestId, request, solutions));
    }

    @PostMapping("/semesters/{semester}/solve")
    public ResponseEntity<Map<String, Object>> solveForSemester(@PathVariable String semester, @RequestBody SelectionRequest request) {
        String requestId = UUID.randomUUID().toString();
        logger.info(">>> Received catalog solve request {} for semester {} and {} credits.", requestId, semester, request.getTargetCredits());
        List<CourseSelection> solutions = courseSelectionService.selectFromCatalog(semester, request);
        return ResponseEntity.ok(toBody(requestId, request, solutions));
    }

    private static Map<String, Object> toBody(String requestId, SelectionRequest request, List<CourseSelection> solutions) {
        return Map.of(
                "requestId", requestId,
                "targetCredits", request.getTargetCredits(),
                "count", solutions.size(),
                "solutions", solutions.stream().map(CourseSelection::getCourses).collect(Collectors.toList())
        );
    }
}
