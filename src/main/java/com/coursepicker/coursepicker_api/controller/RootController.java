package com.coursepicker.coursepicker_api.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "coursepicker-api",
            "status", "running",
            "version", "0.0.1",
            "endpoints", Map.of(
                "health", "/api/health",
                "courses", "/api/courses",
                "solve", "/api/selections/solve, /api/selections/semesters/{semester}/solve"
            )
        ));
    }
}
