package com.coursepicker.coursepicker_api.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coursepicker.coursepicker_api.model.CourseRecord;
import com.coursepicker.coursepicker_api.service.CourseCatalogService;

@RestController
@RequestMapping("/api/courses")
public class CourseController {

    private final CourseCatalogService courseCatalogService;

    public CourseController(CourseCatalogService courseCatalogService) {
        this.courseCatalogService = courseCatalogService;
    }

    @GetMapping
    public List<CourseRecord> getAllCourses() {
        return courseCatalogService.getAllCourses();
    }

    @GetMapping("/{id}")
    public ResponseEntity<CourseRecord> getCourseById(@PathVariable String id) {
        return courseCatalogService.getCourseById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public CourseRecord createCourse(@RequestBody CourseRecord course) {
        return courseCatalogService.createCourse(course);
    }

    @PutMapping("/{id}")
    public ResponseEntity<CourseRecord> updateCourse(@PathVariable String id, @RequestBody CourseRecord courseDetails) {
        return courseCatalogService.updateCourse(id, courseDetails)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteCourse(@PathVariable String id) {
        return courseCatalogService.deleteCourse(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
