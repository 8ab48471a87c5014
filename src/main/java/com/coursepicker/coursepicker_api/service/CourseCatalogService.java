package com.coursepicker.coursepicker_api.service;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.coursepicker.coursepicker_api.model.CourseRecord;
import com.coursepicker.coursepicker_api.repository.CourseRepository;
import com.coursepicker.coursepicker_api.solver.TimeParser;

@Service
public class CourseCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CourseCatalogService.class);

    private final CourseRepository courseRepository;

    public CourseCatalogService(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    public List<CourseRecord> getAllCourses() {
        return courseRepository.findAll();
    }

    public Optional<CourseRecord> getCourseById(String id) {
        return courseRepository.findById(id);
    }

    public CourseRecord createCourse(CourseRecord course) {
        validate(course);
        if (courseRepository.existsByNameAndSemesterIgnoreCase(course.getName(), course.getSemester())) {
            throw new IllegalArgumentException("Course " + course.getName() + " already exists for semester " + course.getSemester() + ".");
        }
        course.setId(null);
        return courseRepository.save(course);
    }

    public Optional<CourseRecord> updateCourse(String id, CourseRecord details) {
        validate(details);
        return courseRepository.findById(id).map(existing -> {
            if (courseRepository.existsByNameAndSemesterIgnoreCaseAndIdNot(details.getName(), details.getSemester(), id)) {
                throw new IllegalArgumentException("Course " + details.getName() + " already exists for semester " + details.getSemester() + ".");
            }
            existing.setName(details.getName());
            existing.setCredit(details.getCredit());
            existing.setField(details.getField());
            existing.setFormat(details.getFormat());
            existing.setDates(details.getDates());
            existing.setSemester(details.getSemester());
            return courseRepository.save(existing);
        });
    }

    public boolean deleteCourse(String id) {
        if (!courseRepository.existsById(id)) {
            return false;
        }
        courseRepository.deleteById(id);
        return true;
    }

    /**
     * Candidate pool for one request: courses offered in {@code semester} whose credit fits
     * within {@code targetCredits}.
     */
    public List<CourseRecord> findCandidates(String semester, int targetCredits) {
        if (semester == null || semester.isBlank()) {
            throw new IllegalArgumentException("Semester must not be empty.");
        }
        List<CourseRecord> candidates = courseRepository.findBySemesterIgnoreCaseAndCreditLessThanEqual(semester.trim(), targetCredits);
        logger.info("Catalog returned {} candidate(s) for semester {} and at most {} credits.", candidates.size(), semester, targetCredits);
        return candidates;
    }

    private void validate(CourseRecord course) {
        if (course == null) {
            throw new IllegalArgumentException("Course body must not be empty.");
        }
        if (course.getName() == null || course.getName().isBlank()) {
            throw new IllegalArgumentException("Course name must not be empty.");
        }
        if (course.getCredit() == null || course.getCredit() <= 0) {
            throw new IllegalArgumentException("Course " + course.getName() + " must have a positive credit value.");
        }
        // catalog solves look courses up by semester, so a course without one is unreachable
        if (course.getSemester() == null || course.getSemester().isBlank()) {
            throw new IllegalArgumentException("Course " + course.getName() + " needs a semester.");
        }
        course.setSemester(course.getSemester().trim());
        // fail before storing a pattern the solver cannot read
        TimeParser.parse(course.getDates());
    }
}
