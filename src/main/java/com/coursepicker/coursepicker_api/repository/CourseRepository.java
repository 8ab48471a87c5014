package com.coursepicker.coursepicker_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.coursepicker.coursepicker_api.model.CourseRecord;

@Repository
public interface CourseRepository extends MongoRepository<CourseRecord, String> {

    // Candidate pool for a solve request: offered this semester and small enough to fit the target
    List<CourseRecord> findBySemesterIgnoreCaseAndCreditLessThanEqual(String semester, Integer maxCredit);

    boolean existsByNameAndSemesterIgnoreCase(String name, String semester);

    boolean existsByNameAndSemesterIgnoreCaseAndIdNot(String name, String semester, String id);
}
