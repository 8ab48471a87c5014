package com.coursepicker.coursepicker_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import com.coursepicker.coursepicker_api.model.CourseRecord;

/**
 * Logs catalog connectivity and the effective solver settings on startup.
 */
@Component
public class CatalogConnectionLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(CatalogConnectionLogger.class);

    private final MongoTemplate mongoTemplate;
    private final SolverProperties solverProperties;

    @Value("${spring.data.mongodb.uri:not-set}")
    private String mongoUri;

    public CatalogConnectionLogger(MongoTemplate mongoTemplate, SolverProperties solverProperties) {
        this.mongoTemplate = mongoTemplate;
        this.solverProperties = solverProperties;
    }

    @Override
    public void run(String... args) {
        logger.info("Solver settings: {} (credit step {})", solverProperties.toSettings(), solverProperties.getCreditStep());
        logger.info("Course catalog URI: {}", maskUri(mongoUri));
        try {
            long count = mongoTemplate.count(new Query(), CourseRecord.class);
            logger.info("Course catalog reachable, database {} holds {} course(s).", mongoTemplate.getDb().getName(), count);
        } catch (Exception e) {
            // the solve endpoint with inline candidates still works without a catalog
            logger.error("Course catalog not reachable: {}", e.getMessage(), e);
        }
    }

    static String maskUri(String uri) {
        return uri.replaceAll(":[^:@/]+@", ":****@");
    }
}
