package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.model.CourseRecord;
import com.coursepicker.coursepicker_api.solver.domain.Constraints;
import com.coursepicker.coursepicker_api.solver.domain.Course;
import com.coursepicker.coursepicker_api.solver.domain.CourseSelection;
import com.coursepicker.coursepicker_api.solver.domain.GreedyResult;
import com.coursepicker.coursepicker_api.solver.domain.SelectedCourse;
import com.coursepicker.coursepicker_api.solver.domain.TimeInterval;
import com.coursepicker.coursepicker_api.solver.domain.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the three-stage selection pipeline several times over reshuffled candidates and returns
 * the distinct exact-credit solutions it finds.
 * <ol>
 *     <li>Stage A: greedy over courses matching both field and format preferences, aiming at
 *     about half of the target.</li>
 *     <li>Stage B: greedy over courses matching at least one preference, aiming at what is left.</li>
 *     <li>Stage C: exact backtracking over every other course for the remaining gap. If it fails
 *     the whole pass yields nothing.</li>
 * </ol>
 * Stages B and C only see courses that do not overlap anything an earlier stage picked.
 * One instance serves one request; the injected {@link Random} drives every shuffle.
 */
public class SelectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SelectionOrchestrator.class);

    private final SolverSettings settings;
    private final Random random;

    public SelectionOrchestrator(SolverSettings settings, Random random) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param rawCandidates pool already narrowed by semester upstream
     * @param busySchedule  time pattern of the user's own commitments, may be empty
     * @return zero to {@code passes} distinct solutions
     * @throws com.coursepicker.coursepicker_api.exception.TimeFormatException on a malformed time pattern
     */
    public List<CourseSelection> selectCourses(List<CourseRecord> rawCandidates, Constraints constraints, String busySchedule) {
        List<Course> pool = normalize(rawCandidates, constraints.getTargetCredits());
        List<TimeInterval> busy = TimeParser.parseOptional(busySchedule).stream()
                .map(TimeSlot::getInterval)
                .collect(Collectors.toList());

        List<Course> candidates = removeBusyConflicts(pool, busy);
        if (candidates.isEmpty()) {
            logger.warn("No candidate left after busy-schedule filtering ({} before).", pool.size());
            return List.of();
        }

        PreparedPool prepared = new PreparedPool(candidates, constraints);
        logger.debug("Prepared {} candidates, {} conflicting pairs, {} field matches, {} format matches",
                candidates.size(), prepared.graph.getEdgeCount(), prepared.fieldMatches.size(), prepared.formatMatches.size());

        Map<Set<String>, List<String>> distinct = new LinkedHashMap<>();
        List<Course> order = new ArrayList<>(candidates);
        for (int pass = 0; pass < settings.getPasses(); pass++) {
            Collections.shuffle(order, random);
            Optional<List<String>> names = selectOnce(prepared, order, constraints);
            if (names.isEmpty() || names.get().isEmpty()) {
                logger.debug("Pass {} found no solution.", pass + 1);
                continue;
            }
            logger.debug("Pass {} found {}", pass + 1, names.get());
            distinct.putIfAbsent(new HashSet<>(names.get()), names.get());
        }

        List<CourseSelection> solutions = new ArrayList<>();
        for (List<String> names : distinct.values()) {
            if (prepared.isValidSolution(names, constraints.getTargetCredits())) {
                solutions.add(assemble(names, prepared.byName));
            } else {
                logger.error("Discarding invalid selection {} for target {}", names, constraints.getTargetCredits());
            }
        }
        logger.info("Selected {} distinct solution(s) from {} candidates for {} credits.",
                solutions.size(), candidates.size(), constraints.getTargetCredits());
        return solutions;
    }

    /**
     * One pass of the pipeline over {@code order}. Empty when stage C cannot close the gap.
     */
    Optional<List<String>> selectOnce(PreparedPool pool, List<Course> order, Constraints constraints) {
        int target = constraints.getTargetCredits();

        // Stage A: both preferences
        Set<String> intersection = new HashSet<>(pool.fieldMatches);
        intersection.retainAll(pool.formatMatches);
        // never above the target itself, or stage A alone could overshoot it
        int stageATarget = (int) Math.min(target, Math.max(settings.getStageAMinCredits(), Math.round(0.5 * target)));
        GreedyResult inter = pool.greedy.approximate(restrict(order, intersection), stageATarget);

        // Stage B: either preference
        Set<String> union = new HashSet<>(pool.fieldMatches);
        union.addAll(pool.formatMatches);
        union.removeAll(inter.getChosenNames());
        int stageBTarget = Math.max(0, target - inter.getAchievedCredits());
        List<Course> interCourses = pool.coursesNamed(inter.getChosenNames());
        GreedyResult either = pool.greedy.approximate(
                compatibleWith(restrict(order, union), interCourses, pool.graph), stageBTarget);

        List<String> chosen = new ArrayList<>(inter.getChosenNames());
        chosen.addAll(either.getChosenNames());
        int remaining = target - inter.getAchievedCredits() - either.getAchievedCredits();
        logger.debug("Stage A {}/{} credits, stage B {}/{} credits, {} remaining",
                inter.getAchievedCredits(), stageATarget, either.getAchievedCredits(), stageBTarget, remaining);
        if (remaining == 0) {
            return Optional.of(chosen);
        }

        // Stage C: exact completion over everything not yet chosen and not clashing with it
        Set<String> taken = new HashSet<>(chosen);
        List<Course> rest = compatibleWith(order.stream()
                .filter(c -> !taken.contains(c.getName()))
                .collect(Collectors.toList()), pool.coursesNamed(chosen), pool.graph);
        Optional<List<String>> completion = pool.exact.solveExact(rest, remaining, settings.newSearchBudget());
        if (completion.isEmpty()) {
            return Optional.empty();
        }
        chosen.addAll(completion.get());
        return Optional.of(chosen);
    }

    private List<Course> normalize(List<CourseRecord> rawCandidates, int targetCredits) {
        List<Course> courses = new ArrayList<>();
        if (rawCandidates == null) {
            return courses;
        }
        for (CourseRecord record : rawCandidates) {
            if (record.getCredit() == null) {
                throw new IllegalArgumentException("Course " + record.getName() + " has no credit value.");
            }
            Course course = new Course(record.getName(), record.getCredit(), record.getField(), record.getFormat(),
                    TimeParser.parse(record.getDates()));
            if (course.getCredit() > targetCredits) {
                logger.debug("Skipping {}: {} credits exceed the target of {}", course.getName(), course.getCredit(), targetCredits);
                continue;
            }
            courses.add(course);
        }
        return courses;
    }

    private static List<Course> removeBusyConflicts(List<Course> pool, List<TimeInterval> busy) {
        if (busy.isEmpty()) {
            return new ArrayList<>(pool);
        }
        List<Course> kept = new ArrayList<>();
        for (Course course : pool) {
            if (ConflictGraph.hasOverlap(course.getIntervals(), busy)) {
                logger.debug("Dropping {}: overlaps the busy schedule", course.getName());
                continue;
            }
            kept.add(course);
        }
        return kept;
    }

    private static List<Course> restrict(List<Course> order, Set<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        return order.stream().filter(c -> names.contains(c.getName())).collect(Collectors.toList());
    }

    private static List<Course> compatibleWith(List<Course> candidates, List<Course> chosen, ConflictGraph graph) {
        if (chosen.isEmpty()) {
            return candidates;
        }
        return candidates.stream()
                .filter(c -> !graph.conflictsWithAny(c, chosen))
                .collect(Collectors.toList());
    }

    private static CourseSelection assemble(List<String> names, Map<String, Course> byName) {
        List<SelectedCourse> courses = new ArrayList<>(names.size());
        for (String name : names) {
            courses.add(SelectedCourse.of(byName.get(name)));
        }
        return new CourseSelection(courses);
    }

    /**
     * Everything derived once from the filtered pool and shared by all passes of a request.
     */
    final class PreparedPool {
        final ConflictGraph graph;
        final Map<String, Course> byName = new HashMap<>();
        final Set<String> fieldMatches;
        final Set<String> formatMatches;
        final GreedyRandomizedSelector greedy;
        final ExactBacktrackingSolver exact;

        PreparedPool(List<Course> candidates, Constraints constraints) {
            this.graph = ConflictGraph.build(candidates);
            for (Course course : candidates) {
                byName.put(course.getName(), course);
            }
            this.fieldMatches = PreferenceFilter.filterByPreference(candidates, PreferenceSlot.FIELD, constraints.getFields());
            this.formatMatches = PreferenceFilter.filterByPreference(candidates, PreferenceSlot.FORMAT, constraints.getFormats());
            this.greedy = new GreedyRandomizedSelector(graph, random, settings.getGreedyTrials());
            this.exact = new ExactBacktrackingSolver(graph);
        }

        List<Course> coursesNamed(Collection<String> names) {
            List<Course> courses = new ArrayList<>(names.size());
            for (String name : names) {
                courses.add(byName.get(name));
            }
            return courses;
        }

        boolean isValidSolution(List<String> names, int targetCredits) {
            Set<String> unique = new LinkedHashSet<>(names);
            if (unique.size() != names.size()) {
                return false;
            }
            int credits = 0;
            List<Course> seen = new ArrayList<>();
            for (String name : names) {
                Course course = byName.get(name);
                if (course == null || graph.conflictsWithAny(course, seen)) {
                    return false;
                }
                credits += course.getCredit();
                seen.add(course);
            }
            return credits == targetCredits;
        }
    }
}
