package com.coursepicker.coursepicker_api.solver;

import com.coursepicker.coursepicker_api.solver.domain.Course;
import com.coursepicker.coursepicker_api.solver.domain.TimeInterval;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairwise time-overlap relation over one candidate pool. Built once in O(n^2) and read-only
 * afterwards. Courses are keyed by their position in the pool, so a pair lookup never depends
 * on what characters the course names contain.
 */
public final class ConflictGraph {

    private final Map<String, Integer> indexByName;
    private final boolean[][] conflicts;
    private final int edgeCount;

    private ConflictGraph(Map<String, Integer> indexByName, boolean[][] conflicts, int edgeCount) {
        this.indexByName = indexByName;
        this.conflicts = conflicts;
        this.edgeCount = edgeCount;
    }

    /**
     * @throws IllegalArgumentException if two candidates share a name
     */
    public static ConflictGraph build(List<Course> courses) {
        int n = courses.size();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            Integer previous = index.put(courses.get(i).getName(), i);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate course name in candidate pool: " + courses.get(i).getName());
            }
        }

        boolean[][] matrix = new boolean[n][n];
        int edges = 0;
        for (int i = 0; i < n; i++) {
            List<TimeInterval> a = courses.get(i).getIntervals();
            for (int j = i + 1; j < n; j++) {
                if (hasOverlap(a, courses.get(j).getIntervals())) {
                    matrix[i][j] = true;
                    matrix[j][i] = true;
                    edges++;
                }
            }
        }
        return new ConflictGraph(index, matrix, edges);
    }

    /**
     * True if any interval of {@code a} overlaps any interval of {@code b} by more than zero minutes.
     */
    public static boolean hasOverlap(Collection<TimeInterval> a, Collection<TimeInterval> b) {
        for (TimeInterval x : a) {
            for (TimeInterval y : b) {
                if (x.overlaps(y)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Order-independent lookup. A course never conflicts with itself.
     *
     * @throws IllegalStateException if either name is not part of this graph
     */
    public boolean conflicts(String a, String b) {
        int i = indexOf(a);
        int j = indexOf(b);
        return i != j && conflicts[i][j];
    }

    public boolean conflicts(Course a, Course b) {
        return conflicts(a.getName(), b.getName());
    }

    /**
     * True if {@code course} overlaps any of {@code accepted}.
     */
    public boolean conflictsWithAny(Course course, Collection<Course> accepted) {
        int i = indexOf(course.getName());
        for (Course other : accepted) {
            int j = indexOf(other.getName());
            if (i != j && conflicts[i][j]) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public int size() {
        return conflicts.length;
    }

    /** Number of unordered conflicting pairs. */
    public int getEdgeCount() {
        return edgeCount;
    }

    private int indexOf(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new IllegalStateException("Course '" + name + "' is not part of the conflict graph");
        }
        return index;
    }
}
