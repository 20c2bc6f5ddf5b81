package com.herzen.planner.graph;

import com.herzen.planner.domain.DomainModels.Course;
import com.herzen.planner.domain.DomainModels.PrerequisiteEdge;
import com.herzen.planner.error.MalformedGraphException;
import com.herzen.planner.error.NotFoundException;

import java.util.*;

/**
 * Immutable prerequisite graph built from one catalog snapshot. Forward adjacency maps a course
 * to the courses it requires, reverse adjacency maps it to the courses requiring it.
 * Safe to share between threads once built.
 */
public final class GraphStore {
    private final Map<String, Course> courses;
    private final Map<String, SortedSet<String>> prerequisites;
    private final Map<String, SortedSet<String>> dependents;
    private final int edgeCount;

    private GraphStore(Map<String, Course> courses,
                       Map<String, SortedSet<String>> prerequisites,
                       Map<String, SortedSet<String>> dependents,
                       int edgeCount) {
        this.courses = courses;
        this.prerequisites = prerequisites;
        this.dependents = dependents;
        this.edgeCount = edgeCount;
    }

    public static GraphStore build(Collection<Course> courseList, Collection<PrerequisiteEdge> edges) {
        List<String> problems = new ArrayList<>();
        Map<String, Course> byCode = new TreeMap<>();
        for (Course course : courseList) {
            if (course.code() == null || course.code().isBlank()) {
                problems.add("Course with blank code: " + course.name());
            } else if (byCode.putIfAbsent(course.code(), course) != null) {
                problems.add("Duplicate course code: " + course.code());
            }
        }

        Map<String, SortedSet<String>> forward = new HashMap<>();
        Map<String, SortedSet<String>> reverse = new HashMap<>();
        byCode.keySet().forEach(code -> {
            forward.put(code, new TreeSet<>());
            reverse.put(code, new TreeSet<>());
        });

        int count = 0;
        for (PrerequisiteEdge edge : edges) {
            if (edge.courseCode() == null || edge.prerequisiteCode() == null) {
                problems.add("Edge " + edge.courseCode() + "->" + edge.prerequisiteCode() + " has a missing course code");
                continue;
            }
            boolean fromKnown = byCode.containsKey(edge.courseCode());
            boolean toKnown = byCode.containsKey(edge.prerequisiteCode());
            if (!fromKnown || !toKnown) {
                String unknown = !fromKnown ? edge.courseCode() : edge.prerequisiteCode();
                problems.add("Edge " + edge.courseCode() + "->" + edge.prerequisiteCode() + " references unknown course " + unknown);
                continue;
            }
            if (forward.get(edge.courseCode()).add(edge.prerequisiteCode())) {
                reverse.get(edge.prerequisiteCode()).add(edge.courseCode());
                count++;
            }
        }

        if (!problems.isEmpty()) {
            throw new MalformedGraphException(problems);
        }

        return new GraphStore(
                Collections.unmodifiableMap(byCode),
                freeze(forward),
                freeze(reverse),
                count);
    }

    private static Map<String, SortedSet<String>> freeze(Map<String, SortedSet<String>> adjacency) {
        Map<String, SortedSet<String>> frozen = new HashMap<>();
        adjacency.forEach((code, set) -> frozen.put(code, Collections.unmodifiableSortedSet(set)));
        return Collections.unmodifiableMap(frozen);
    }

    public Course course(String code) {
        Course course = courses.get(code);
        if (course == null) throw NotFoundException.course(code);
        return course;
    }

    public boolean contains(String code) {
        return code != null && courses.containsKey(code);
    }

    /** All courses ordered by code. */
    public Collection<Course> courses() {
        return courses.values();
    }

    public Set<String> codes() {
        return courses.keySet();
    }

    public SortedSet<String> prerequisitesOf(String code) {
        SortedSet<String> result = prerequisites.get(code);
        if (result == null) throw NotFoundException.course(code);
        return result;
    }

    public SortedSet<String> dependentsOf(String code) {
        SortedSet<String> result = dependents.get(code);
        if (result == null) throw NotFoundException.course(code);
        return result;
    }

    public boolean hasSelfEdge(String code) {
        return prerequisitesOf(code).contains(code);
    }

    public int creditsOf(String code, int defaultCredits) {
        Integer credits = course(code).credits();
        return credits == null ? defaultCredits : credits;
    }

    public int size() {
        return courses.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
