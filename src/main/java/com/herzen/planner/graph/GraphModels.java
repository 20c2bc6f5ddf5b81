package com.herzen.planner.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

public class GraphModels {
    /**
     * A directed prerequisite cycle. {@code courses} starts at the smallest code and does not
     * repeat it; a single entry means a self-edge.
     */
    public record CourseCycle(List<String> courses) {
        public CourseCycle {
            if (courses == null || courses.isEmpty()) {
                throw new IllegalArgumentException("A cycle needs at least one course");
            }
            courses = List.copyOf(courses);
        }

        /** Rotates so the smallest code comes first. */
        public static CourseCycle normalized(List<String> courses) {
            int start = 0;
            for (int i = 1; i < courses.size(); i++) {
                if (courses.get(i).compareTo(courses.get(start)) < 0) start = i;
            }
            List<String> rotated = new ArrayList<>(courses.size());
            for (int i = 0; i < courses.size(); i++) {
                rotated.add(courses.get((start + i) % courses.size()));
            }
            return new CourseCycle(rotated);
        }

        public String first() {
            return courses.get(0);
        }

        public int length() {
            return courses.size();
        }

        public List<String> path() {
            List<String> path = new ArrayList<>(courses);
            path.add(courses.get(0));
            return path;
        }
    }

    /**
     * Result of a depth-capped traversal. {@code partial} is set when courses beyond
     * {@code maxDepth} were cut off.
     */
    public record BoundedReach(String origin,
                               int maxDepth,
                               SortedSet<String> courses,
                               Map<Integer, List<String>> byDepth,
                               int chainDepth,
                               boolean partial) {}

    public enum Direction { PREREQUISITES, DEPENDENTS }

    public record CourseReach(String course,
                              Direction direction,
                              boolean transitive,
                              List<String> courses,
                              Map<Integer, List<String>> byDepth,
                              int chainDepth,
                              boolean partial) {}

    public record PrerequisiteChain(String course, int chainDepth, List<String> criticalChain) {}

    public record CycleReport(boolean acyclic, List<CourseCycle> cycles) {}
}
