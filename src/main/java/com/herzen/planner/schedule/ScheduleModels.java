package com.herzen.planner.schedule;

import java.util.*;

public class ScheduleModels {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public record ScheduleConstraints(int maxCoursesPerSemester, int maxCreditsPerSemester, int targetSemesters) {
        public ScheduleConstraints {
            if (maxCoursesPerSemester < 1) throw new IllegalArgumentException("maxCoursesPerSemester must be positive");
            if (maxCreditsPerSemester < 1) throw new IllegalArgumentException("maxCreditsPerSemester must be positive");
            if (targetSemesters < 0) throw new IllegalArgumentException("targetSemesters must not be negative");
        }

        /** Course-count cap only; credits and horizon length are unbounded. */
        public static ScheduleConstraints ofMaxCourses(int maxCourses) {
            return new ScheduleConstraints(maxCourses, UNLIMITED, UNLIMITED);
        }
    }

    /** Per-course figures the priority rules rank on. */
    public record CourseMetrics(String code, int unlocks, int remainingDepth, int credits) {}

    public enum PriorityRule {
        UNLOCKS_FIRST(Comparator.comparingInt(CourseMetrics::unlocks).reversed()
                .thenComparingInt(CourseMetrics::remainingDepth)
                .thenComparing(CourseMetrics::code)),
        SHALLOW_FIRST(Comparator.comparingInt(CourseMetrics::remainingDepth)
                .thenComparing(Comparator.comparingInt(CourseMetrics::unlocks).reversed())
                .thenComparing(CourseMetrics::code)),
        LEXICOGRAPHIC(Comparator.comparing(CourseMetrics::code)),
        CREDITS_FIRST(Comparator.comparingInt(CourseMetrics::credits).reversed()
                .thenComparing(Comparator.comparingInt(CourseMetrics::unlocks).reversed())
                .thenComparing(CourseMetrics::code)),
        REVERSE_LEXICOGRAPHIC(Comparator.comparing(CourseMetrics::code).reversed());

        private final Comparator<CourseMetrics> comparator;

        PriorityRule(Comparator<CourseMetrics> comparator) {
            this.comparator = comparator;
        }

        public Comparator<CourseMetrics> comparator() {
            return comparator;
        }
    }

    public record ScheduledCourse(String code, String name, int credits, List<String> prerequisites) {}

    public record SemesterPlan(String semesterId,
                               String label,
                               int year,
                               int termIndex,
                               int position,
                               List<ScheduledCourse> courses,
                               int totalCourses,
                               int totalCredits) {
        public List<String> courseCodes() {
            return courses.stream().map(ScheduledCourse::code).toList();
        }
    }

    public record SchedulePlan(List<SemesterPlan> semesters,
                               List<String> unscheduled,
                               List<String> unreachable,
                               List<String> warnings,
                               int totalCourses,
                               int totalCredits) {
        public static SchedulePlan empty() {
            return new SchedulePlan(List.of(), List.of(), List.of(), List.of(), 0, 0);
        }

        /** Semester id to scheduled codes, in timeline order. */
        public Map<String, List<String>> assignments() {
            Map<String, List<String>> result = new LinkedHashMap<>();
            semesters.forEach(s -> result.put(s.semesterId(), s.courseCodes()));
            return result;
        }

        public List<String> orderedCourses() {
            List<String> result = new ArrayList<>();
            semesters.forEach(s -> result.addAll(s.courseCodes()));
            return result;
        }
    }

    public record StudentSchedule(String studentId, String program, List<String> completedCourses, PriorityRule priority, SchedulePlan plan) {}

    public record GraduationPath(String strategy, List<String> ordering, SchedulePlan plan) {}

    public record GraduationPaths(String studentId, String program, List<String> remainingCourses, List<GraduationPath> paths) {}

    public record DegreeSequence(String studentId, String program, List<String> remainingCourses, List<List<String>> recommendedSequence) {}
}
