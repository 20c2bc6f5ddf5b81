package com.herzen.planner.analytics;

import com.herzen.planner.analytics.AnalyticsModels.*;
import com.herzen.planner.domain.DomainModels.Course;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

public class BottleneckAnalyzer {
    public static final int DEFAULT_MIN_DEPENDENTS = 3;
    public static final int DEFAULT_MIN_PREREQUISITES = 2;
    public static final int MAX_PREREQUISITE_DEPTH = 3;

    private static final Comparator<BottleneckCourse> BOTTLENECK_ORDER = Comparator
            .comparingInt(BottleneckCourse::unlocks).reversed()
            .thenComparing(Comparator.comparingInt(BottleneckCourse::totalPrereqs).reversed())
            .thenComparing(BottleneckCourse::code);

    private static final Comparator<CourseImpact> IMPACT_ORDER = Comparator
            .comparingInt(CourseImpact::difficultyScore).reversed()
            .thenComparing(Comparator.comparingInt(CourseImpact::impactScore).reversed())
            .thenComparing(CourseImpact::code);

    private final GraphStore graph;
    private final ReachabilityIndex reachability;

    public BottleneckAnalyzer(ReachabilityIndex reachability) {
        this.graph = reachability.graph();
        this.reachability = reachability;
    }

    public List<BottleneckCourse> bottlenecks(int minDependents, int minPrerequisites, int depth, int limit) {
        if (minDependents < 1 || minPrerequisites < 1) {
            throw new IllegalArgumentException("Bottleneck thresholds must be at least 1");
        }
        int boundedDepth = Math.max(1, Math.min(MAX_PREREQUISITE_DEPTH, depth));

        List<BottleneckCourse> rows = new ArrayList<>();
        for (Course course : graph.courses()) {
            int unlocks = graph.dependentsOf(course.code()).size();
            if (unlocks < minDependents) continue;

            int totalPrereqs = reachability.prerequisitesWithin(course.code(), boundedDepth).courses().size();
            if (totalPrereqs < minPrerequisites) continue;

            rows.add(new BottleneckCourse(course.code(), course.name(), unlocks, totalPrereqs,
                    List.copyOf(graph.dependentsOf(course.code()))));
        }
        rows.sort(BOTTLENECK_ORDER);
        return limit > 0 && rows.size() > limit ? List.copyOf(rows.subList(0, limit)) : List.copyOf(rows);
    }

    public List<CourseImpact> impact(String departmentFilter) {
        List<CourseImpact> rows = new ArrayList<>();
        for (Course course : graph.courses()) {
            if (!matchesDepartment(course, departmentFilter)) continue;

            String code = course.code();
            int direct = graph.prerequisitesOf(code).size();
            int total = reachability.transitivePrerequisitesOf(code).size();
            int maxPrereqDepth = reachability.chainDepth(code);
            int dependents = reachability.transitiveDependentsOf(code).size();
            int maxDependentDepth = reachability.dependentDepth(code);
            List<String> chain = maxPrereqDepth == 0 ? List.of() : reachability.criticalChain(code).criticalChain();

            int difficulty = total * 2 + maxPrereqDepth * 10;
            int impact = dependents * 2 + maxDependentDepth * 5;

            rows.add(new CourseImpact(code, course.name(), classify(total, dependents),
                    direct, total, maxPrereqDepth, dependents, maxDependentDepth, chain, difficulty, impact));
        }
        rows.sort(IMPACT_ORDER);
        return List.copyOf(rows);
    }

    public List<StudentProgress> compareProgress(Collection<StudentState> students, int defaultCredits) {
        List<StudentProgress> rows = new ArrayList<>();
        for (StudentState student : students) {
            int completedCredits = 0;
            int completedCount = 0;
            for (String code : student.completed()) {
                if (!graph.contains(code)) continue;
                completedCount++;
                completedCredits += graph.creditsOf(code, defaultCredits);
            }

            List<String> available = new ArrayList<>();
            int blocked = 0;
            for (Course course : graph.courses()) {
                if (student.hasCompleted(course.code())) continue;
                boolean open = graph.prerequisitesOf(course.code()).stream().allMatch(student::hasCompleted);
                if (open) {
                    available.add(course.code());
                } else {
                    blocked++;
                }
            }

            int denominator = completedCount + available.size() + blocked;
            double progress = denominator == 0 ? 0.0 : BigDecimal.valueOf(completedCount * 100.0 / denominator)
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();

            rows.add(new StudentProgress(student.studentId(), student.name(), student.program(),
                    completedCount, completedCredits, available.size(), blocked,
                    available.stream().limit(10).toList(), progress));
        }
        rows.sort(Comparator.comparingDouble(StudentProgress::progressPercentage).reversed()
                .thenComparing(StudentProgress::studentId));
        return List.copyOf(rows);
    }

    static CourseType classify(int totalPrereqs, int dependents) {
        if (totalPrereqs == 0 && dependents > 5) return CourseType.FOUNDATION;
        if (totalPrereqs > 5 && dependents == 0) return CourseType.CAPSTONE;
        if (dependents > 3) return CourseType.CORE;
        if (totalPrereqs > 3) return CourseType.ADVANCED;
        return CourseType.REGULAR;
    }

    private boolean matchesDepartment(Course course, String filter) {
        if (filter == null || filter.isBlank()) return true;
        if (course.department() != null && !course.department().isBlank()) {
            return course.department().equalsIgnoreCase(filter.trim());
        }
        return course.code().toUpperCase(Locale.ROOT).startsWith(filter.trim().toUpperCase(Locale.ROOT));
    }
}
