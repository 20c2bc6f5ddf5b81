package com.herzen.planner.analytics;

import java.util.List;

public class AnalyticsModels {
    public record BottleneckCourse(String code, String name, int unlocks, int totalPrereqs, List<String> dependents) {}

    public record BottleneckResponse(int minDependents, int minPrerequisites, int depth, List<BottleneckCourse> bottlenecks) {}

    public enum CourseType { FOUNDATION, CAPSTONE, CORE, ADVANCED, REGULAR }

    public record CourseImpact(String code,
                               String name,
                               CourseType type,
                               int directPrereqCount,
                               int totalPrereqCount,
                               int maxPrereqDepth,
                               int dependentCount,
                               int maxDependentDepth,
                               List<String> criticalChain,
                               int difficultyScore,
                               int impactScore) {}

    public record CentralityScore(String code, String name, double score) {}

    public record StudentProgress(String studentId,
                                  String name,
                                  String program,
                                  int completedCount,
                                  int completedCredits,
                                  int availableCount,
                                  int blockedCount,
                                  List<String> sampleAvailable,
                                  double progressPercentage) {}

    public record ProgressComparison(List<StudentProgress> students, int comparisonCount) {}
}
