package com.herzen.planner.readiness;

import java.util.List;
import java.util.Map;

public class ReadinessModels {
    public enum ReadinessStatus {
        READY_NOW("Ready Now"),
        ALMOST_READY("Almost Ready"),
        NOT_READY("Not Ready");

        private final String label;

        ReadinessStatus(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public record ReadinessReport(String course, int score, List<String> missingPrerequisites, ReadinessStatus status) {
        public boolean surfaced() {
            return status != ReadinessStatus.NOT_READY;
        }
    }

    public enum EligibilityReason { OK, MISSING_PREREQUISITES, COURSE_NOT_FOUND, STUDENT_NOT_FOUND }

    public record EligibilityReport(String studentId,
                                    String course,
                                    List<String> required,
                                    List<String> completed,
                                    List<String> missing,
                                    boolean canTake,
                                    EligibilityReason reason) {}

    public enum ReadinessBucket {
        READY_NOW("Ready Now"),
        ALMOST_READY("Almost Ready"),
        PLAN_SOON("Plan Soon"),
        PLAN_LATER("Plan Later");

        private final String label;

        ReadinessBucket(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static ReadinessBucket forMissing(int missing) {
            if (missing <= 0) return READY_NOW;
            if (missing == 1) return ALMOST_READY;
            if (missing == 2) return PLAN_SOON;
            return PLAN_LATER;
        }
    }

    public record BucketedCourse(String course, String name, int missingCount, List<String> missingPrerequisites, int chainDepth) {}

    public record ReadinessBuckets(String studentId, int totalRemaining, Map<ReadinessBucket, List<BucketedCourse>> byBucket) {}

    public record CourseRecommendation(String course,
                                       String name,
                                       Integer credits,
                                       ReadinessReport readiness,
                                       int unlocksCount,
                                       List<String> sampleUnlocked) {}

    public record RecommendationList(String studentId,
                                     String semesterId,
                                     int minReadiness,
                                     List<CourseRecommendation> recommendations) {}

    public record StudentSummary(String studentId,
                                 String name,
                                 String program,
                                 int completedCourses,
                                 RecommendationList nextSemester,
                                 ReadinessBuckets remaining) {}
}
