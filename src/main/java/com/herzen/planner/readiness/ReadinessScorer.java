package com.herzen.planner.readiness;

import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.readiness.ReadinessModels.*;

import java.util.List;
import java.util.SortedSet;

/**
 * Direct readiness of one student for one course. The score counts only one-hop
 * prerequisites, so a course without prerequisites is always ready.
 */
public class ReadinessScorer {
    public static final int DEFAULT_ALMOST_READY_THRESHOLD = 75;

    private final GraphStore graph;
    private final int almostReadyThreshold;

    public ReadinessScorer(GraphStore graph) {
        this(graph, DEFAULT_ALMOST_READY_THRESHOLD);
    }

    public ReadinessScorer(GraphStore graph, int almostReadyThreshold) {
        if (almostReadyThreshold < 0 || almostReadyThreshold > 100) {
            throw new IllegalArgumentException("Readiness threshold must be within 0..100, got " + almostReadyThreshold);
        }
        this.graph = graph;
        this.almostReadyThreshold = almostReadyThreshold;
    }

    public ReadinessReport score(StudentState student, String targetCourse) {
        SortedSet<String> required = graph.prerequisitesOf(targetCourse);
        List<String> missing = required.stream()
                .filter(code -> !student.hasCompleted(code))
                .toList();

        int score = required.isEmpty() || missing.isEmpty()
                ? 100
                : 100 * (required.size() - missing.size()) / required.size();

        return new ReadinessReport(targetCourse, score, missing, statusFor(score));
    }

    public ReadinessStatus statusFor(int score) {
        if (score == 100) return ReadinessStatus.READY_NOW;
        if (score >= almostReadyThreshold) return ReadinessStatus.ALMOST_READY;
        return ReadinessStatus.NOT_READY;
    }

    /** Transitive check: every course reachable through requires edges must be completed. */
    public EligibilityReport eligibility(StudentState student, String course, ReachabilityIndex reachability) {
        SortedSet<String> required = reachability.transitivePrerequisitesOf(course);
        List<String> missing = required.stream()
                .filter(code -> !student.hasCompleted(code))
                .toList();
        List<String> completed = student.completed().stream().sorted().toList();

        return new EligibilityReport(student.studentId(), course,
                List.copyOf(required),
                completed,
                missing,
                missing.isEmpty(),
                missing.isEmpty() ? EligibilityReason.OK : EligibilityReason.MISSING_PREREQUISITES);
    }

    public BucketedCourse bucketEntry(StudentState student, String course, ReachabilityIndex reachability) {
        ReadinessReport report = score(student, course);
        return new BucketedCourse(course,
                graph.course(course).name(),
                report.missingPrerequisites().size(),
                report.missingPrerequisites(),
                reachability.chainDepth(course));
    }
}
