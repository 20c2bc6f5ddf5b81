package com.herzen.planner.readiness;

import com.herzen.planner.config.PlannerProperties;
import com.herzen.planner.domain.DomainModels.SemesterOffering;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.readiness.ReadinessModels.*;
import com.herzen.planner.service.CatalogService;
import com.herzen.planner.service.CatalogService.CatalogView;
import com.herzen.planner.service.StudentService;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class ReadinessService {
    private static final int UNLOCK_DEPTH = 2;
    private static final int UNLOCK_SAMPLE = 5;

    private final CatalogService catalogService;
    private final StudentService studentService;
    private final PlannerProperties properties;

    public ReadinessService(CatalogService catalogService, StudentService studentService, PlannerProperties properties) {
        this.catalogService = catalogService;
        this.studentService = studentService;
        this.properties = properties;
    }

    public ReadinessReport readiness(String studentId, String courseCode) {
        StudentState student = studentService.require(studentId);
        return scorer(catalogService.current().graph()).score(student, courseCode);
    }

    /** Answers with a reason code instead of failing when the course or student is unknown. */
    public EligibilityReport eligibility(String studentId, String courseCode) {
        GraphStore graph = catalogService.current().graph();
        if (!graph.contains(courseCode)) {
            return new EligibilityReport(studentId, courseCode, List.of(), List.of(), List.of(), false,
                    EligibilityReason.COURSE_NOT_FOUND);
        }
        Optional<StudentState> student = studentService.find(studentId);
        if (student.isEmpty()) {
            List<String> required = List.copyOf(new ReachabilityIndex(graph).transitivePrerequisitesOf(courseCode));
            return new EligibilityReport(studentId, courseCode, required, List.of(), required, false,
                    EligibilityReason.STUDENT_NOT_FOUND);
        }
        return scorer(graph).eligibility(student.get(), courseCode, new ReachabilityIndex(graph));
    }

    public RecommendationList recommendations(String studentId, String semesterId, Integer minReadiness, Integer limit) {
        StudentState student = studentService.require(studentId);
        CatalogView view = catalogService.current();
        return recommendations(student, view, semesterId, minReadiness, limit);
    }

    public ReadinessBuckets buckets(String studentId, Integer limit) {
        StudentState student = studentService.require(studentId);
        return buckets(student, catalogService.current(), limit);
    }

    public StudentSummary summary(String studentId, String semesterId) {
        StudentState student = studentService.require(studentId);
        CatalogView view = catalogService.current();
        RecommendationList next = recommendations(student, view, semesterId, null, 10);
        ReadinessBuckets remaining = buckets(student, view, 20);
        int completed = (int) student.completed().stream().filter(view.graph()::contains).count();
        return new StudentSummary(student.studentId(), student.name(), student.program(), completed, next, remaining);
    }

    private RecommendationList recommendations(StudentState student, CatalogView view, String semesterId,
                                               Integer minReadiness, Integer limit) {
        SemesterOffering semester = semesterId == null
                ? view.snapshot().semesters().stream().findFirst().orElse(null)
                : view.semester(semesterId);
        int threshold = minReadiness == null ? properties.readiness().almostReadyThreshold() : minReadiness;
        int max = limit == null ? properties.recommendations().limit() : limit;
        if (semester == null) {
            return new RecommendationList(student.studentId(), null, threshold, List.of());
        }

        GraphStore graph = view.graph();
        ReadinessScorer scorer = scorer(graph);
        ReachabilityIndex reachability = new ReachabilityIndex(graph);

        List<CourseRecommendation> rows = new ArrayList<>();
        for (String code : new TreeSet<>(semester.courseCodes())) {
            if (student.completed().contains(code) || student.enrolled().contains(code)) continue;
            ReadinessReport report = scorer.score(student, code);
            if (report.score() < threshold) continue;

            SortedSet<String> unlocked = reachability.dependentsWithin(code, UNLOCK_DEPTH).courses();
            rows.add(new CourseRecommendation(code, graph.course(code).name(), graph.course(code).credits(), report,
                    unlocked.size(), unlocked.stream().limit(UNLOCK_SAMPLE).toList()));
        }
        rows.sort(Comparator.comparingInt((CourseRecommendation r) -> r.readiness().score()).reversed()
                .thenComparing(CourseRecommendation::course));
        return new RecommendationList(student.studentId(), semester.id(), threshold,
                rows.stream().limit(Math.max(max, 0)).toList());
    }

    private ReadinessBuckets buckets(StudentState student, CatalogView view, Integer limit) {
        GraphStore graph = view.graph();
        Collection<String> pool = student.program() == null
                ? graph.codes()
                : view.snapshot().programs().stream()
                    .filter(p -> p.name().equals(student.program()))
                    .findFirst()
                    .map(p -> (Collection<String>) p.requiredCourses())
                    .orElse(graph.codes());

        ReadinessScorer scorer = scorer(graph);
        ReachabilityIndex reachability = new ReachabilityIndex(graph);
        List<BucketedCourse> entries = new ArrayList<>();
        for (String code : new TreeSet<>(pool)) {
            if (student.completed().contains(code)) continue;
            entries.add(scorer.bucketEntry(student, code, reachability));
        }
        entries.sort(Comparator.comparingInt(BucketedCourse::missingCount)
                .thenComparingInt(BucketedCourse::chainDepth)
                .thenComparing(BucketedCourse::course));

        int max = limit == null || limit <= 0 ? Integer.MAX_VALUE : limit;
        Map<ReadinessBucket, List<BucketedCourse>> byBucket = new EnumMap<>(ReadinessBucket.class);
        for (ReadinessBucket bucket : ReadinessBucket.values()) {
            byBucket.put(bucket, new ArrayList<>());
        }
        entries.stream().limit(max).forEach(e -> byBucket.get(ReadinessBucket.forMissing(e.missingCount())).add(e));
        byBucket.replaceAll((bucket, list) -> List.copyOf(list));
        return new ReadinessBuckets(student.studentId(), entries.size(), byBucket);
    }

    private ReadinessScorer scorer(GraphStore graph) {
        return new ReadinessScorer(graph, properties.readiness().almostReadyThreshold());
    }
}
