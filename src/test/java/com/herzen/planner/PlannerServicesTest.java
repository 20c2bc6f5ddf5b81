package com.herzen.planner;

import com.herzen.planner.analytics.AnalyticsService;
import com.herzen.planner.domain.DomainModels.*;
import com.herzen.planner.error.CycleDetectedException;
import com.herzen.planner.error.InvalidRequestException;
import com.herzen.planner.error.MalformedGraphException;
import com.herzen.planner.error.NotFoundException;
import com.herzen.planner.graph.CurriculumGraphService;
import com.herzen.planner.readiness.ReadinessModels.*;
import com.herzen.planner.readiness.ReadinessService;
import com.herzen.planner.schedule.PlanningService;
import com.herzen.planner.schedule.PlanningService.PlanRequest;
import com.herzen.planner.service.CatalogService;
import com.herzen.planner.service.StudentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.herzen.planner.Catalogs.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PlannerServicesTest {
    @Autowired
    private CatalogService catalogService;
    @Autowired
    private StudentService studentService;
    @Autowired
    private ReadinessService readinessService;
    @Autowired
    private PlanningService planningService;
    @Autowired
    private AnalyticsService analyticsService;
    @Autowired
    private CurriculumGraphService graphService;

    @BeforeEach
    void importCurriculum() {
        catalogService.importCatalog(curriculumSnapshot());
        studentService.save(new StudentState("svc-ann", "Ann", PROGRAM, Set.of("CS125"), Set.of("MATH241")));
        studentService.save(new StudentState("svc-bo", "Bo", PROGRAM, Set.of(), Set.of()));
    }

    @Test
    void importedCatalogSurvivesReloadFromStorage() {
        var summary = catalogService.summary();
        assertEquals(8, summary.courses());
        assertEquals(7, summary.prerequisiteEdges());
        assertEquals(6, summary.semesters());
        assertEquals(List.of(PROGRAM), summary.programs());

        catalogService.invalidate();
        var reloaded = catalogService.current();
        assertEquals(8, reloaded.graph().size());
        assertEquals(Set.of("CS125", "MATH241"), reloaded.graph().prerequisitesOf("CS225"));
        assertEquals(programCourses(), reloaded.program(PROGRAM).requiredCourses());
        assertTrue(reloaded.semester("2024-1").offers("CS421"));
        assertEquals("CS999", reloaded.graph().course("CS999").code());
    }

    @Test
    void malformedImportKeepsPreviousCatalog() {
        var broken = new CatalogSnapshot(curriculumCourses(), curriculumEdges(), List.of(semester(2024, 1, 1, "CS404")),
                List.of(new ProgramRequirement(PROGRAM, Set.of("CS125", "CS405"))));

        var ex = assertThrows(MalformedGraphException.class, () -> catalogService.importCatalog(broken));
        assertEquals(2, ex.getProblems().size());
        assertEquals(6, catalogService.summary().semesters());
    }

    @Test
    void readinessAndEligibilityForStoredStudent() {
        ReadinessReport report = readinessService.readiness("svc-ann", "CS225");
        assertEquals(50, report.score());
        assertEquals(List.of("MATH241"), report.missingPrerequisites());

        assertEquals(EligibilityReason.OK, readinessService.eligibility("svc-ann", "CS173").reason());
        assertEquals(EligibilityReason.COURSE_NOT_FOUND, readinessService.eligibility("svc-ann", "CS404").reason());
        EligibilityReport ghost = readinessService.eligibility("ghost", "CS225");
        assertEquals(EligibilityReason.STUDENT_NOT_FOUND, ghost.reason());
        assertEquals(List.of("CS125", "MATH241"), ghost.missing());

        assertThrows(NotFoundException.class, () -> readinessService.readiness("ghost", "CS225"));
    }

    @Test
    void recommendationsRankOfferedCoursesByReadiness() {
        RecommendationList ready = readinessService.recommendations("svc-ann", "2024-1", null, null);
        assertEquals(75, ready.minReadiness());
        assertEquals(1, ready.recommendations().size());
        CourseRecommendation top = ready.recommendations().get(0);
        assertEquals("CS173", top.course());
        assertEquals(2, top.unlocksCount());
        assertEquals(List.of("CS374", "CS421"), top.sampleUnlocked());

        RecommendationList all = readinessService.recommendations("svc-ann", "2024-1", 0, null);
        assertEquals(List.of("CS173", "CS225", "CS233", "CS374", "CS421"),
                all.recommendations().stream().map(CourseRecommendation::course).toList());

        assertThrows(NotFoundException.class, () -> readinessService.recommendations("svc-ann", "1999-1", null, null));
    }

    @Test
    void bucketsGroupRemainingProgramCourses() {
        ReadinessBuckets buckets = readinessService.buckets("svc-ann", null);

        assertEquals(6, buckets.totalRemaining());
        assertEquals(List.of("MATH241", "CS173"), codes(buckets.byBucket().get(ReadinessBucket.READY_NOW)));
        assertEquals(List.of("CS225", "CS233", "CS421"), codes(buckets.byBucket().get(ReadinessBucket.ALMOST_READY)));
        assertEquals(List.of("CS374"), codes(buckets.byBucket().get(ReadinessBucket.PLAN_SOON)));
        assertTrue(buckets.byBucket().get(ReadinessBucket.PLAN_LATER).isEmpty());

        StudentSummary summary = readinessService.summary("svc-ann", null);
        assertEquals(1, summary.completedCourses());
        assertEquals("2024-1", summary.nextSemester().semesterId());
    }

    @Test
    void scheduleLeavesCoursesBlockedByEnrolledPrerequisite() {
        var schedule = planningService.schedule("svc-ann", new PlanRequest(null, 2, 18, 6, null, null));

        assertEquals(PROGRAM, schedule.program());
        assertEquals(List.of("CS173"), schedule.plan().orderedCourses());
        assertEquals(List.of("CS225", "CS233", "CS374", "CS421"), schedule.plan().unscheduled());
        assertTrue(schedule.plan().warnings().contains("CS225 is blocked by prerequisites outside the plan: MATH241"));
    }

    @Test
    void scheduleHonoursStartPositionAndDefaults() {
        var schedule = planningService.schedule("svc-bo", new PlanRequest(PROGRAM, null, null, null, 3, null));

        assertEquals("2025-1", schedule.plan().semesters().get(0).semesterId());
        assertEquals(7, schedule.plan().totalCourses());
        assertEquals(0, planningService.schedule("svc-bo", null).plan().unscheduled().size());
    }

    @Test
    void scheduleRejectsCapsOutsideBounds() {
        var courses = assertThrows(InvalidRequestException.class,
                () -> planningService.schedule("svc-bo", new PlanRequest(null, 9, null, null, null, null)));
        assertEquals("maxCoursesPerSemester", courses.getField());
        assertThrows(InvalidRequestException.class,
                () -> planningService.schedule("svc-bo", new PlanRequest(null, null, 5, null, null, null)));
        assertThrows(InvalidRequestException.class,
                () -> planningService.schedule("svc-bo", new PlanRequest(null, null, null, 13, null, null)));

        var program = assertThrows(NotFoundException.class,
                () -> planningService.schedule("svc-bo", new PlanRequest("Unknown", null, null, null, null, null)));
        assertEquals(NotFoundException.Kind.PROGRAM, program.getKind());
    }

    @Test
    void graduationPathsAndSequence() {
        var paths = planningService.graduationPaths("svc-bo", null, null);
        assertEquals(3, paths.paths().size());
        assertEquals(7, paths.remainingCourses().size());

        assertThrows(InvalidRequestException.class, () -> planningService.graduationPaths("svc-bo", null, 11));

        var sequence = planningService.sequence("svc-bo", null);
        assertEquals(4, sequence.recommendedSequence().size());
        assertEquals(List.of("CS421"), sequence.recommendedSequence().get(3));
    }

    @Test
    void cyclicCatalogIsReportedAndAbortsPlanning() {
        List<PrerequisiteEdge> edges = new ArrayList<>(curriculumEdges());
        edges.add(requires("CS125", "CS374"));
        catalogService.importCatalog(new CatalogSnapshot(curriculumCourses(), edges, openSemesters(4),
                List.of(new ProgramRequirement(PROGRAM, programCourses()))));

        var report = graphService.cycles();
        assertFalse(report.acyclic());
        assertEquals(List.of("CS125", "CS374", "CS173"), report.cycles().get(0).courses());

        assertThrows(CycleDetectedException.class, () -> planningService.schedule("svc-bo", null));
        assertEquals(List.of("CS374"), graphService.prerequisites("CS125", false, null).courses());
    }

    @Test
    void graphQueriesOverCurrentCatalog() {
        assertEquals(List.of("CS374"), graphService.prerequisites("CS421", false, null).courses());
        assertEquals(5, graphService.prerequisites("CS421", true, null).courses().size());
        assertTrue(graphService.prerequisites("CS421", true, 2).partial());
        assertEquals(3, graphService.dependents("CS125", true, null).chainDepth());
        assertEquals(List.of("CS421", "CS374", "CS173", "CS125"), graphService.chain("CS421").criticalChain());
    }

    @Test
    void analyticsUseConfiguredDefaults() {
        var bottlenecks = analyticsService.bottlenecks(null, null, null, null);
        assertEquals(3, bottlenecks.minDependents());
        assertTrue(bottlenecks.bottlenecks().isEmpty());

        var progress = analyticsService.progress(List.of("svc-ann", "svc-bo", "ghost"));
        assertEquals(2, progress.comparisonCount());
        assertEquals("svc-ann", progress.students().get(0).studentId());

        assertEquals("CS125", analyticsService.centrality(1).get(0).code());
        assertEquals(1, analyticsService.impact("MATH").size());
    }

    private static List<String> codes(List<BucketedCourse> entries) {
        return entries.stream().map(BucketedCourse::course).toList();
    }
}
