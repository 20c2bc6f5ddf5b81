package com.herzen.planner;

import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.error.NotFoundException;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.readiness.ReadinessModels.*;
import com.herzen.planner.readiness.ReadinessScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.herzen.planner.Catalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class ReadinessScorerTest {
    private final GraphStore graph = curriculum();
    private final ReadinessScorer scorer = new ReadinessScorer(graph);

    @Test
    void completedPrerequisitesMakeCourseReady() {
        ReadinessReport report = scorer.score(student("CS125", "MATH241"), "CS225");

        assertEquals(100, report.score());
        assertTrue(report.missingPrerequisites().isEmpty());
        assertEquals(ReadinessStatus.READY_NOW, report.status());
    }

    @Test
    void halfCompletedPrerequisitesScoreFifty() {
        ReadinessReport report = scorer.score(student("CS125"), "CS225");

        assertEquals(50, report.score());
        assertEquals(List.of("MATH241"), report.missingPrerequisites());
        assertEquals(ReadinessStatus.NOT_READY, report.status());
        assertFalse(report.surfaced());
    }

    @Test
    void coursesWithoutPrerequisitesAlwaysScoreHundred() {
        for (String code : graph.codes()) {
            if (!graph.prerequisitesOf(code).isEmpty()) continue;
            assertEquals(100, scorer.score(student(), code).score(), code);
        }
    }

    @Test
    void thresholdSeparatesAlmostReady() {
        GraphStore wide = GraphStore.build(
                List.of(course("P1", 3, null), course("P2", 3, null), course("P3", 3, null), course("P4", 3, null),
                        course("T", 3, null)),
                List.of(requires("T", "P1"), requires("T", "P2"), requires("T", "P3"), requires("T", "P4")));

        ReadinessReport report = new ReadinessScorer(wide).score(student("P1", "P2", "P3"), "T");
        assertEquals(75, report.score());
        assertEquals(ReadinessStatus.ALMOST_READY, report.status());

        ReadinessReport strict = new ReadinessScorer(wide, 80).score(student("P1", "P2", "P3"), "T");
        assertEquals(ReadinessStatus.NOT_READY, strict.status());

        assertThrows(IllegalArgumentException.class, () -> new ReadinessScorer(wide, 101));
    }

    @Test
    void scoreNeverDropsAsCoursesAreCompleted() {
        List<String> completionOrder = List.of("CS125", "MATH241", "CS173", "CS225", "CS233", "CS374", "CS421", "CS999");
        Set<String> completed = new HashSet<>();
        List<Integer> previous = new ArrayList<>();
        for (String code : graph.codes()) previous.add(scorer.score(student(), code).score());

        for (String done : completionOrder) {
            completed.add(done);
            StudentState state = StudentState.anonymous(completed);
            int i = 0;
            for (String code : graph.codes()) {
                int score = scorer.score(state, code).score();
                assertTrue(score >= previous.get(i), code + " dropped after completing " + done);
                previous.set(i++, score);
            }
        }
    }

    @Test
    void unknownTargetRaisesNotFound() {
        assertThrows(NotFoundException.class, () -> scorer.score(student(), "CS404"));
    }

    @Test
    void eligibilityUsesTransitivePrerequisites() {
        ReachabilityIndex index = new ReachabilityIndex(graph);

        EligibilityReport blocked = scorer.eligibility(student("CS173", "CS225"), "CS374", index);
        assertFalse(blocked.canTake());
        assertEquals(EligibilityReason.MISSING_PREREQUISITES, blocked.reason());
        assertEquals(List.of("CS125", "MATH241"), blocked.missing());

        EligibilityReport open = scorer.eligibility(student("CS125", "MATH241", "CS173", "CS225"), "CS374", index);
        assertTrue(open.canTake());
        assertEquals(EligibilityReason.OK, open.reason());
        assertEquals(List.of("CS125", "CS173", "CS225", "MATH241"), open.required());
    }

    @Test
    void bucketsFollowDirectMissingCount() {
        ReachabilityIndex index = new ReachabilityIndex(graph);

        BucketedCourse entry = scorer.bucketEntry(student(), "CS374", index);
        assertEquals(2, entry.missingCount());
        assertEquals(2, entry.chainDepth());
        assertEquals(ReadinessBucket.PLAN_SOON, ReadinessBucket.forMissing(entry.missingCount()));
        assertEquals(ReadinessBucket.READY_NOW, ReadinessBucket.forMissing(0));
        assertEquals(ReadinessBucket.ALMOST_READY, ReadinessBucket.forMissing(1));
        assertEquals(ReadinessBucket.PLAN_LATER, ReadinessBucket.forMissing(4));
    }
}
