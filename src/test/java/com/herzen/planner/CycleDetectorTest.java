package com.herzen.planner;

import com.herzen.planner.domain.DomainModels.Course;
import com.herzen.planner.domain.DomainModels.PrerequisiteEdge;
import com.herzen.planner.graph.CycleDetector;
import com.herzen.planner.graph.GraphModels.CourseCycle;
import com.herzen.planner.graph.GraphStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.herzen.planner.Catalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    @Test
    void acyclicCurriculumHasNoCycles() {
        CycleDetector detector = new CycleDetector(curriculum());

        assertTrue(detector.findCycles().isEmpty());
        assertFalse(detector.hasCycles());
        assertEquals(8, detector.stronglyConnectedComponents().size());
    }

    @Test
    void findsInjectedThreeCourseCycle() {
        List<PrerequisiteEdge> edges = new ArrayList<>(curriculumEdges());
        edges.add(requires("CS125", "CS374"));
        GraphStore graph = GraphStore.build(curriculumCourses(), edges);

        List<CourseCycle> cycles = new CycleDetector(graph).findCycles();

        assertEquals(1, cycles.size());
        CourseCycle cycle = cycles.get(0);
        assertEquals("CS125", cycle.first());
        assertEquals(List.of("CS125", "CS374", "CS173"), cycle.courses());
        assertEquals(List.of("CS125", "CS374", "CS173", "CS125"), cycle.path());
    }

    @Test
    void reportsCycleStartingAtSmallestCode() {
        GraphStore graph = GraphStore.build(
                List.of(course("A", 3, null), course("B", 3, null), course("C", 3, null), course("D", 3, null)),
                List.of(requires("A", "B"), requires("B", "C"), requires("C", "A"), requires("D", "A")));

        CycleDetector detector = new CycleDetector(graph);

        assertEquals(List.of(new CourseCycle(List.of("A", "B", "C"))), detector.findCycles());
        assertEquals(List.of("A", "B", "C"), detector.cycleThrough("B").orElseThrow().courses());
        assertTrue(detector.cycleThrough("D").isEmpty());
    }

    @Test
    void selfEdgeIsAOneCourseCycle() {
        GraphStore graph = GraphStore.build(
                List.of(course("A", 3, null), course("B", 3, null)),
                List.of(requires("A", "A"), requires("B", "A")));

        List<CourseCycle> cycles = new CycleDetector(graph).findCycles();

        assertEquals(1, cycles.size());
        assertEquals(1, cycles.get(0).length());
        assertEquals(List.of("A", "A"), cycles.get(0).path());
    }

    @Test
    void separateCyclesAreOrderedByFirstCourse() {
        GraphStore graph = GraphStore.build(
                List.of(course("A", 3, null), course("B", 3, null), course("X", 3, null), course("Y", 3, null)),
                List.of(requires("Y", "X"), requires("X", "Y"), requires("B", "A"), requires("A", "B")));

        List<CourseCycle> cycles = new CycleDetector(graph).findCycles();

        assertEquals(2, cycles.size());
        assertEquals("A", cycles.get(0).first());
        assertEquals("X", cycles.get(1).first());
    }

    @Test
    void normalizedRotatesButKeepsDirection() {
        assertEquals(List.of("A", "B", "C"), CourseCycle.normalized(List.of("C", "A", "B")).courses());
        assertThrows(IllegalArgumentException.class, () -> new CourseCycle(List.of()));
    }
    @Test
    void handlesComponentsLongerThanTheCallStack() {
        int length = 20_000;
        List<Course> courses = new ArrayList<>();
        List<PrerequisiteEdge> edges = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            courses.add(course(String.format("C%05d", i), 3, null));
            edges.add(requires(String.format("C%05d", i), String.format("C%05d", (i + length - 1) % length)));
        }

        List<CourseCycle> cycles = new CycleDetector(GraphStore.build(courses, edges)).findCycles();

        assertEquals(1, cycles.size());
        assertEquals(length, cycles.get(0).length());
        assertEquals("C00000", cycles.get(0).first());
        assertEquals("C19999", cycles.get(0).courses().get(1));
    }
}
