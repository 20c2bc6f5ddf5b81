package com.herzen.planner;

import com.herzen.planner.domain.DomainModels.SemesterOffering;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.schedule.GraduationPathExplorer;
import com.herzen.planner.schedule.ScheduleModels.*;
import com.herzen.planner.schedule.ScheduleOptimizer;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.herzen.planner.Catalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class GraduationPathExplorerTest {

    private static GraduationPathExplorer explorer(GraphStore graph) {
        return new GraduationPathExplorer(new ScheduleOptimizer(new ReachabilityIndex(graph), 3), graph);
    }

    @Test
    void producesDistinctValidOrderings() {
        GraphStore graph = curriculum();
        GraduationPathExplorer explorer = explorer(graph);

        List<GraduationPath> paths = explorer.explore(student(), programCourses(), openSemesters(6),
                new ScheduleConstraints(2, 18, 6), 3);

        assertEquals(3, paths.size());
        assertEquals(PriorityRule.UNLOCKS_FIRST.name(), paths.get(0).strategy());
        assertEquals(3, new HashSet<>(paths.stream().map(GraduationPath::ordering).toList()).size());
        for (GraduationPath path : paths) {
            assertTrue(explorer.isValidOrdering(path.ordering(), programCourses()), path.strategy());
            assertEquals(7, path.plan().totalCourses());
        }
    }

    @Test
    void fallsBackToEnumerationWhenRulesAgree() {
        GraphStore flat = GraphStore.build(List.of(course("A", 3, null), course("B", 3, null), course("C", 3, null)), List.of());
        List<SemesterOffering> semesters = List.of(semester(2024, 1, 1, "A", "B", "C"));

        List<GraduationPath> paths = explorer(flat).explore(student(), Set.of("A", "B", "C"), semesters,
                ScheduleConstraints.ofMaxCourses(5), 4);

        assertEquals(List.of("UNLOCKS_FIRST", "REVERSE_LEXICOGRAPHIC", GraduationPathExplorer.ENUMERATED,
                GraduationPathExplorer.ENUMERATED), paths.stream().map(GraduationPath::strategy).toList());
        assertEquals(List.of("A", "B", "C"), paths.get(0).ordering());
        assertEquals(List.of("C", "B", "A"), paths.get(1).ordering());
        assertEquals(List.of("A", "C", "B"), paths.get(2).ordering());
        assertEquals(List.of("B", "A", "C"), paths.get(3).ordering());
        assertSame(paths.get(0).plan(), paths.get(3).plan());
    }

    @Test
    void returnsFewerPathsWhenOnlyOneOrderExists() {
        GraphStore chain = GraphStore.build(List.of(course("X", 3, null), course("Y", 3, null)), List.of(requires("Y", "X")));

        List<GraduationPath> paths = explorer(chain).explore(student(), Set.of("X", "Y"),
                List.of(semester(2024, 1, 1, "X", "Y"), semester(2024, 2, 2, "X", "Y")),
                ScheduleConstraints.ofMaxCourses(5), 5);

        assertEquals(1, paths.size());
        assertEquals(List.of("X", "Y"), paths.get(0).ordering());
    }

    @Test
    void cycleOutsideRemainingCoursesStillYieldsPaths() {
        GraphStore tangled = GraphStore.build(
                List.of(course("A", 3, null), course("B", 3, null), course("Y", 3, null), course("Z", 3, null)),
                List.of(requires("B", "A"), requires("Y", "A"), requires("Y", "Z"), requires("Z", "Y")));

        List<GraduationPath> paths = explorer(tangled).explore(student(), Set.of("A", "B"),
                List.of(semester(2024, 1, 1, "A"), semester(2024, 2, 2, "B")), ScheduleConstraints.ofMaxCourses(5), 3);

        assertEquals(1, paths.size());
        assertEquals(List.of("A", "B"), paths.get(0).ordering());
    }

    @Test
    void completedProgramGivesSinglePath() {
        List<GraduationPath> paths = explorer(curriculum()).explore(student("CS125"), Set.of("CS125"), openSemesters(1),
                ScheduleConstraints.ofMaxCourses(5), 3);

        assertEquals(1, paths.size());
        assertEquals(GraduationPathExplorer.ALREADY_COMPLETE, paths.get(0).strategy());
        assertTrue(paths.get(0).ordering().isEmpty());
    }

    @Test
    void rejectsPathCountBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> explorer(curriculum()).explore(student(), programCourses(),
                openSemesters(1), ScheduleConstraints.ofMaxCourses(5), 0));
    }

    @Test
    void orderingValidationCatchesViolations() {
        GraduationPathExplorer explorer = explorer(curriculum());

        assertTrue(explorer.isValidOrdering(List.of("CS125", "CS173"), Set.of("CS125", "CS173")));
        assertFalse(explorer.isValidOrdering(List.of("CS173", "CS125"), Set.of("CS125", "CS173")));
        assertFalse(explorer.isValidOrdering(List.of("CS125"), Set.of("CS125", "CS173")));
    }
}
