package com.herzen.planner.graph;

import com.herzen.planner.graph.GraphModels.*;
import com.herzen.planner.service.CatalogService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

@Service
public class CurriculumGraphService {
    private final CatalogService catalogService;

    public CurriculumGraphService(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public CycleReport cycles() {
        List<CourseCycle> cycles = new CycleDetector(catalogService.current().graph()).findCycles();
        return new CycleReport(cycles.isEmpty(), cycles);
    }

    public CourseReach prerequisites(String courseCode, boolean transitive, Integer depth) {
        return reach(courseCode, Direction.PREREQUISITES, transitive, depth);
    }

    public CourseReach dependents(String courseCode, boolean transitive, Integer depth) {
        return reach(courseCode, Direction.DEPENDENTS, transitive, depth);
    }

    public PrerequisiteChain chain(String courseCode) {
        return new ReachabilityIndex(catalogService.current().graph()).criticalChain(courseCode);
    }

    private CourseReach reach(String courseCode, Direction direction, boolean transitive, Integer depth) {
        GraphStore graph = catalogService.current().graph();
        ReachabilityIndex index = new ReachabilityIndex(graph);

        if (depth != null) {
            BoundedReach bounded = direction == Direction.PREREQUISITES
                    ? index.prerequisitesWithin(courseCode, depth)
                    : index.dependentsWithin(courseCode, depth);
            return new CourseReach(courseCode, direction, true, List.copyOf(bounded.courses()),
                    bounded.byDepth(), bounded.chainDepth(), bounded.partial());
        }

        if (!transitive) {
            SortedSet<String> direct = direction == Direction.PREREQUISITES
                    ? graph.prerequisitesOf(courseCode)
                    : graph.dependentsOf(courseCode);
            return new CourseReach(courseCode, direction, false, List.copyOf(direct),
                    direct.isEmpty() ? Map.of() : Map.of(1, List.copyOf(direct)),
                    direct.isEmpty() ? 0 : 1, false);
        }

        SortedSet<String> closure = direction == Direction.PREREQUISITES
                ? index.transitivePrerequisitesOf(courseCode)
                : index.transitiveDependentsOf(courseCode);
        int chainDepth = direction == Direction.PREREQUISITES
                ? index.chainDepth(courseCode)
                : index.dependentDepth(courseCode);
        return new CourseReach(courseCode, direction, true, List.copyOf(closure), Map.of(), chainDepth, false);
    }
}
