package com.herzen.planner.api;

import com.herzen.planner.graph.CurriculumGraphService;
import com.herzen.planner.graph.GraphModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class CourseGraphController {
    private final CurriculumGraphService graphService;

    public CourseGraphController(CurriculumGraphService graphService) {
        this.graphService = graphService;
    }

    @GetMapping("/graph/cycles")
    public ResponseEntity<GraphModels.CycleReport> cycles() {
        return ResponseEntity.ok(graphService.cycles());
    }

    @GetMapping("/courses/{code}/prerequisites")
    public ResponseEntity<GraphModels.CourseReach> prerequisites(@PathVariable String code,
                                                                 @RequestParam(defaultValue = "false") boolean transitive,
                                                                 @RequestParam(required = false) Integer depth) {
        return ResponseEntity.ok(graphService.prerequisites(code, transitive, depth));
    }

    @GetMapping("/courses/{code}/dependents")
    public ResponseEntity<GraphModels.CourseReach> dependents(@PathVariable String code,
                                                              @RequestParam(defaultValue = "false") boolean transitive,
                                                              @RequestParam(required = false) Integer depth) {
        return ResponseEntity.ok(graphService.dependents(code, transitive, depth));
    }

    @GetMapping("/courses/{code}/chain")
    public ResponseEntity<GraphModels.PrerequisiteChain> chain(@PathVariable String code) {
        return ResponseEntity.ok(graphService.chain(code));
    }
}
