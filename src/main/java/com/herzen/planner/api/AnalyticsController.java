package com.herzen.planner.api;

import com.herzen.planner.analytics.AnalyticsModels;
import com.herzen.planner.analytics.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/bottlenecks")
    public ResponseEntity<AnalyticsModels.BottleneckResponse> bottlenecks(@RequestParam(required = false) Integer minDependents,
                                                                          @RequestParam(required = false) Integer minPrerequisites,
                                                                          @RequestParam(required = false) Integer depth,
                                                                          @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(analyticsService.bottlenecks(minDependents, minPrerequisites, depth, limit));
    }

    @GetMapping("/impact")
    public ResponseEntity<List<AnalyticsModels.CourseImpact>> impact(@RequestParam(required = false) String department) {
        return ResponseEntity.ok(analyticsService.impact(department));
    }

    @GetMapping("/centrality")
    public ResponseEntity<List<AnalyticsModels.CentralityScore>> centrality(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(analyticsService.centrality(limit));
    }

    @GetMapping("/progress")
    public ResponseEntity<AnalyticsModels.ProgressComparison> progress(@RequestParam(required = false) String studentIds) {
        return ResponseEntity.ok(analyticsService.progress(parseCsv(studentIds)));
    }

    private Set<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
