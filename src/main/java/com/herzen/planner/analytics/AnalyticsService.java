package com.herzen.planner.analytics;

import com.herzen.planner.config.PlannerProperties;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.service.CatalogService;
import com.herzen.planner.service.StudentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
public class AnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final CatalogService catalogService;
    private final StudentService studentService;
    private final PlannerProperties properties;

    public AnalyticsService(CatalogService catalogService, StudentService studentService, PlannerProperties properties) {
        this.catalogService = catalogService;
        this.studentService = studentService;
        this.properties = properties;
    }

    public AnalyticsModels.BottleneckResponse bottlenecks(Integer minDependents, Integer minPrerequisites, Integer depth, Integer limit) {
        PlannerProperties.Bottleneck defaults = properties.bottleneck();
        int dependents = minDependents == null ? defaults.minDependents() : minDependents;
        int prerequisites = minPrerequisites == null ? defaults.minPrerequisites() : minPrerequisites;
        int boundedDepth = Math.max(1, Math.min(BottleneckAnalyzer.MAX_PREREQUISITE_DEPTH,
                depth == null ? defaults.depth() : depth));

        List<AnalyticsModels.BottleneckCourse> rows = analyzer()
                .bottlenecks(dependents, prerequisites, boundedDepth, limit == null ? 0 : limit);
        return new AnalyticsModels.BottleneckResponse(dependents, prerequisites, boundedDepth, rows);
    }

    public List<AnalyticsModels.CourseImpact> impact(String department) {
        log.debug("Computing impact analysis for department filter '{}'", department);
        List<AnalyticsModels.CourseImpact> rows = analyzer().impact(department);
        log.debug("Impact analysis produced {} rows", rows.size());
        return rows;
    }

    public List<AnalyticsModels.CentralityScore> centrality(Integer limit) {
        log.debug("Ranking courses by centrality");
        return new CentralityRanker(catalogService.current().graph()).pageRank(limit == null ? 0 : limit);
    }

    public AnalyticsModels.ProgressComparison progress(Collection<String> studentIds) {
        List<StudentState> students = studentService.findAll(studentIds);
        List<AnalyticsModels.StudentProgress> rows = analyzer().compareProgress(students, properties.defaultCredits());
        return new AnalyticsModels.ProgressComparison(rows, rows.size());
    }

    private BottleneckAnalyzer analyzer() {
        return new BottleneckAnalyzer(new ReachabilityIndex(catalogService.current().graph()));
    }
}
