package com.herzen.planner.analytics;

import com.herzen.planner.analytics.AnalyticsModels.CentralityScore;
import com.herzen.planner.graph.GraphStore;

import java.util.*;

/**
 * PageRank over requires edges: a course passes rank to its prerequisites, so heavily
 * required foundations score high. Scores are not normalised (base {@code 1 - damping}).
 */
public class CentralityRanker {
    public static final double DAMPING = 0.85;
    public static final int MAX_ITERATIONS = 20;
    public static final double TOLERANCE = 1e-7;

    private final GraphStore graph;

    public CentralityRanker(GraphStore graph) {
        this.graph = graph;
    }

    public List<CentralityScore> pageRank(int limit) {
        List<String> codes = new ArrayList<>(graph.codes());
        Map<String, Double> scores = new HashMap<>();
        codes.forEach(code -> scores.put(code, 1.0 - DAMPING));

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            Map<String, Double> next = new HashMap<>();
            double maxDelta = 0.0;
            for (String code : codes) {
                double incoming = 0.0;
                for (String dependent : graph.dependentsOf(code)) {
                    incoming += scores.get(dependent) / graph.prerequisitesOf(dependent).size();
                }
                double score = (1.0 - DAMPING) + DAMPING * incoming;
                maxDelta = Math.max(maxDelta, Math.abs(score - scores.get(code)));
                next.put(code, score);
            }
            scores.putAll(next);
            if (maxDelta < TOLERANCE) break;
        }

        return codes.stream()
                .map(code -> new CentralityScore(code, graph.course(code).name(), scores.get(code)))
                .sorted(Comparator.comparingDouble(CentralityScore::score).reversed().thenComparing(CentralityScore::code))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .toList();
    }
}
