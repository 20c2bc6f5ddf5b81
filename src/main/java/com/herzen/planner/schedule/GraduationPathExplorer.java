package com.herzen.planner.schedule;

import com.herzen.planner.domain.DomainModels.SemesterOffering;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.schedule.ScheduleModels.*;

import java.util.*;

/**
 * Produces alternative orderings of a student's remaining courses. Each priority rule drives
 * one topological sort and one horizon plan; when the rules yield fewer than {@code k}
 * distinct orderings, the rest come from enumerating topological orders in code order.
 */
public class GraduationPathExplorer {
    public static final String ENUMERATED = "ENUMERATED";
    public static final String ALREADY_COMPLETE = "ALREADY_COMPLETE";

    private final GraphStore graph;
    private final ScheduleOptimizer optimizer;

    public GraduationPathExplorer(ScheduleOptimizer optimizer, GraphStore graph) {
        this.optimizer = optimizer;
        this.graph = graph;
    }

    public List<GraduationPath> explore(StudentState student,
                                        Collection<String> requiredCourses,
                                        List<SemesterOffering> semesters,
                                        ScheduleConstraints constraints,
                                        int k) {
        if (k < 1) throw new IllegalArgumentException("Path count must be at least 1, got " + k);

        SortedSet<String> remaining = optimizer.remaining(student, requiredCourses);
        if (remaining.isEmpty()) {
            return List.of(new GraduationPath(ALREADY_COMPLETE, List.of(), SchedulePlan.empty()));
        }

        Map<String, CourseMetrics> metrics = optimizer.metrics(remaining, optimizer.satisfiedAtStart(student));

        Map<List<String>, GraduationPath> found = new LinkedHashMap<>();
        for (PriorityRule rule : PriorityRule.values()) {
            if (found.size() >= k) break;
            List<String> ordering = topologicalOrder(remaining, Comparator.comparing(metrics::get, rule.comparator()));
            if (found.containsKey(ordering)) continue;
            SchedulePlan plan = optimizer.optimize(student, requiredCourses, semesters, constraints, rule);
            found.put(ordering, new GraduationPath(rule.name(), ordering, plan));
        }

        if (found.size() < k) {
            SchedulePlan defaultPlan = found.values().iterator().next().plan();
            for (List<String> ordering : enumerateOrders(remaining, k, found.keySet())) {
                found.put(ordering, new GraduationPath(ENUMERATED, ordering, defaultPlan));
            }
        }
        return List.copyOf(found.values());
    }

    /** Each course appears exactly once and after every prerequisite that is itself in {@code courses}. */
    public boolean isValidOrdering(List<String> ordering, Set<String> courses) {
        if (ordering.size() != courses.size() || !courses.containsAll(ordering)) return false;
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < ordering.size(); i++) {
            position.put(ordering.get(i), i);
        }
        for (String code : ordering) {
            for (String prerequisite : graph.prerequisitesOf(code)) {
                Integer before = position.get(prerequisite);
                if (before != null && before >= position.get(code)) return false;
            }
        }
        return true;
    }

    List<String> topologicalOrder(Set<String> courses, Comparator<String> priority) {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String code : courses) {
            inDegree.put(code, (int) graph.prerequisitesOf(code).stream().filter(courses::contains).count());
        }

        PriorityQueue<String> ready = new PriorityQueue<>(priority);
        inDegree.forEach((code, degree) -> {
            if (degree == 0) ready.add(code);
        });

        List<String> ordering = new ArrayList<>(courses.size());
        while (!ready.isEmpty()) {
            String code = ready.poll();
            ordering.add(code);
            for (String dependent : graph.dependentsOf(code)) {
                if (!courses.contains(dependent)) continue;
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) ready.add(dependent);
            }
        }
        if (ordering.size() != courses.size()) {
            throw new IllegalStateException("Courses left unordered: " + courses.size() + " vs " + ordering.size());
        }
        return List.copyOf(ordering);
    }

    private List<List<String>> enumerateOrders(SortedSet<String> courses, int k, Set<List<String>> known) {
        List<List<String>> results = new ArrayList<>();
        backtrack(courses, new LinkedHashSet<>(), k - known.size(), known, results);
        return results;
    }

    private boolean backtrack(SortedSet<String> courses,
                              LinkedHashSet<String> order,
                              int wanted,
                              Set<List<String>> known,
                              List<List<String>> results) {
        if (order.size() == courses.size()) {
            List<String> candidate = List.copyOf(order);
            if (!known.contains(candidate)) results.add(candidate);
            return results.size() >= wanted;
        }
        for (String code : courses) {
            if (order.contains(code)) continue;
            boolean ready = graph.prerequisitesOf(code).stream()
                    .filter(courses::contains)
                    .allMatch(order::contains);
            if (!ready) continue;

            order.add(code);
            boolean done = backtrack(courses, order, wanted, known, results);
            order.remove(code);
            if (done) return true;
        }
        return false;
    }
}
