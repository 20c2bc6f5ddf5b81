package com.herzen.planner.graph;

import com.herzen.planner.error.CycleDetectedException;
import com.herzen.planner.graph.GraphModels.BoundedReach;
import com.herzen.planner.graph.GraphModels.CourseCycle;
import com.herzen.planner.graph.GraphModels.Direction;
import com.herzen.planner.graph.GraphModels.PrerequisiteChain;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Transitive prerequisite and dependent closures over a {@link GraphStore}.
 *
 * <p>Unbounded queries use memoized depth-first traversal; each course is expanded at most once
 * per direction for the lifetime of the index. A back edge met during traversal raises
 * {@link CycleDetectedException} carrying the cycle. Bounded queries stop at the requested depth
 * and never raise.</p>
 *
 * <p>Instances hold mutable memo tables and belong to a single computation.</p>
 */
public class ReachabilityIndex {
    private final GraphStore graph;
    private final Map<String, SortedSet<String>> prerequisiteClosure = new HashMap<>();
    private final Map<String, SortedSet<String>> dependentClosure = new HashMap<>();
    private final Map<String, Integer> prerequisiteDepth = new HashMap<>();
    private final Map<String, Integer> dependentDepth = new HashMap<>();

    public ReachabilityIndex(GraphStore graph) {
        this.graph = graph;
    }

    public GraphStore graph() {
        return graph;
    }

    public SortedSet<String> transitivePrerequisitesOf(String code) {
        graph.course(code);
        return closure(code, Direction.PREREQUISITES);
    }

    public SortedSet<String> transitiveDependentsOf(String code) {
        graph.course(code);
        return closure(code, Direction.DEPENDENTS);
    }

    public BoundedReach prerequisitesWithin(String code, int maxDepth) {
        return bounded(code, maxDepth, Direction.PREREQUISITES);
    }

    public BoundedReach dependentsWithin(String code, int maxDepth) {
        return bounded(code, maxDepth, Direction.DEPENDENTS);
    }

    /** Length of the longest prerequisite chain below {@code code}; 0 when it has none. */
    public int chainDepth(String code) {
        graph.course(code);
        return longest(code, Direction.PREREQUISITES, c -> true, prerequisiteDepth);
    }

    public int dependentDepth(String code) {
        graph.course(code);
        return longest(code, Direction.DEPENDENTS, c -> true, dependentDepth);
    }

    /**
     * Longest prerequisite chain below {@code code} counting only courses outside {@code satisfied}.
     * Not memoized across calls since the result depends on the satisfied set.
     */
    public int remainingDepth(String code, Set<String> satisfied, Map<String, Integer> memo) {
        graph.course(code);
        return longest(code, Direction.PREREQUISITES, c -> !satisfied.contains(c), memo);
    }

    /** The chain realising {@link #chainDepth(String)}, starting with {@code code}; ties go to the smallest code. */
    public PrerequisiteChain criticalChain(String code) {
        int depth = chainDepth(code);
        List<String> chain = new ArrayList<>();
        chain.add(code);
        String current = code;
        while (!graph.prerequisitesOf(current).isEmpty()) {
            String best = null;
            int bestDepth = -1;
            for (String next : graph.prerequisitesOf(current)) {
                int d = chainDepth(next);
                if (d > bestDepth) {
                    best = next;
                    bestDepth = d;
                }
            }
            chain.add(best);
            current = best;
        }
        return new PrerequisiteChain(code, depth, List.copyOf(chain));
    }

    private SortedSet<String> closure(String code, Direction direction) {
        Map<String, SortedSet<String>> memo = direction == Direction.PREREQUISITES ? prerequisiteClosure : dependentClosure;
        postOrder(code, direction, memo::containsKey, done -> {
            SortedSet<String> result = new TreeSet<>();
            for (String next : neighbours(done, direction)) {
                result.add(next);
                result.addAll(memo.get(next));
            }
            memo.put(done, Collections.unmodifiableSortedSet(result));
        });
        return memo.get(code);
    }

    private int longest(String code, Direction direction, Predicate<String> counted, Map<String, Integer> memo) {
        postOrder(code, direction, memo::containsKey, done -> {
            int best = 0;
            for (String next : neighbours(done, direction)) {
                best = Math.max(best, memo.get(next) + (counted.test(next) ? 1 : 0));
            }
            memo.put(done, best);
        });
        return memo.get(code);
    }

    /**
     * Depth-first walk from {@code start} on an explicit stack. Unresolved courses are handed to
     * {@code resolve} after all their neighbours; meeting a course already on the current path
     * raises {@link CycleDetectedException}.
     */
    private void postOrder(String start, Direction direction, Predicate<String> resolved, Consumer<String> resolve) {
        if (resolved.test(start)) return;

        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        path.add(start);
        onPath.add(start);
        pending.push(neighbours(start, direction).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> open = pending.peek();
            if (open.hasNext()) {
                String next = open.next();
                if (resolved.test(next)) continue;
                if (onPath.contains(next)) throw cycleOnPath(path, next, direction);
                path.add(next);
                onPath.add(next);
                pending.push(neighbours(next, direction).iterator());
                continue;
            }
            pending.pop();
            String done = path.remove(path.size() - 1);
            onPath.remove(done);
            resolve.accept(done);
        }
    }

    private BoundedReach bounded(String code, int maxDepth, Direction direction) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Traversal depth must be at least 1, got " + maxDepth);
        }
        graph.course(code);

        Set<String> visited = new HashSet<>();
        visited.add(code);
        SortedSet<String> reached = new TreeSet<>();
        Map<Integer, List<String>> byDepth = new LinkedHashMap<>();
        Collection<String> frontier = List.of(code);
        int depth = 0;

        while (depth < maxDepth) {
            SortedSet<String> next = new TreeSet<>();
            for (String node : frontier) {
                for (String neighbour : neighbours(node, direction)) {
                    if (visited.add(neighbour)) next.add(neighbour);
                }
            }
            if (next.isEmpty()) {
                frontier = List.of();
                break;
            }
            depth++;
            byDepth.put(depth, List.copyOf(next));
            reached.addAll(next);
            frontier = next;
        }

        boolean partial = false;
        for (String node : frontier) {
            for (String neighbour : neighbours(node, direction)) {
                if (!visited.contains(neighbour)) {
                    partial = true;
                    break;
                }
            }
        }

        return new BoundedReach(code, maxDepth,
                Collections.unmodifiableSortedSet(reached),
                Collections.unmodifiableMap(byDepth),
                depth,
                partial);
    }

    private SortedSet<String> neighbours(String code, Direction direction) {
        return direction == Direction.PREREQUISITES ? graph.prerequisitesOf(code) : graph.dependentsOf(code);
    }

    private CycleDetectedException cycleOnPath(List<String> path, String repeated, Direction direction) {
        List<String> cycle = new ArrayList<>(path.subList(path.lastIndexOf(repeated), path.size()));
        if (direction == Direction.DEPENDENTS) {
            // dependents are walked against the requires edges
            Collections.reverse(cycle);
        }
        return new CycleDetectedException(CourseCycle.normalized(cycle));
    }
}
