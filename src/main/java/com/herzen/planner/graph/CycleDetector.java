package com.herzen.planner.graph;

import com.herzen.planner.graph.GraphModels.CourseCycle;

import java.util.*;

/**
 * Finds prerequisite cycles with Tarjan's strongly connected components algorithm, O(V + E).
 *
 * <p>Every component with more than one course yields one representative cycle: the shortest
 * cycle through the component's smallest code. Every self-edge yields a one-course cycle.
 * Nodes and neighbours are visited in code order, so equal graphs give equal reports.</p>
 */
public class CycleDetector {
    private static final Comparator<CourseCycle> ORDER = Comparator
            .comparing(CourseCycle::first)
            .thenComparingInt(CourseCycle::length)
            .thenComparing(c -> String.join(",", c.courses()));

    private final GraphStore graph;
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowlink = new HashMap<>();
    private final Set<String> onStack = new HashSet<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Map<String, Set<String>> componentOf = new HashMap<>();
    private List<Set<String>> components;
    private int currentIndex;

    public CycleDetector(GraphStore graph) {
        this.graph = graph;
    }

    public List<CourseCycle> findCycles() {
        List<CourseCycle> cycles = new ArrayList<>();
        for (Set<String> scc : stronglyConnectedComponents()) {
            if (scc.size() > 1) {
                cycles.add(representativeCycle(scc));
            }
        }
        for (String code : graph.codes()) {
            if (graph.hasSelfEdge(code)) {
                cycles.add(new CourseCycle(List.of(code)));
            }
        }
        cycles.sort(ORDER);
        return cycles;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /** The representative cycle of the component containing {@code code}, if that course lies on one. */
    public Optional<CourseCycle> cycleThrough(String code) {
        graph.course(code);
        stronglyConnectedComponents();
        Set<String> scc = componentOf.get(code);
        if (scc != null && scc.size() > 1) {
            return Optional.of(representativeCycle(scc));
        }
        if (graph.hasSelfEdge(code)) {
            return Optional.of(new CourseCycle(List.of(code)));
        }
        return Optional.empty();
    }

    public List<Set<String>> stronglyConnectedComponents() {
        if (components != null) return components;

        components = new ArrayList<>();
        for (String node : graph.codes()) {
            if (!index.containsKey(node)) {
                strongConnect(node);
            }
        }
        return components;
    }

    // Explicit call stack; each frame keeps the iterator over its remaining prerequisites.
    private void strongConnect(String root) {
        Deque<String> calls = new ArrayDeque<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        enter(root, calls, pending);

        while (!calls.isEmpty()) {
            String v = calls.peek();
            Iterator<String> neighbours = pending.peek();
            if (neighbours.hasNext()) {
                String w = neighbours.next();
                if (!index.containsKey(w)) {
                    enter(w, calls, pending);
                } else if (onStack.contains(w)) {
                    lowlink.put(v, Math.min(lowlink.get(v), index.get(w)));
                }
                continue;
            }

            calls.pop();
            pending.pop();
            if (lowlink.get(v).equals(index.get(v))) {
                Set<String> scc = new TreeSet<>();
                String w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    scc.add(w);
                } while (!w.equals(v));
                components.add(scc);
                scc.forEach(code -> componentOf.put(code, scc));
            }
            if (!calls.isEmpty()) {
                String parent = calls.peek();
                lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(v)));
            }
        }
    }

    private void enter(String v, Deque<String> calls, Deque<Iterator<String>> pending) {
        index.put(v, currentIndex);
        lowlink.put(v, currentIndex);
        currentIndex++;
        stack.push(v);
        onStack.add(v);
        calls.push(v);
        pending.push(graph.prerequisitesOf(v).iterator());
    }

    // BFS inside the component from its smallest code back to itself.
    private CourseCycle representativeCycle(Set<String> scc) {
        String start = scc.iterator().next();
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        parent.put(start, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graph.prerequisitesOf(current)) {
                if (!scc.contains(next)) continue;
                if (next.equals(start) && !current.equals(start)) {
                    LinkedList<String> path = new LinkedList<>();
                    for (String step = current; step != null; step = parent.get(step)) {
                        path.addFirst(step);
                    }
                    return new CourseCycle(path);
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        throw new IllegalStateException("Component without a cycle through " + start);
    }
}
