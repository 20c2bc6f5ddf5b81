package com.herzen.planner.error;

import com.herzen.planner.graph.GraphModels.CourseCycle;

/**
 * Raised by operations that need an acyclic prerequisite graph when a cycle is reachable
 * from the courses they touch. Only the failing operation is aborted.
 */
public class CycleDetectedException extends PlannerException {
    private final CourseCycle cycle;

    public CycleDetectedException(CourseCycle cycle) {
        super("Prerequisite cycle detected: " + String.join(" -> ", cycle.path()));
        this.cycle = cycle;
    }

    public CourseCycle getCycle() {
        return cycle;
    }

    @Override
    public String code() {
        return "CYCLE_DETECTED";
    }
}
