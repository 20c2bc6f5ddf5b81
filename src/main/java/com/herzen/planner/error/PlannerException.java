package com.herzen.planner.error;

public abstract class PlannerException extends RuntimeException {
    protected PlannerException(String message) {
        super(message);
    }

    /** Stable machine-readable error code rendered at the boundary. */
    public abstract String code();
}
