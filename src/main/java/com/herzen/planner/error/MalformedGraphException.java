package com.herzen.planner.error;

import java.util.List;

public class MalformedGraphException extends PlannerException {
    private final List<String> problems;

    public MalformedGraphException(List<String> problems) {
        super("Malformed prerequisite graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String code() {
        return "MALFORMED_GRAPH";
    }
}
