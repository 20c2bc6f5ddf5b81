package com.herzen.planner.error;

public class InvalidRequestException extends PlannerException {
    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String code() {
        return "INVALID_REQUEST";
    }
}
