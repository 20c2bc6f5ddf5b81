package com.herzen.planner.error;

public class NotFoundException extends PlannerException {
    public enum Kind { COURSE, STUDENT, PROGRAM, SEMESTER }

    private final Kind kind;
    private final String key;

    public NotFoundException(Kind kind, String key) {
        super(kind.name().charAt(0) + kind.name().substring(1).toLowerCase() + " not found: " + key);
        this.kind = kind;
        this.key = key;
    }

    public static NotFoundException course(String code) {
        return new NotFoundException(Kind.COURSE, code);
    }

    public static NotFoundException student(String studentId) {
        return new NotFoundException(Kind.STUDENT, studentId);
    }

    public static NotFoundException program(String name) {
        return new NotFoundException(Kind.PROGRAM, name);
    }

    public static NotFoundException semester(String id) {
        return new NotFoundException(Kind.SEMESTER, id);
    }

    public Kind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
