package com.herzen.planner.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public class DomainModels {
    public record Course(String code, String name, Integer credits, String department) {
        public Course {
            if (credits != null && credits < 0) {
                throw new IllegalArgumentException("Negative credit weight for course " + code);
            }
        }
    }

    /** {@code courseCode} requires {@code prerequisiteCode}. */
    public record PrerequisiteEdge(String courseCode, String prerequisiteCode) {}

    public record SemesterOffering(int year, int termIndex, int position, String label, Set<String> courseCodes) {
        public static final Comparator<SemesterOffering> TIMELINE = Comparator
                .comparingInt(SemesterOffering::position)
                .thenComparingInt(SemesterOffering::year)
                .thenComparingInt(SemesterOffering::termIndex);

        public SemesterOffering {
            courseCodes = courseCodes == null ? Set.of() : Set.copyOf(courseCodes);
        }

        public String id() {
            return year + "-" + termIndex;
        }

        public boolean offers(String courseCode) {
            return courseCodes.contains(courseCode);
        }
    }

    public record StudentState(String studentId, String name, String program, Set<String> completed, Set<String> enrolled) {
        public StudentState {
            completed = completed == null ? Set.of() : Set.copyOf(completed);
            enrolled = enrolled == null ? Set.of() : Set.copyOf(enrolled);
        }

        public static StudentState anonymous(Set<String> completed) {
            return new StudentState("anonymous", null, null, completed, Set.of());
        }

        public boolean hasCompleted(String courseCode) {
            return completed.contains(courseCode);
        }
    }

    public record ProgramRequirement(String name, Set<String> requiredCourses) {
        public ProgramRequirement {
            requiredCourses = requiredCourses == null ? Set.of() : Set.copyOf(requiredCourses);
        }
    }

    public record CatalogSnapshot(List<Course> courses,
                                  List<PrerequisiteEdge> edges,
                                  List<SemesterOffering> semesters,
                                  List<ProgramRequirement> programs) {
        public CatalogSnapshot {
            courses = courses == null ? List.of() : List.copyOf(courses);
            edges = edges == null ? List.of() : List.copyOf(edges);
            semesters = semesters == null ? List.of() : semesters.stream().sorted(SemesterOffering.TIMELINE).toList();
            programs = programs == null ? List.of() : List.copyOf(programs);
        }

        public static CatalogSnapshot empty() {
            return new CatalogSnapshot(List.of(), List.of(), List.of(), List.of());
        }

        public Set<String> programNames() {
            Set<String> names = new TreeSet<>();
            programs.forEach(p -> names.add(p.name()));
            return names;
        }
    }
}
