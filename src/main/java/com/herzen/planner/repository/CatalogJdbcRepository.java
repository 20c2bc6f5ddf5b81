package com.herzen.planner.repository;

import com.herzen.planner.domain.DomainModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void replaceCatalog(CatalogSnapshot snapshot) {
        jdbcTemplate.update("DELETE FROM course_prerequisites");
        jdbcTemplate.update("DELETE FROM semester_offerings");
        jdbcTemplate.update("DELETE FROM semesters");
        jdbcTemplate.update("DELETE FROM program_courses");
        jdbcTemplate.update("DELETE FROM programs");
        jdbcTemplate.update("DELETE FROM courses");

        snapshot.courses().forEach(c -> jdbcTemplate.update(
                "INSERT INTO courses(code, name, credits, department) VALUES (?,?,?,?)",
                c.code(), c.name(), c.credits(), c.department()));

        snapshot.edges().stream().distinct().forEach(e -> jdbcTemplate.update(
                "INSERT INTO course_prerequisites(course_code, prerequisite_code) VALUES (?,?)",
                e.courseCode(), e.prerequisiteCode()));

        snapshot.semesters().forEach(s -> {
            jdbcTemplate.update(
                    "INSERT INTO semesters(offering_year, term_index, timeline_position, label) VALUES (?,?,?,?)",
                    s.year(), s.termIndex(), s.position(), s.label());
            s.courseCodes().forEach(code -> jdbcTemplate.update(
                    "INSERT INTO semester_offerings(offering_year, term_index, course_code) VALUES (?,?,?)",
                    s.year(), s.termIndex(), code));
        });

        snapshot.programs().forEach(p -> {
            jdbcTemplate.update("INSERT INTO programs(name) VALUES (?)", p.name());
            p.requiredCourses().forEach(code -> jdbcTemplate.update(
                    "INSERT INTO program_courses(program_name, course_code) VALUES (?,?)",
                    p.name(), code));
        });
    }

    public CatalogSnapshot loadSnapshot() {
        List<Course> courses = jdbcTemplate.query(
                "SELECT code, name, credits, department FROM courses ORDER BY code",
                (rs, rowNum) -> new Course(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3), rs.getString(4)));

        List<PrerequisiteEdge> edges = jdbcTemplate.query(
                "SELECT course_code, prerequisite_code FROM course_prerequisites ORDER BY course_code, prerequisite_code",
                (rs, rowNum) -> new PrerequisiteEdge(rs.getString(1), rs.getString(2)));

        Map<String, Set<String>> offered = new HashMap<>();
        jdbcTemplate.query("SELECT offering_year, term_index, course_code FROM semester_offerings", rs -> {
            offered.computeIfAbsent(rs.getInt(1) + "-" + rs.getInt(2), k -> new TreeSet<>()).add(rs.getString(3));
        });
        List<SemesterOffering> semesters = jdbcTemplate.query(
                "SELECT offering_year, term_index, timeline_position, label FROM semesters",
                (rs, rowNum) -> new SemesterOffering(rs.getInt(1), rs.getInt(2), rs.getInt(3), rs.getString(4),
                        offered.getOrDefault(rs.getInt(1) + "-" + rs.getInt(2), Set.of())));

        Map<String, Set<String>> required = new TreeMap<>();
        jdbcTemplate.query("SELECT name FROM programs", rs -> {
            required.put(rs.getString(1), new TreeSet<>());
        });
        jdbcTemplate.query("SELECT program_name, course_code FROM program_courses", rs -> {
            required.computeIfAbsent(rs.getString(1), k -> new TreeSet<>()).add(rs.getString(2));
        });
        List<ProgramRequirement> programs = required.entrySet().stream()
                .map(e -> new ProgramRequirement(e.getKey(), e.getValue()))
                .toList();

        return new CatalogSnapshot(courses, edges, semesters, programs);
    }
}
