package com.herzen.planner.repository;

import com.herzen.planner.domain.DomainModels.StudentState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Repository
public class StudentJdbcRepository {
    static final String COMPLETED = "COMPLETED";
    static final String ENROLLED = "ENROLLED";

    private final JdbcTemplate jdbcTemplate;

    public StudentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void save(StudentState student) {
        jdbcTemplate.update("DELETE FROM student_courses WHERE student_id = ?", student.studentId());
        jdbcTemplate.update("DELETE FROM students WHERE student_id = ?", student.studentId());

        jdbcTemplate.update("INSERT INTO students(student_id, name, program) VALUES (?,?,?)",
                student.studentId(), student.name(), student.program());
        student.completed().forEach(code -> jdbcTemplate.update(
                "INSERT INTO student_courses(student_id, course_code, status) VALUES (?,?,?)",
                student.studentId(), code, COMPLETED));
        student.enrolled().forEach(code -> jdbcTemplate.update(
                "INSERT INTO student_courses(student_id, course_code, status) VALUES (?,?,?)",
                student.studentId(), code, ENROLLED));
    }

    public Optional<StudentState> find(String studentId) {
        List<StudentRow> rows = jdbcTemplate.query(
                "SELECT student_id, name, program FROM students WHERE student_id = ?",
                (rs, rowNum) -> new StudentRow(rs.getString(1), rs.getString(2), rs.getString(3)),
                studentId);
        if (rows.isEmpty()) return Optional.empty();

        StudentRow row = rows.get(0);
        Set<String> completed = new TreeSet<>();
        Set<String> enrolled = new TreeSet<>();
        jdbcTemplate.query("SELECT course_code, status FROM student_courses WHERE student_id = ?", rs -> {
            if (COMPLETED.equals(rs.getString(2))) {
                completed.add(rs.getString(1));
            } else {
                enrolled.add(rs.getString(1));
            }
        }, studentId);

        return Optional.of(new StudentState(row.studentId(), row.name(), row.program(), completed, enrolled));
    }

    /** Students in the requested order; unknown ids are skipped. */
    public List<StudentState> findAll(Collection<String> studentIds) {
        return studentIds.stream()
                .distinct()
                .map(this::find)
                .flatMap(Optional::stream)
                .toList();
    }

    private record StudentRow(String studentId, String name, String program) {}
}
