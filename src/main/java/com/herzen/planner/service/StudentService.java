package com.herzen.planner.service;

import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.error.InvalidRequestException;
import com.herzen.planner.error.NotFoundException;
import com.herzen.planner.repository.StudentJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Service
public class StudentService {
    private final StudentJdbcRepository repository;

    public StudentService(StudentJdbcRepository repository) {
        this.repository = repository;
    }

    public StudentState save(StudentState student) {
        if (student.studentId() == null || student.studentId().isBlank()) {
            throw new InvalidRequestException("studentId", "Student id must not be blank");
        }
        repository.save(student);
        return student;
    }

    public StudentState require(String studentId) {
        return repository.find(studentId).orElseThrow(() -> NotFoundException.student(studentId));
    }

    public Optional<StudentState> find(String studentId) {
        return repository.find(studentId);
    }

    public List<StudentState> findAll(Collection<String> studentIds) {
        return repository.findAll(studentIds);
    }
}
