package com.herzen.planner.api;

import com.herzen.planner.error.CycleDetectedException;
import com.herzen.planner.error.InvalidRequestException;
import com.herzen.planner.error.MalformedGraphException;
import com.herzen.planner.error.NotFoundException;
import com.herzen.planner.error.PlannerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MalformedGraphException.class)
    public ResponseEntity<Map<String, Object>> handleMalformed(MalformedGraphException ex) {
        log.warn("Rejected malformed catalog: {} problem(s), first: {}", ex.getProblems().size(),
                ex.getProblems().isEmpty() ? "-" : ex.getProblems().get(0));
        Map<String, Object> body = body(ex);
        body.put("problems", ex.getProblems());
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        log.warn("Lookup failed: kind={} key={}", ex.getKind(), ex.getKey());
        Map<String, Object> body = body(ex);
        body.put("kind", ex.getKind().name());
        body.put("key", ex.getKey());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CycleDetectedException.class)
    public ResponseEntity<Map<String, Object>> handleCycle(CycleDetectedException ex) {
        log.warn("Operation aborted by prerequisite cycle: {}", ex.getCycle().path());
        Map<String, Object> body = body(ex);
        body.put("cycle", ex.getCycle().path());
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidRequestException ex) {
        log.warn("Invalid request: field={} message={}", ex.getField(), ex.getMessage());
        Map<String, Object> body = body(ex);
        body.put("field", ex.getField());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "INVALID_REQUEST");
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    private static Map<String, Object> body(PlannerException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.code());
        body.put("message", ex.getMessage());
        return body;
    }
}
