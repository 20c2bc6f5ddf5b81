package com.herzen.planner.service;

import com.herzen.planner.domain.DomainModels.*;
import com.herzen.planner.error.MalformedGraphException;
import com.herzen.planner.error.NotFoundException;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.repository.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current catalog snapshot. Imports are validated before anything is written; the
 * cached view is replaced as a whole, never mutated, so readers always see one consistent
 * snapshot.
 */
@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogJdbcRepository repository;
    private final AtomicReference<CatalogView> current = new AtomicReference<>();

    public CatalogService(CatalogJdbcRepository repository) {
        this.repository = repository;
    }

    public CatalogSummary importCatalog(CatalogSnapshot snapshot) {
        GraphStore graph = GraphStore.build(snapshot.courses(), snapshot.edges());
        List<String> problems = referenceProblems(snapshot, graph);
        if (!problems.isEmpty()) {
            throw new MalformedGraphException(problems);
        }

        repository.replaceCatalog(snapshot);
        CatalogView view = new CatalogView(snapshot, graph, Instant.now());
        current.set(view);
        log.info("Imported catalog: {} courses, {} prerequisite edges, {} semesters, {} programs",
                graph.size(), graph.edgeCount(), snapshot.semesters().size(), snapshot.programs().size());
        return view.summary();
    }

    public CatalogView current() {
        CatalogView view = current.get();
        if (view != null) return view;

        CatalogSnapshot snapshot = repository.loadSnapshot();
        CatalogView loaded = new CatalogView(snapshot, GraphStore.build(snapshot.courses(), snapshot.edges()), Instant.now());
        log.debug("Loaded catalog snapshot with {} courses from storage", loaded.graph().size());
        return current.compareAndSet(null, loaded) ? loaded : current.get();
    }

    /** Drops the cached view; the next reader reloads from storage. */
    public void invalidate() {
        current.set(null);
    }

    public CatalogSummary summary() {
        return current().summary();
    }

    private List<String> referenceProblems(CatalogSnapshot snapshot, GraphStore graph) {
        List<String> problems = new ArrayList<>();
        Set<String> semesterIds = new HashSet<>();
        for (SemesterOffering semester : snapshot.semesters()) {
            if (!semesterIds.add(semester.id())) {
                problems.add("Duplicate semester " + semester.id());
            }
            semester.courseCodes().stream()
                    .filter(code -> !graph.contains(code))
                    .sorted()
                    .forEach(code -> problems.add("Semester " + semester.id() + " offers unknown course " + code));
        }
        Set<String> programNames = new HashSet<>();
        for (ProgramRequirement program : snapshot.programs()) {
            if (program.name() == null || program.name().isBlank()) {
                problems.add("Program with blank name");
                continue;
            }
            if (!programNames.add(program.name())) {
                problems.add("Duplicate program " + program.name());
            }
            program.requiredCourses().stream()
                    .filter(code -> !graph.contains(code))
                    .sorted()
                    .forEach(code -> problems.add("Program " + program.name() + " requires unknown course " + code));
        }
        return problems;
    }

    public record CatalogView(CatalogSnapshot snapshot, GraphStore graph, Instant loadedAt) {
        public ProgramRequirement program(String name) {
            return snapshot.programs().stream()
                    .filter(p -> p.name().equals(name))
                    .findFirst()
                    .orElseThrow(() -> NotFoundException.program(name));
        }

        public SemesterOffering semester(String id) {
            return snapshot.semesters().stream()
                    .filter(s -> s.id().equals(id))
                    .findFirst()
                    .orElseThrow(() -> NotFoundException.semester(id));
        }

        /** Timeline from the given position on; everything when {@code fromPosition} is null. */
        public List<SemesterOffering> semestersFrom(Integer fromPosition) {
            return snapshot.semesters().stream()
                    .filter(s -> fromPosition == null || s.position() >= fromPosition)
                    .toList();
        }

        public CatalogSummary summary() {
            return new CatalogSummary(graph.size(), graph.edgeCount(), snapshot.semesters().size(),
                    List.copyOf(snapshot.programNames()), loadedAt);
        }
    }

    public record CatalogSummary(int courses, int prerequisiteEdges, int semesters, List<String> programs, Instant loadedAt) {}
}
