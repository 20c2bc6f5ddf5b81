package com.herzen.planner.schedule;

import com.herzen.planner.config.PlannerProperties;
import com.herzen.planner.domain.DomainModels.ProgramRequirement;
import com.herzen.planner.domain.DomainModels.SemesterOffering;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.error.InvalidRequestException;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.schedule.ScheduleModels.*;
import com.herzen.planner.service.CatalogService;
import com.herzen.planner.service.CatalogService.CatalogView;
import com.herzen.planner.service.StudentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.SortedSet;

@Service
public class PlanningService {
    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    static final int MIN_COURSES_PER_SEMESTER = 1;
    static final int MAX_COURSES_PER_SEMESTER = 8;
    static final int MIN_CREDITS_PER_SEMESTER = 6;
    static final int MAX_CREDITS_PER_SEMESTER = 24;

    private final CatalogService catalogService;
    private final StudentService studentService;
    private final PlannerProperties properties;

    public PlanningService(CatalogService catalogService, StudentService studentService, PlannerProperties properties) {
        this.catalogService = catalogService;
        this.studentService = studentService;
        this.properties = properties;
    }

    public StudentSchedule schedule(String studentId, PlanRequest request) {
        PlanRequest req = request == null ? PlanRequest.defaults() : request;
        StudentState student = studentService.require(studentId);
        CatalogView view = catalogService.current();
        ProgramRequirement program = view.program(programName(req.program(), student));
        ScheduleConstraints constraints = constraints(req);
        PriorityRule rule = req.priority() == null ? PriorityRule.UNLOCKS_FIRST : req.priority();

        log.debug("Scheduling {} for student {} with {}", program.name(), studentId, rule);
        SchedulePlan plan = optimizer(view).optimize(student, program.requiredCourses(),
                view.semestersFrom(req.startPosition()), constraints, rule);
        log.debug("Scheduled {} courses for student {}, {} left unscheduled, {} unreachable",
                plan.totalCourses(), studentId, plan.unscheduled().size(), plan.unreachable().size());

        return new StudentSchedule(student.studentId(), program.name(),
                student.completed().stream().sorted().toList(), rule, plan);
    }

    public GraduationPaths graduationPaths(String studentId, PlanRequest request, Integer k) {
        PlanRequest req = request == null ? PlanRequest.defaults() : request;
        int count = k == null ? properties.paths().defaultCount() : k;
        if (count < 1 || count > properties.paths().maxCount()) {
            throw new InvalidRequestException("k", "Path count must be within 1.." + properties.paths().maxCount());
        }
        StudentState student = studentService.require(studentId);
        CatalogView view = catalogService.current();
        ProgramRequirement program = view.program(programName(req.program(), student));
        List<SemesterOffering> semesters = view.semestersFrom(req.startPosition());

        ScheduleOptimizer optimizer = optimizer(view);
        log.debug("Exploring {} graduation paths for student {}", count, studentId);
        List<GraduationPath> paths = new GraduationPathExplorer(optimizer, view.graph())
                .explore(student, program.requiredCourses(), semesters, constraints(req), count);

        return new GraduationPaths(student.studentId(), program.name(),
                List.copyOf(optimizer.remaining(student, program.requiredCourses())), paths);
    }

    public DegreeSequence sequence(String studentId, String programName) {
        StudentState student = studentService.require(studentId);
        CatalogView view = catalogService.current();
        ProgramRequirement program = view.program(programName(programName, student));

        ScheduleOptimizer optimizer = optimizer(view);
        SortedSet<String> remaining = optimizer.remaining(student, program.requiredCourses());
        return new DegreeSequence(student.studentId(), program.name(), List.copyOf(remaining),
                optimizer.layeredSequence(remaining));
    }

    ScheduleConstraints constraints(PlanRequest request) {
        PlannerProperties.Schedule defaults = properties.schedule();
        int maxCourses = request.maxCoursesPerSemester() == null
                ? defaults.maxCoursesPerSemester() : request.maxCoursesPerSemester();
        int maxCredits = request.maxCreditsPerSemester() == null
                ? defaults.maxCreditsPerSemester() : request.maxCreditsPerSemester();
        int target = request.targetSemesters() == null
                ? defaults.targetSemesters() : request.targetSemesters();

        requireWithin("maxCoursesPerSemester", maxCourses, MIN_COURSES_PER_SEMESTER, MAX_COURSES_PER_SEMESTER);
        requireWithin("maxCreditsPerSemester", maxCredits, MIN_CREDITS_PER_SEMESTER, MAX_CREDITS_PER_SEMESTER);
        requireWithin("targetSemesters", target, 1, defaults.maxTargetSemesters());
        return new ScheduleConstraints(maxCourses, maxCredits, target);
    }

    private ScheduleOptimizer optimizer(CatalogView view) {
        return new ScheduleOptimizer(new ReachabilityIndex(view.graph()), properties.defaultCredits(),
                properties.schedule().enrolledSatisfiesPrerequisites());
    }

    private static String programName(String requested, StudentState student) {
        if (requested != null && !requested.isBlank()) return requested;
        if (student.program() != null && !student.program().isBlank()) return student.program();
        throw new InvalidRequestException("program", "No program given and student " + student.studentId() + " has none");
    }

    private static void requireWithin(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidRequestException(field, field + " must be within " + min + ".." + max + ", got " + value);
        }
    }

    public record PlanRequest(String program,
                              Integer maxCoursesPerSemester,
                              Integer maxCreditsPerSemester,
                              Integer targetSemesters,
                              Integer startPosition,
                              PriorityRule priority) {
        public static PlanRequest defaults() {
            return new PlanRequest(null, null, null, null, null, null);
        }
    }
}
