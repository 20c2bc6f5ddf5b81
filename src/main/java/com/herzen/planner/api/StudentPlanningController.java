package com.herzen.planner.api;

import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.readiness.ReadinessModels;
import com.herzen.planner.readiness.ReadinessService;
import com.herzen.planner.schedule.PlanningService;
import com.herzen.planner.schedule.ScheduleModels;
import com.herzen.planner.service.StudentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@RestController
@RequestMapping("/api/students/{studentId}")
public class StudentPlanningController {
    private final StudentService studentService;
    private final ReadinessService readinessService;
    private final PlanningService planningService;

    public StudentPlanningController(StudentService studentService,
                                     ReadinessService readinessService,
                                     PlanningService planningService) {
        this.studentService = studentService;
        this.readinessService = readinessService;
        this.planningService = planningService;
    }

    @PutMapping
    public ResponseEntity<StudentState> save(@PathVariable String studentId, @RequestBody StudentRequest request) {
        return ResponseEntity.ok(studentService.save(new StudentState(studentId, request.name(), request.program(),
                request.completed(), request.enrolled())));
    }

    @GetMapping("/readiness")
    public ResponseEntity<ReadinessModels.ReadinessReport> readiness(@PathVariable String studentId,
                                                                     @RequestParam String course) {
        return ResponseEntity.ok(readinessService.readiness(studentId, course));
    }

    @GetMapping("/eligibility")
    public ResponseEntity<ReadinessModels.EligibilityReport> eligibility(@PathVariable String studentId,
                                                                         @RequestParam String course) {
        return ResponseEntity.ok(readinessService.eligibility(studentId, course));
    }

    @GetMapping("/recommendations")
    public ResponseEntity<ReadinessModels.RecommendationList> recommendations(@PathVariable String studentId,
                                                                              @RequestParam(required = false) String semester,
                                                                              @RequestParam(required = false) Integer minReadiness,
                                                                              @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(readinessService.recommendations(studentId, semester, minReadiness, limit));
    }

    @GetMapping("/readiness-buckets")
    public ResponseEntity<ReadinessModels.ReadinessBuckets> buckets(@PathVariable String studentId,
                                                                    @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(readinessService.buckets(studentId, limit));
    }

    @GetMapping("/summary")
    public ResponseEntity<ReadinessModels.StudentSummary> summary(@PathVariable String studentId,
                                                                  @RequestParam(required = false) String semester) {
        return ResponseEntity.ok(readinessService.summary(studentId, semester));
    }

    @PostMapping("/schedule")
    public ResponseEntity<ScheduleModels.StudentSchedule> schedule(@PathVariable String studentId,
                                                                   @RequestBody(required = false) PlanningService.PlanRequest request) {
        return ResponseEntity.ok(planningService.schedule(studentId, request));
    }

    @PostMapping("/graduation-paths")
    public ResponseEntity<ScheduleModels.GraduationPaths> graduationPaths(@PathVariable String studentId,
                                                                          @RequestParam(required = false) Integer k,
                                                                          @RequestBody(required = false) PlanningService.PlanRequest request) {
        return ResponseEntity.ok(planningService.graduationPaths(studentId, request, k));
    }

    @GetMapping("/sequence")
    public ResponseEntity<ScheduleModels.DegreeSequence> sequence(@PathVariable String studentId,
                                                                  @RequestParam(required = false) String program) {
        return ResponseEntity.ok(planningService.sequence(studentId, program));
    }

    public record StudentRequest(String name, String program, Set<String> completed, Set<String> enrolled) {}
}
