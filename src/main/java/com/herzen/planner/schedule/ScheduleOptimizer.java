package com.herzen.planner.schedule;

import com.herzen.planner.domain.DomainModels.SemesterOffering;
import com.herzen.planner.domain.DomainModels.StudentState;
import com.herzen.planner.graph.GraphStore;
import com.herzen.planner.graph.ReachabilityIndex;
import com.herzen.planner.schedule.ScheduleModels.*;

import java.util.*;

/**
 * Assigns a student's remaining required courses to the semesters of a bounded horizon.
 *
 * <p>Semesters are filled in timeline order. A course is eligible in a semester when it is
 * offered there and each direct prerequisite was completed or placed in an earlier semester.
 * Eligible courses are admitted in priority order while the course-count and credit caps
 * hold. Courses left over are reported as unscheduled, or as unreachable when no semester of
 * the horizon offers them; capacity shortfalls are never errors.</p>
 */
public class ScheduleOptimizer {
    private final GraphStore graph;
    private final ReachabilityIndex reachability;
    private final int defaultCredits;
    private final boolean enrolledSatisfiesPrerequisites;

    public ScheduleOptimizer(ReachabilityIndex reachability, int defaultCredits, boolean enrolledSatisfiesPrerequisites) {
        this.graph = reachability.graph();
        this.reachability = reachability;
        this.defaultCredits = defaultCredits;
        this.enrolledSatisfiesPrerequisites = enrolledSatisfiesPrerequisites;
    }

    public ScheduleOptimizer(ReachabilityIndex reachability, int defaultCredits) {
        this(reachability, defaultCredits, false);
    }

    /** Required minus completed minus currently enrolled, sorted. Unknown codes raise {@code NotFoundException}. */
    public SortedSet<String> remaining(StudentState student, Collection<String> requiredCourses) {
        SortedSet<String> remaining = new TreeSet<>();
        for (String code : requiredCourses) {
            graph.course(code);
            if (!student.completed().contains(code) && !student.enrolled().contains(code)) {
                remaining.add(code);
            }
        }
        return remaining;
    }

    public Set<String> satisfiedAtStart(StudentState student) {
        Set<String> satisfied = new HashSet<>(student.completed());
        if (enrolledSatisfiesPrerequisites) satisfied.addAll(student.enrolled());
        return satisfied;
    }

    public SchedulePlan optimize(StudentState student,
                                 Collection<String> requiredCourses,
                                 List<SemesterOffering> semesters,
                                 ScheduleConstraints constraints,
                                 PriorityRule rule) {
        SortedSet<String> remaining = remaining(student, requiredCourses);
        if (remaining.isEmpty()) return SchedulePlan.empty();

        Set<String> satisfied = satisfiedAtStart(student);
        Map<String, CourseMetrics> metrics = metrics(remaining, satisfied);
        Comparator<String> ranking = Comparator.comparing(metrics::get, rule.comparator());

        List<SemesterOffering> horizon = semesters.stream()
                .sorted(SemesterOffering.TIMELINE)
                .limit(constraints.targetSemesters())
                .toList();

        List<String> warnings = new ArrayList<>(blockedWarnings(remaining, satisfied));
        if (horizon.isEmpty()) {
            warnings.add(0, "No semesters available for scheduling");
            return new SchedulePlan(List.of(), List.copyOf(remaining), List.of(), List.copyOf(warnings), 0, 0);
        }

        Set<String> pending = new TreeSet<>(remaining);
        List<SemesterPlan> plans = new ArrayList<>();
        int totalCourses = 0;
        int totalCredits = 0;

        for (SemesterOffering semester : horizon) {
            if (pending.isEmpty()) break;

            List<String> eligible = pending.stream()
                    .filter(semester::offers)
                    .filter(code -> satisfied.containsAll(graph.prerequisitesOf(code)))
                    .sorted(ranking)
                    .toList();

            List<ScheduledCourse> admitted = new ArrayList<>();
            int credits = 0;
            for (String code : eligible) {
                if (admitted.size() >= constraints.maxCoursesPerSemester()) break;
                int courseCredits = metrics.get(code).credits();
                if ((long) credits + courseCredits > constraints.maxCreditsPerSemester()) continue;

                admitted.add(new ScheduledCourse(code, graph.course(code).name(), courseCredits,
                        List.copyOf(graph.prerequisitesOf(code))));
                credits += courseCredits;
            }

            // placements only count towards later semesters
            admitted.forEach(c -> {
                pending.remove(c.code());
                satisfied.add(c.code());
            });

            SemesterPlan plan = new SemesterPlan(semester.id(), semester.label(), semester.year(), semester.termIndex(),
                    semester.position(), List.copyOf(admitted), admitted.size(), credits);
            plans.add(plan);
            totalCourses += admitted.size();
            totalCredits += credits;
            if (admitted.isEmpty()) {
                warnings.add("Empty semester: " + (semester.label() == null ? semester.id() : semester.label()));
            }
        }

        List<String> unscheduled = new ArrayList<>();
        List<String> unreachable = new ArrayList<>();
        for (String code : pending) {
            boolean offered = horizon.stream().anyMatch(s -> s.offers(code));
            if (offered) {
                unscheduled.add(code);
            } else {
                unreachable.add(code);
            }
            if (offered && metrics.get(code).credits() > constraints.maxCreditsPerSemester()) {
                warnings.add(code + " exceeds the per-semester credit cap of " + constraints.maxCreditsPerSemester());
            }
        }

        return new SchedulePlan(List.copyOf(plans), List.copyOf(unscheduled), List.copyOf(unreachable),
                List.copyOf(warnings), totalCourses, totalCredits);
    }

    /**
     * Uncapped degree sequence: each layer holds the remaining courses whose remaining
     * prerequisites all sit in earlier layers. Prerequisites outside the remaining set are ignored.
     */
    public List<List<String>> layeredSequence(SortedSet<String> remaining) {
        remaining.forEach(reachability::transitivePrerequisitesOf);

        List<List<String>> layers = new ArrayList<>();
        Set<String> left = new TreeSet<>(remaining);
        while (!left.isEmpty()) {
            List<String> layer = left.stream()
                    .filter(code -> graph.prerequisitesOf(code).stream().noneMatch(left::contains))
                    .toList();
            if (layer.isEmpty()) {
                throw new IllegalStateException("No progress while layering " + left);
            }
            layers.add(layer);
            layer.forEach(left::remove);
        }
        return List.copyOf(layers);
    }

    /**
     * Ranking figures for the remaining set. Resolves every prerequisite closure first, so a cycle
     * below a remaining course aborts with {@code CycleDetectedException} before anything is assigned.
     */
    public Map<String, CourseMetrics> metrics(Set<String> remaining, Set<String> satisfied) {
        Map<String, Integer> depthMemo = new HashMap<>();
        Map<String, CourseMetrics> metrics = new HashMap<>();
        for (String code : remaining) {
            reachability.transitivePrerequisitesOf(code);
            int unlocks = remainingDependents(code, remaining);
            int depth = reachability.remainingDepth(code, satisfied, depthMemo);
            metrics.put(code, new CourseMetrics(code, unlocks, depth, graph.creditsOf(code, defaultCredits)));
        }
        return metrics;
    }

    /**
     * Remaining courses that depend on {@code code}, directly or not. Cycles above the plan are
     * only visited once and do not abort ranking.
     */
    private int remainingDependents(String code, Set<String> remaining) {
        Set<String> visited = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>(graph.dependentsOf(code));
        int count = 0;
        while (!frontier.isEmpty()) {
            String next = frontier.pop();
            if (next.equals(code) || !visited.add(next)) continue;
            if (remaining.contains(next)) count++;
            frontier.addAll(graph.dependentsOf(next));
        }
        return count;
    }

    private List<String> blockedWarnings(Set<String> remaining, Set<String> satisfied) {
        List<String> warnings = new ArrayList<>();
        for (String code : remaining) {
            List<String> outside = graph.prerequisitesOf(code).stream()
                    .filter(p -> !satisfied.contains(p) && !remaining.contains(p))
                    .toList();
            if (!outside.isEmpty()) {
                warnings.add(code + " is blocked by prerequisites outside the plan: " + String.join(", ", outside));
            }
        }
        return warnings;
    }
}
