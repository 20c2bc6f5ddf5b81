package com.herzen.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "planner")
public record PlannerProperties(@DefaultValue("3") int defaultCredits,
                                @DefaultValue Readiness readiness,
                                @DefaultValue Bottleneck bottleneck,
                                @DefaultValue Schedule schedule,
                                @DefaultValue Paths paths,
                                @DefaultValue Recommendations recommendations) {

    public record Readiness(@DefaultValue("75") int almostReadyThreshold) {}

    public record Bottleneck(@DefaultValue("3") int minDependents,
                             @DefaultValue("2") int minPrerequisites,
                             @DefaultValue("3") int depth) {}

    public record Schedule(@DefaultValue("5") int maxCoursesPerSemester,
                           @DefaultValue("18") int maxCreditsPerSemester,
                           @DefaultValue("8") int targetSemesters,
                           @DefaultValue("12") int maxTargetSemesters,
                           @DefaultValue("false") boolean enrolledSatisfiesPrerequisites) {}

    public record Paths(@DefaultValue("3") int defaultCount,
                        @DefaultValue("10") int maxCount) {}

    public record Recommendations(@DefaultValue("15") int limit) {}
}
