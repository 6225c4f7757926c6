package com.dcruver.htn.config;

import com.dcruver.htn.domain.planning.PlannerOptions;
import com.dcruver.htn.domain.planning.UnresolvedGoalPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Planner defaults, bound from {@code htn.planner.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "htn.planner")
@Data
public class PlannerProperties {
    private int maxDepth = PlannerOptions.DEFAULT_MAX_DEPTH;
    private int verbose = 0;
    private UnresolvedGoalPolicy unresolvedGoalPolicy = UnresolvedGoalPolicy.FAIL;
    private String reportDir = ".htn/reports";

    public PlannerOptions toOptions() {
        return PlannerOptions.builder()
            .maxDepth(maxDepth)
            .verbose(verbose)
            .unresolvedGoalPolicy(unresolvedGoalPolicy)
            .build();
    }
}
