package com.dcruver.htn.domain.planning;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Per-call planner settings.
 */
@Value
@Builder(toBuilder = true)
public class PlannerOptions {

    public static final int DEFAULT_MAX_DEPTH = 100;

    /** Maximum number of node expansions after the root before planning stops as bounded. */
    @Builder.Default
    int maxDepth = DEFAULT_MAX_DEPTH;

    /** Diagnostic detail, 0-3. Never changes the outcome. */
    @Builder.Default
    int verbose = 0;

    @Builder.Default
    UnresolvedGoalPolicy unresolvedGoalPolicy = UnresolvedGoalPolicy.FAIL;

    /** Action names that may not be executed during this plan. */
    @Singular
    Set<String> blacklistedActions;

    public static PlannerOptions defaults() {
        return PlannerOptions.builder().build();
    }
}
