package com.dcruver.htn.domain.planning;

/**
 * What to do with a goal or multigoal node once every method for it has failed.
 */
public enum UnresolvedGoalPolicy {
    /** Abort planning with {@link PlanningErrorType#NO_APPLICABLE_METHOD}. */
    FAIL,
    /**
     * Mark the node primitive and keep planning. The node contributes no action to the
     * extracted plan, so the plan may silently leave the goal unachieved.
     */
    MARK_PRIMITIVE
}
