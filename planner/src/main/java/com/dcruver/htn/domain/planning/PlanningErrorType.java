package com.dcruver.htn.domain.planning;

/**
 * Why a plan could not be produced.
 */
public enum PlanningErrorType {
    /** A task, goal or multigoal ran out of methods and had no fallback. */
    NO_APPLICABLE_METHOD,
    /** A task had no methods and no action registered under its name. */
    ACTION_NOT_FOUND,
    /** An action reported failure, threw, or returned no state. */
    ACTION_FAILED,
    /** A node reached dispatch in a shape the planner cannot expand. */
    MALFORMED_TASK
}
