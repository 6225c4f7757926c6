package com.dcruver.htn.domain.todo;

/**
 * The closed set of todo variants a solution node can carry.
 * Dispatch switches over this enum without a default branch so that a new
 * variant fails compilation until every expander handles it.
 */
public enum TodoKind {
    ROOT,
    TASK,
    GOAL,
    MULTIGOAL,
    PRIMITIVE
}
