package com.dcruver.htn.domain.planning;

/**
 * How a non-failing plan call ended.
 */
public enum PlanOutcome {
    /** No open nodes remain. */
    COMPLETE,
    /** The expansion bound was reached first; the tree may still have open nodes. */
    BOUNDED
}
