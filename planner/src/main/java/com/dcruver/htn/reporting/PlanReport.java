package com.dcruver.htn.reporting;

import com.dcruver.htn.domain.planning.PlanOutcome;
import com.dcruver.htn.domain.state.Fact;
import com.dcruver.htn.domain.tree.PlanStep;
import com.dcruver.htn.domain.tree.TreeStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Serializable summary of a plan.
 */
@Value
@Builder
public class PlanReport {
    String domain;
    PlanOutcome outcome;
    Instant createdAt;
    int maxDepth;
    int iterations;
    boolean treeComplete;
    List<Object> todos;
    List<PlanStep> actions;
    TreeStats stats;
    List<Fact> finalState;
}
