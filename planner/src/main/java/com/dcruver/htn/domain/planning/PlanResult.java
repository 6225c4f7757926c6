package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.tree.PlanStep;
import com.dcruver.htn.domain.tree.SolutionTree;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A finished or bounded plan. Fatal failures are reported as {@link PlanningException} instead.
 */
@Value
@Builder
public class PlanResult {
    PlanOutcome outcome;
    SolutionTree solutionTree;
    FactState finalState;
    PlanMetadata metadata;

    public boolean isComplete() {
        return outcome == PlanOutcome.COMPLETE;
    }

    public boolean isBounded() {
        return outcome == PlanOutcome.BOUNDED;
    }

    public List<PlanStep> actions() {
        return solutionTree.extractPrimitiveActions();
    }
}
