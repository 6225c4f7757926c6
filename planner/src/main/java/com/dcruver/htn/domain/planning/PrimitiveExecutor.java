package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.ActionFunction;
import com.dcruver.htn.domain.ActionOutcome;
import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.tree.SolutionTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs a task's action against the planning-time state.
 *
 * There is exactly one action per name, so nothing is retried: any failure here is fatal
 * to the plan. This is the only place a new planning state is produced.
 */
@Component
@Slf4j
public class PrimitiveExecutor {

    /**
     * Execute the action and mark the node as an executed primitive.
     *
     * @return the state after the action
     * @throws PlanningException if the action is missing, blacklisted or fails
     */
    public FactState execute(
            PlanningDomain domain,
            SolutionTree tree,
            int nodeId,
            String actionName,
            List<Object> args,
            FactState state,
            int verbose) throws PlanningException {

        if (tree.isActionBlacklisted(actionName)) {
            log.warn("Action '{}' is blacklisted for this plan", actionName);
            throw new PlanningException(PlanningErrorType.ACTION_FAILED,
                "Action " + actionName + " is blacklisted");
        }

        ActionFunction action = domain.action(actionName).orElse(null);
        if (action == null) {
            log.warn("Action '{}' not found in domain {}", actionName, domain.getName());
            throw new PlanningException(PlanningErrorType.ACTION_NOT_FOUND,
                "Action " + actionName + " not found in domain " + domain.getName());
        }

        if (verbose > 2) {
            log.debug("Executing primitive action {}{}", actionName, args);
        }

        ActionOutcome outcome;
        try {
            outcome = action.apply(state, args);
        } catch (RuntimeException e) {
            log.error("Action '{}' raised exception", actionName, e);
            throw new PlanningException(PlanningErrorType.ACTION_FAILED,
                "Action " + actionName + " raised exception: " + e, e);
        }

        if (outcome == null) {
            throw new PlanningException(PlanningErrorType.ACTION_FAILED,
                "Action " + actionName + " returned unexpected format");
        }

        if (!outcome.isSuccess()) {
            if (verbose > 1) {
                log.debug("Action '{}' failed: {}", actionName, outcome.getMessage());
            }
            throw new PlanningException(PlanningErrorType.ACTION_FAILED,
                "Action " + actionName + " failed: " + outcome.getMessage());
        }

        if (outcome.getResultingState() == null) {
            throw new PlanningException(PlanningErrorType.ACTION_FAILED,
                "Action " + actionName + " succeeded without a resulting state");
        }

        tree.markExecuted(nodeId, actionName, args);
        if (verbose > 2) {
            log.debug("Action '{}' succeeded", actionName);
        }
        return outcome.getResultingState();
    }
}
