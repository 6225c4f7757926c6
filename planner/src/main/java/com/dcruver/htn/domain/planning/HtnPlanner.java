package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.Todo;
import com.dcruver.htn.domain.tree.SolutionNode;
import com.dcruver.htn.domain.tree.SolutionTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * IPyHOP-style HTN planner.
 *
 * Expands the root once, then repeatedly expands the first open node in insertion
 * order until no open node remains or the expansion bound is hit. Task nodes without
 * an applicable method are executed as actions on the planning state as soon as they
 * are reached, so later methods see the effects of earlier actions.
 *
 * There is no backtracking: a fatal failure aborts the plan. Callers that want to try
 * again with a different method blacklist it on the node and plan again.
 *
 * Stateless; concurrent calls are safe when the domain's methods and actions are.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HtnPlanner {

    private final NodeExpander nodeExpander;

    public PlanResult plan(PlanningDomain domain, FactState initialState, List<? extends Todo> todos)
            throws PlanningException {
        return plan(domain, initialState, todos, PlannerOptions.defaults());
    }

    /**
     * Plan for the given todos.
     *
     * @return a {@link PlanOutcome#COMPLETE} result, or {@link PlanOutcome#BOUNDED} with the
     *         partial tree when {@code maxDepth} expansions were not enough
     * @throws PlanningException when a node cannot be expanded
     */
    public PlanResult plan(PlanningDomain domain, FactState initialState, List<? extends Todo> todos,
                           PlannerOptions options) throws PlanningException {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(todos, "todos");
        Objects.requireNonNull(options, "options");

        int maxDepth = options.getMaxDepth();
        log.info("HTN planning in domain {}: {} todos, max depth {}", domain.getName(), todos.size(), maxDepth);

        SolutionTree tree = SolutionTree.createInitial(todos, initialState);
        options.getBlacklistedActions().forEach(tree::blacklistAction);
        FactState state = initialState;

        if (maxDepth <= 0) {
            log.info("Max depth {} leaves no room for expansion - returning unexpanded tree", maxDepth);
            return result(PlanOutcome.BOUNDED, domain, tree, state, maxDepth, 0);
        }

        state = expand(domain, tree, tree.getRootId(), state, options);

        int iterations = 0;
        while (true) {
            Optional<SolutionNode> next = tree.findNextUnexpanded();
            if (next.isEmpty()) {
                break;
            }

            if (iterations >= maxDepth) {
                log.info("Reached max depth {} with {} nodes - returning partial plan", maxDepth, tree.size());
                return result(PlanOutcome.BOUNDED, domain, tree, state, maxDepth, iterations);
            }

            state = expand(domain, tree, next.get().getId(), state, options);
            iterations++;
        }

        PlanResult result = result(PlanOutcome.COMPLETE, domain, tree, state, maxDepth, iterations);
        log.info("HTN planning complete after {} iterations: {} actions, {} nodes",
            iterations, tree.planCost(), tree.size());
        return result;
    }

    private FactState expand(PlanningDomain domain, SolutionTree tree, int nodeId, FactState state,
                             PlannerOptions options) throws PlanningException {
        if (options.getVerbose() > 2) {
            log.debug("Expanding node {}", tree.getNode(nodeId).getLabel());
        }
        try {
            Expansion expansion = nodeExpander.expand(domain, tree, nodeId, state, options);
            if (options.getVerbose() > 1) {
                log.debug("Node {}: {}", tree.getNode(nodeId).getLabel(), expansion.getDescription());
            }
            return expansion.getState();
        } catch (PlanningException e) {
            log.warn("HTN planning failed at node {}: {}", tree.getNode(nodeId).getLabel(), e.toString());
            throw e;
        }
    }

    private static PlanResult result(PlanOutcome outcome, PlanningDomain domain, SolutionTree tree,
                                     FactState state, int maxDepth, int iterations) {
        PlanMetadata metadata = PlanMetadata.builder()
            .createdAt(Instant.now())
            .domain(domain)
            .finalState(state)
            .maxDepth(maxDepth)
            .iterations(iterations)
            .build();

        return PlanResult.builder()
            .outcome(outcome)
            .solutionTree(tree)
            .finalState(state)
            .metadata(metadata)
            .build();
    }
}
