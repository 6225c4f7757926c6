package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.MethodOutcome;
import com.dcruver.htn.domain.NamedMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tries candidate methods in declaration order and returns the first that applies.
 *
 * A method that reports failure, returns nothing or throws is skipped; its failure
 * never leaves this class. Only when every candidate has been skipped does the caller
 * get {@link Resolution.Kind#NO_APPLICABLE_METHOD}.
 */
@Component
@Slf4j
public class MethodResolver {

    /**
     * Calls one candidate with the node's state and arguments already bound.
     */
    @FunctionalInterface
    public interface MethodInvoker<M> {
        MethodOutcome invoke(M method);
    }

    public <M> Resolution resolve(
            String target,
            List<NamedMethod<M>> candidates,
            Set<String> blacklist,
            MethodInvoker<M> invoker,
            int verbose) {

        List<String> failures = new ArrayList<>();

        for (NamedMethod<M> candidate : candidates) {
            String methodId = candidate.getId();

            if (blacklist.contains(methodId)) {
                if (verbose > 2) {
                    log.debug("Skipping blacklisted method '{}' for {}", methodId, target);
                }
                continue;
            }

            if (verbose > 2) {
                log.debug("Trying method '{}' for {}", methodId, target);
            }

            MethodOutcome outcome;
            try {
                outcome = invoker.invoke(candidate.getMethod());
            } catch (RuntimeException e) {
                failures.add(methodId + ": threw " + e);
                log.debug("Method '{}' for {} threw: {}", methodId, target, e.toString());
                continue;
            }

            if (outcome == null) {
                failures.add(methodId + ": returned no outcome");
                log.debug("Method '{}' for {} returned no outcome", methodId, target);
                continue;
            }

            if (!outcome.isSuccess()) {
                failures.add(methodId + ": " + outcome.getReason());
                if (verbose > 2) {
                    log.debug("Method '{}' for {} not applicable: {}", methodId, target, outcome.getReason());
                }
                continue;
            }

            if (outcome.getSubtasks() == null) {
                failures.add(methodId + ": succeeded without a subtask list");
                log.debug("Method '{}' for {} succeeded without a subtask list", methodId, target);
                continue;
            }

            if (outcome.getSubtasks().isEmpty()) {
                return Resolution.completed(methodId, failures);
            }
            return Resolution.decomposed(methodId, outcome.getSubtasks(), failures);
        }

        if (verbose > 1) {
            log.debug("No applicable method for {} ({} candidates, {} failures)",
                target, candidates.size(), failures.size());
        }
        return Resolution.noApplicableMethod(failures);
    }
}
