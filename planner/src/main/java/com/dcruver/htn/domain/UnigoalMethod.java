package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;

/**
 * Achieves a single goal {@code predicate(subject) == value} for the predicate it is registered under.
 */
@FunctionalInterface
public interface UnigoalMethod {
    MethodOutcome apply(FactState state, String subject, Object value);
}
