package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;

import java.util.List;

/**
 * A primitive action. Must not mutate the state it receives.
 */
@FunctionalInterface
public interface ActionFunction {
    ActionOutcome apply(FactState state, List<Object> args);
}
