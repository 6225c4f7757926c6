package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;

import java.util.List;

/**
 * Shorthand action that returns the next state directly.
 */
@FunctionalInterface
public interface StateTransition {
    FactState apply(FactState state, List<Object> args);
}
