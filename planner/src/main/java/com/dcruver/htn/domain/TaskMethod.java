package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;

import java.util.List;

/**
 * Decomposes a task into subtasks.
 */
@FunctionalInterface
public interface TaskMethod {
    MethodOutcome apply(FactState state, List<Object> args);
}
