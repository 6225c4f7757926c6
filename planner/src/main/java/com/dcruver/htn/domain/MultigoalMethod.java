package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.MultigoalTodo;

/**
 * Plans for a whole multigoal at once.
 */
@FunctionalInterface
public interface MultigoalMethod {
    MethodOutcome apply(FactState state, MultigoalTodo multigoal);
}
