package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.MethodOutcome;
import com.dcruver.htn.domain.MultigoalMethod;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.GoalTodo;
import com.dcruver.htn.domain.todo.MultigoalTodo;

import java.util.List;

/**
 * Fallback for multigoals no domain method can handle: achieve each unsatisfied
 * goal on its own, in the order the multigoal lists them.
 */
public class DefaultMultigoalMethod implements MultigoalMethod {

    public static final String ID = "default_multigoal";

    @Override
    public MethodOutcome apply(FactState state, MultigoalTodo multigoal) {
        List<GoalTodo> unsatisfied = multigoal.getGoals().stream()
            .filter(goal -> !state.matches(goal.getPredicate(), goal.getSubject(), goal.getValue()))
            .toList();
        return MethodOutcome.subtasks(unsatisfied);
    }
}
