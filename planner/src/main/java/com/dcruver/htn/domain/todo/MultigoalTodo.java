package com.dcruver.htn.domain.todo;

import lombok.Value;

import java.util.List;

/**
 * A set of goals to be achieved together. Multigoal methods receive the
 * whole set so they can reason about the goals jointly.
 */
@Value
public final class MultigoalTodo implements Todo {
    List<GoalTodo> goals;

    public MultigoalTodo(List<GoalTodo> goals) {
        this.goals = goals == null ? List.of() : List.copyOf(goals);
    }

    @Override
    public TodoKind getKind() {
        return TodoKind.MULTIGOAL;
    }
}
