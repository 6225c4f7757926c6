package com.dcruver.htn.domain.todo;

import java.util.Arrays;
import java.util.List;

/**
 * A unit of work handed to the planner: a task, a goal or a multigoal.
 * Root and primitive todos are produced by the planner itself.
 */
public sealed interface Todo permits RootTodo, TaskTodo, GoalTodo, MultigoalTodo, PrimitiveTodo {

    TodoKind getKind();

    static TaskTodo task(String name, Object... args) {
        return new TaskTodo(name, Arrays.asList(args));
    }

    static GoalTodo goal(String predicate, String subject, Object value) {
        return new GoalTodo(predicate, subject, value);
    }

    static MultigoalTodo multigoal(GoalTodo... goals) {
        return new MultigoalTodo(Arrays.asList(goals));
    }

    static MultigoalTodo multigoal(List<GoalTodo> goals) {
        return new MultigoalTodo(goals);
    }
}
