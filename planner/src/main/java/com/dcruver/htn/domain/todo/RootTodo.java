package com.dcruver.htn.domain.todo;

import lombok.Value;

import java.util.List;

/**
 * Head of every solution tree, holding the caller's todo list.
 */
@Value
public final class RootTodo implements Todo {
    List<Todo> todos;

    public RootTodo(List<? extends Todo> todos) {
        this.todos = List.copyOf(todos);
    }

    @Override
    public TodoKind getKind() {
        return TodoKind.ROOT;
    }
}
