package com.dcruver.htn.domain.todo;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named task with positional arguments. Decomposed by task methods,
 * or executed directly when the domain registers an action of the same name.
 */
@Value
public final class TaskTodo implements Todo {
    String name;
    List<Object> args;

    public TaskTodo(String name, List<?> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public TodoKind getKind() {
        return TodoKind.TASK;
    }
}
