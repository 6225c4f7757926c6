package com.dcruver.htn.domain.todo;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An action that has already been executed at planning time.
 * Only the planner creates these, by re-tagging a task node after its action succeeds.
 */
@Value
public final class PrimitiveTodo implements Todo {
    String name;
    List<Object> args;

    public PrimitiveTodo(String name, List<?> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public TodoKind getKind() {
        return TodoKind.PRIMITIVE;
    }
}
