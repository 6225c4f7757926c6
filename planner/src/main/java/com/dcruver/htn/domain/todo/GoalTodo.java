package com.dcruver.htn.domain.todo;

import lombok.Value;

import java.util.Objects;

/**
 * Desired fact: {@code predicate(subject) == value}.
 */
@Value
public final class GoalTodo implements Todo {
    String predicate;
    String subject;
    Object value;

    public GoalTodo(String predicate, String subject, Object value) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.value = value;
    }

    @Override
    public TodoKind getKind() {
        return TodoKind.GOAL;
    }
}
