package com.dcruver.htn.domain;

import com.dcruver.htn.domain.todo.Todo;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What a task, unigoal or multigoal method returns.
 * An empty subtask list means the todo is already accomplished; a failure means
 * this method does not apply and the next candidate should be tried.
 */
@Value
public class MethodOutcome {
    boolean success;
    List<Todo> subtasks;
    String reason;

    public static MethodOutcome subtasks(Todo... subtasks) {
        return subtasks(Arrays.asList(subtasks));
    }

    public static MethodOutcome subtasks(List<? extends Todo> subtasks) {
        return new MethodOutcome(true, Collections.unmodifiableList(new ArrayList<>(subtasks)), null);
    }

    public static MethodOutcome done() {
        return new MethodOutcome(true, List.of(), null);
    }

    public static MethodOutcome failure(String reason) {
        return new MethodOutcome(false, List.of(), reason);
    }
}
