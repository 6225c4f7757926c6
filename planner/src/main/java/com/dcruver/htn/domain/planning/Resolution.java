package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.todo.Todo;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of trying a list of candidate methods for one node.
 * {@link Kind#COMPLETED} and {@link Kind#NO_APPLICABLE_METHOD} both carry no subtasks
 * but mean opposite things.
 */
@Value
public class Resolution {

    public enum Kind {
        COMPLETED,
        DECOMPOSED,
        NO_APPLICABLE_METHOD
    }

    Kind kind;
    String methodId;
    List<Todo> subtasks;
    List<String> failures;

    static Resolution completed(String methodId, List<String> failures) {
        return new Resolution(Kind.COMPLETED, methodId, List.of(), List.copyOf(failures));
    }

    static Resolution decomposed(String methodId, List<Todo> subtasks, List<String> failures) {
        return new Resolution(Kind.DECOMPOSED, methodId, Collections.unmodifiableList(new ArrayList<>(subtasks)),
            List.copyOf(failures));
    }

    static Resolution noApplicableMethod(List<String> failures) {
        return new Resolution(Kind.NO_APPLICABLE_METHOD, null, List.of(), List.copyOf(failures));
    }

    public boolean isResolved() {
        return kind != Kind.NO_APPLICABLE_METHOD;
    }
}
