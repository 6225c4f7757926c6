package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;
import lombok.Builder;
import lombok.Value;

/**
 * Result of running a primitive action at planning time.
 */
@Value
@Builder
public class ActionOutcome {
    boolean success;
    FactState resultingState;
    String message;

    public static ActionOutcome success(FactState resultingState) {
        return ActionOutcome.builder()
            .success(true)
            .resultingState(resultingState)
            .build();
    }

    public static ActionOutcome failure(String message) {
        return ActionOutcome.builder()
            .success(false)
            .message(message)
            .build();
    }
}
