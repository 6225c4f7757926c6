package com.dcruver.htn.domain.planning;

import lombok.Getter;

/**
 * Fatal planning failure. Aborts the whole plan; the partial tree is discarded.
 */
@Getter
public class PlanningException extends Exception {

    private final PlanningErrorType type;

    public PlanningException(PlanningErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public PlanningException(PlanningErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    @Override
    public String toString() {
        return type + ": " + getMessage();
    }
}
