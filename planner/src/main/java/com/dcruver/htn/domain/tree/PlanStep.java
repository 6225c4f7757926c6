package com.dcruver.htn.domain.tree;

import lombok.Value;

import java.util.List;

/**
 * One primitive action of an extracted plan.
 */
@Value
public class PlanStep {
    String name;
    List<Object> args;

    @Override
    public String toString() {
        return name + args;
    }
}
