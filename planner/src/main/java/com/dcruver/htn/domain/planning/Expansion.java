package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.state.FactState;
import lombok.Value;

/**
 * Result of expanding one node: the planning state to continue with and a short
 * description of what happened, for logs.
 */
@Value
public class Expansion {
    FactState state;
    String description;
}
