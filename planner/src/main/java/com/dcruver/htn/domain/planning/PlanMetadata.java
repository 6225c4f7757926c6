package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.state.FactState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PlanMetadata {
    Instant createdAt;
    PlanningDomain domain;
    FactState finalState;
    int maxDepth;
    int iterations;

    public String getDomainName() {
        return domain.getName();
    }
}
