package com.dcruver.htn.domain.tree;

import lombok.Builder;
import lombok.Value;

/**
 * Size summary of a solution tree, used in reports and shell output.
 */
@Value
@Builder
public class TreeStats {
    int totalNodes;
    int expandedNodes;
    int primitiveActions;
    int maxDepth;
    int expansions;
}
