package com.dcruver.htn.domain.state;

import lombok.Value;

/**
 * A single {@code (subject, predicate, value)} triple.
 */
@Value
public class Fact {
    String subject;
    String predicate;
    Object value;
}
