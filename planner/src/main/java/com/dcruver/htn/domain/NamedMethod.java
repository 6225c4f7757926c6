package com.dcruver.htn.domain;

import lombok.Value;

/**
 * A method together with the identifier used for logging and blacklisting.
 */
@Value
public class NamedMethod<M> {
    String id;
    M method;
}
