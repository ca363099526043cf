package com.profileparser.model;

import lombok.Value;

/**
 * Link from one span to another span of the same trace
 */
@Value
public class SpanReference {
    public static final String CHILD_OF = "child_of";

    String type;
    String spanId;

    public static SpanReference childOf(String spanId) {
        return new SpanReference(CHILD_OF, spanId);
    }
}
