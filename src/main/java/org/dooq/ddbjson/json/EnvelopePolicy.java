package org.dooq.ddbjson.json;

/**
 * What a top level {@code Item} key means when reading DynamoDB JSON.
 */
public enum EnvelopePolicy {

    /**
     * {@code {"Item": {...}}} is the envelope around the actual item
     */
    UNWRAP,

    /**
     * {@code Item} is an ordinary attribute name
     */
    AS_FIELD
}
