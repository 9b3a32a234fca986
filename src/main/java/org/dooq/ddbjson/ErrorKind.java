package org.dooq.ddbjson;

/**
 * Failure categories of a single conversion.
 */
public enum ErrorKind {

    /**
     * A DynamoDB side value is not an object or does not have exactly one key
     */
    MALFORMED_TAG_OBJECT,

    /**
     * The single key of a tag object is outside the tag alphabet
     */
    UNKNOWN_TAG,

    /**
     * An N or NS payload is not a decimal number literal
     */
    INVALID_NUMBER_LITERAL,

    /**
     * A tag payload has the wrong JSON shape
     */
    TYPE_MISMATCH,

    UNSUPPORTED_NORMAL_VALUE_KIND
}
