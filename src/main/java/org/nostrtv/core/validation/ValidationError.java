package org.nostrtv.core.validation;

/**
 * Why an inbound event was rejected.
 */
public enum ValidationError {
    MISSING_REQUIRED_FIELD,
    INVALID_IDENTIFIER,
    INVALID_SIGNATURE,
    FROM_FUTURE,
    MISSING_REQUIRED_TAG,
    INVALID_TAG_FORMAT,
    INVALID_CONTENT
}
