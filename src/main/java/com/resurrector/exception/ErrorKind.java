package com.resurrector.exception;

/**
 * Stable classification of analysis failures. Every kind is fatal to the current request only.
 */
public enum ErrorKind {
    /** Malformed JSON/YAML/XML, or a request missing mode-required fields. */
    INVALID_INPUT,
    /** A body exceeded the configured byte ceiling. */
    PAYLOAD_TOO_LARGE,
    /** DNS or connection failure reaching the target. */
    UNREACHABLE,
    /** The outbound call did not finish within the configured duration. */
    TIMEOUT,
    /** Well-formed input that describes no analyzable resource. */
    NO_RESOURCES_FOUND,
    /** The target answered 401 or 403. */
    AUTH_FAILURE,
    /** The target answered with another non-success status or a SOAP fault. */
    UPSTREAM_ERROR,
    /** Anything unclassified. */
    INTERNAL
}
