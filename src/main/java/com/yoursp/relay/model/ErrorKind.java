package com.yoursp.relay.model;

/**
 * Failure categories reported across service boundaries.
 */
public enum ErrorKind {
    /** Bad filename, bad ID format, missing field. Never retried. */
    VALIDATION,
    /** Blob or log entry absent. */
    NOT_FOUND,
    PAYLOAD_TOO_LARGE,
    /** Backend unreachable or rejected the call; details stay in the log. */
    STORAGE,
    INTERNAL
}
