package com.example.fileaudit;

/**
 * Failure categories surfaced by the archive, restore and retrieval operations.
 */
public enum ErrorKind {
    /** Resolved path lies outside the configured root. Rejected before any I/O. */
    PATH_ESCAPE,
    NOT_FOUND,
    NOT_READABLE,
    /** Integrity check failed after upload or after a cold-tier download. */
    FINGERPRINT_MISMATCH,
    NOT_ARCHIVED,
    INVALID_STATE,
    UNSUPPORTED_SOURCE,
    COLLABORATOR_UNAUTHORIZED,
    COLLABORATOR_FORBIDDEN,
    COLLABORATOR_NOT_FOUND,
    COLLABORATOR_RATE_LIMITED,
    COLLABORATOR_TIMEOUT,
    COLLABORATOR_FAILURE
}
