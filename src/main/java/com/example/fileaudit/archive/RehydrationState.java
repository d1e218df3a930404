package com.example.fileaudit.archive;

/**
 * Whether the bytes of a cold object can be read right now.
 */
public enum RehydrationState {
    /** Archival object with no restore requested. */
    NOT_REQUESTED,
    IN_PROGRESS,
    /** A rehydrated copy exists, or the object is not in an archival class. */
    AVAILABLE
}
