package com.example.fileaudit.model;

import java.time.Instant;

public record ObservedFile(
        FileSource source,
        String path,
        String fingerprint,
        Instant lastModified,
        Instant lastAccessed,
        String owner
) {
    public static final String UNKNOWN_OWNER = "Unknown";

    public ObservedFile {
        if (owner == null || owner.isBlank()) {
            owner = UNKNOWN_OWNER;
        }
    }
}
