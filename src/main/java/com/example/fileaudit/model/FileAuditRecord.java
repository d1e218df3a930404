package com.example.fileaudit.model;

import java.time.Instant;
import java.util.Optional;

public record FileAuditRecord(
        long id,
        FileSource source,
        String path,
        String fingerprint,
        Instant lastModified,
        Instant lastAccessed,
        String owner,
        ArchiveStatus status,
        String archiveRef,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public Optional<String> archiveRefValue() {
        return Optional.ofNullable(archiveRef).filter(value -> !value.isBlank());
    }

    public Optional<String> failureReasonValue() {
        return Optional.ofNullable(failureReason);
    }
}
