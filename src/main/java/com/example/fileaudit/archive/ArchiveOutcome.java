package com.example.fileaudit.archive;

import com.example.fileaudit.ErrorKind;

import java.util.Optional;

public record ArchiveOutcome(
        long recordId,
        String path,
        Optional<ColdObjectRef> archiveRef,
        Optional<ErrorKind> failureKind,
        String message
) {
    public static ArchiveOutcome archived(long recordId, String path, ColdObjectRef ref) {
        return new ArchiveOutcome(recordId, path, Optional.of(ref), Optional.empty(), "Archived to " + ref);
    }

    public static ArchiveOutcome alreadyArchived(long recordId, String path, ColdObjectRef ref) {
        return new ArchiveOutcome(recordId, path, Optional.of(ref), Optional.empty(), "Already archived at " + ref);
    }

    public static ArchiveOutcome failed(long recordId, String path, ErrorKind kind, String message) {
        return new ArchiveOutcome(recordId, path, Optional.empty(), Optional.of(kind), message);
    }

    public boolean isArchived() {
        return archiveRef.isPresent();
    }
}
