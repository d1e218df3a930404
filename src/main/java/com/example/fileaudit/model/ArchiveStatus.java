package com.example.fileaudit.model;

import java.util.Arrays;

/**
 * Lifecycle state of an audited file.
 * <p>
 * {@link #ARCHIVED} and {@link #RESTORING} are the only states that carry an archive reference.
 * {@link #ARCHIVE_FAILED} is never terminal: a later archive attempt or a re-scan supersedes it.
 */
public enum ArchiveStatus {
    ACTIVE("Active"),
    ARCHIVED("Archived"),
    RESTORING("Restoring"),
    ARCHIVE_FAILED("ArchiveFailed");

    private final String label;

    ArchiveStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean hasArchiveRef() {
        return switch (this) {
            case ARCHIVED, RESTORING -> true;
            case ACTIVE, ARCHIVE_FAILED -> false;
        };
    }

    public static ArchiveStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(status -> status.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown archive status: " + label));
    }
}
