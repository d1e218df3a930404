package com.example.fileaudit.web;

import com.example.fileaudit.model.FileAuditRecord;

import java.time.Instant;

public record RecordView(
        long id,
        String source,
        String path,
        String status,
        String owner,
        String fingerprint,
        String lastModified,
        String lastAccessed,
        String archiveRef,
        String failureReason,
        String createdAt
) {
    static RecordView from(FileAuditRecord record) {
        return new RecordView(
                record.id(),
                record.source().label(),
                record.path(),
                record.status().label(),
                record.owner(),
                record.fingerprint(),
                iso(record.lastModified()),
                iso(record.lastAccessed()),
                record.archiveRef(),
                record.failureReason(),
                iso(record.createdAt())
        );
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
