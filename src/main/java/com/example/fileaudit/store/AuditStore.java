package com.example.fileaudit.store;

import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.ObservedFile;
import com.example.fileaudit.model.StatusCounts;

import java.util.List;
import java.util.Optional;

/**
 * Single source of truth for file lifecycle state. Each component only touches the fields it owns:
 * scanners upsert metadata and reset to Active, the archiver records archive outcomes, and the
 * restore orchestrator moves Archived records to Restoring.
 */
public interface AuditStore {

    /**
     * Creates the table, indexes and trigger if they do not exist yet.
     */
    void initSchema();

    /**
     * Inserts or refreshes the record for {@code observed.path()}. A refreshed record is always
     * {@code Active} with no archive reference and no failure reason.
     */
    FileAuditRecord upsertObserved(ObservedFile observed);

    Optional<FileAuditRecord> findById(long id);

    Optional<FileAuditRecord> findByPath(String path);

    void markArchived(long id, String archiveRef);

    /**
     * Records a failed archive attempt. Applies to Active and ArchiveFailed records, and to an
     * Archived record only while it still points at {@code uploadedRef}, the object this attempt
     * uploaded. Records archived by another attempt or already Restoring are left alone.
     *
     * @param uploadedRef the reference written by this attempt, or null if it never got that far
     * @return true if the record was updated
     */
    boolean markArchiveFailed(long id, String reason, String uploadedRef);

    /**
     * Moves a record from Archived to Restoring.
     *
     * @return true if this call performed the transition, false if the record was not Archived
     */
    boolean markRestoring(long id);

    /**
     * Newest records first.
     */
    List<FileAuditRecord> recent(int limit);

    StatusCounts countByStatus();
}
