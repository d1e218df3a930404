package com.example.fileaudit.archive;

import java.nio.file.Path;

/**
 * Cold storage tier. Every call is blocking, carries a timeout and reports failures as
 * {@link com.example.fileaudit.FileAuditException} with a collaborator kind.
 */
public interface ColdStorage extends AutoCloseable {

    /**
     * Uploads {@code file} under {@code key} with the integrity metadata attached.
     */
    ColdObjectRef upload(String key, Path file, ArchiveMetadata metadata);

    /**
     * Re-reads the metadata recorded on the stored object.
     */
    ArchiveMetadata readMetadata(ColdObjectRef ref);

    /**
     * Asks the provider to rehydrate the object for {@code days} days. A restore that is already
     * running is reported as {@link RestoreRequestResult#ALREADY_IN_PROGRESS}, not as an error.
     */
    RestoreRequestResult requestRestore(ColdObjectRef ref, int days, String tier);

    RehydrationState rehydrationState(ColdObjectRef ref);

    /**
     * Copies the object's bytes to {@code target}, replacing it.
     */
    void download(ColdObjectRef ref, Path target);

    @Override
    default void close() {
        // no-op
    }
}
