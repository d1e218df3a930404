package com.example.fileaudit.archive;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.store.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

// Status is written before the local delete; the delete only runs while the record still points at the upload.
public final class Archiver {
    private static final Logger LOGGER = LoggerFactory.getLogger(Archiver.class);
    static final String ARCHIVED_BY = "file-audit";

    private final AuditStore store;
    private final ColdStorage coldStorage;
    private final BoundaryPathResolver resolver;
    private final FingerprintEngine fingerprints;
    private final Optional<String> keyPrefix;
    private final boolean strictVerification;
    private final Clock clock;

    public Archiver(AuditStore store,
                    ColdStorage coldStorage,
                    BoundaryPathResolver resolver,
                    FingerprintEngine fingerprints,
                    AuditConfig.Archive settings,
                    Clock clock) {
        this.store = store;
        this.coldStorage = coldStorage;
        this.resolver = resolver;
        this.fingerprints = fingerprints;
        this.keyPrefix = settings.prefix().map(prefix -> prefix.replaceAll("/+$", "")).filter(p -> !p.isEmpty());
        this.strictVerification = settings.strictVerification();
        this.clock = clock;
    }

    public ArchiveOutcome archive(FileAuditRecord record) {
        try {
            return doArchive(record);
        } catch (FileAuditException ex) {
            return fail(record, ex.kind(), ex.getMessage(), ex, null);
        } catch (RuntimeException ex) {
            return fail(record, ErrorKind.COLLABORATOR_FAILURE, ex.getMessage(), ex, null);
        }
    }

    private ArchiveOutcome doArchive(FileAuditRecord record) {
        if (record.source() != FileSource.FILE_SERVER) {
            throw new FileAuditException(ErrorKind.UNSUPPORTED_SOURCE,
                    "Only file-server files can be archived: " + record.path());
        }
        Optional<FileAuditRecord> current = store.findById(record.id());
        if (current.isPresent() && current.get().status().hasArchiveRef()) {
            ColdObjectRef existing = ColdObjectRef.parse(current.get().archiveRef());
            LOGGER.debug("Skipping {}: already {} at {}", record.path(), current.get().status().label(), existing);
            return ArchiveOutcome.alreadyArchived(record.id(), record.path(), existing);
        }
        Path local = resolver.resolve(record.path());
        if (!Files.isRegularFile(local, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAuditException(ErrorKind.NOT_FOUND, "File not found: " + local);
        }
        if (!Files.isReadable(local)) {
            throw new FileAuditException(ErrorKind.NOT_READABLE, "File is not readable: " + local);
        }

        String fingerprint;
        try {
            fingerprint = fingerprints.fingerprint(local);
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.NOT_READABLE, "Failed to read " + local + ": " + ex.getMessage(), ex);
        }

        ArchiveMetadata metadata = new ArchiveMetadata(record.path(), fingerprint, ARCHIVED_BY, clock.instant());
        ColdObjectRef ref = coldStorage.upload(keyFor(local), local, metadata);
        verify(ref, fingerprint);

        store.markArchived(record.id(), ref.uri());
        try {
            deleteLocalCopy(record, local, ref);
        } catch (FileAuditException ex) {
            return fail(record, ex.kind(), ex.getMessage(), ex, ref.uri());
        }
        LOGGER.info("Archived and removed {} -> {}", local, ref);
        return ArchiveOutcome.archived(record.id(), record.path(), ref);
    }

    private void verify(ColdObjectRef ref, String expected) {
        String stored;
        try {
            stored = coldStorage.readMetadata(ref).fingerprint();
        } catch (FileAuditException ex) {
            if (strictVerification) {
                throw ex;
            }
            LOGGER.warn("Could not verify {}: {}", ref, ex.getMessage());
            return;
        }
        if (expected.equals(stored)) {
            LOGGER.debug("Integrity verified for {}", ref);
            return;
        }
        if (strictVerification) {
            throw new FileAuditException(ErrorKind.FINGERPRINT_MISMATCH,
                    "Fingerprint mismatch after upload of " + ref + ": expected " + expected + ", stored " + stored);
        }
        LOGGER.warn("Fingerprint mismatch between local file and {} (expected {}, stored {})", ref, expected, stored);
    }

    private void deleteLocalCopy(FileAuditRecord record, Path local, ColdObjectRef ref) {
        boolean stillArchived = store.findById(record.id())
                .filter(current -> current.status() == ArchiveStatus.ARCHIVED)
                .flatMap(FileAuditRecord::archiveRefValue)
                .filter(ref.uri()::equals)
                .isPresent();
        if (!stillArchived) {
            throw new FileAuditException(ErrorKind.INVALID_STATE,
                    "Record " + record.id() + " changed while archiving; local copy kept at " + local);
        }
        try {
            Files.deleteIfExists(local);
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.NOT_READABLE,
                    "Uploaded to " + ref + " but failed to delete local copy " + local + ": " + ex.getMessage(), ex);
        }
    }

    private ArchiveOutcome fail(FileAuditRecord record, ErrorKind kind, String message, Exception cause,
                                String uploadedRef) {
        LOGGER.error("Failed to archive {}: {}", record.path(), message, cause);
        try {
            if (!store.markArchiveFailed(record.id(), kind + ": " + message, uploadedRef)) {
                LOGGER.warn("Kept current state of {}: it was archived or restored by another attempt", record.path());
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to record archive failure for {}", record.path(), ex);
        }
        return ArchiveOutcome.failed(record.id(), record.path(), kind, message);
    }

    String keyFor(Path local) {
        String relative = resolver.root().relativize(local).toString().replace("\\", "/");
        return keyPrefix.map(prefix -> prefix + "/" + relative).orElse(relative);
    }
}
