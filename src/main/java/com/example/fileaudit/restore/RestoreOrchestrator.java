package com.example.fileaudit.restore;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.archive.ColdObjectRef;
import com.example.fileaudit.archive.ColdStorage;
import com.example.fileaudit.archive.RehydrationState;
import com.example.fileaudit.archive.RestoreRequestResult;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.store.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RestoreOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RestoreOrchestrator.class);

    private final AuditStore store;
    private final ColdStorage coldStorage;
    private final int retentionDays;
    private final String tier;

    /**
     * {@code coldStorage} may be {@code null} when no archive bucket is configured; every restore
     * request then fails with {@link ErrorKind#UNSUPPORTED_SOURCE}.
     */
    public RestoreOrchestrator(AuditStore store, ColdStorage coldStorage, AuditConfig.Restore settings) {
        this.store = store;
        this.coldStorage = coldStorage;
        this.retentionDays = settings.retentionDays();
        this.tier = settings.tier();
    }

    /**
     * Requests a restore of record {@code id}. Repeated or concurrent requests for the same record
     * succeed with {@link RestoreOutcome#ALREADY_IN_PROGRESS}. A Restoring record whose rehydrated
     * copy has expired, or whose earlier request never took effect, is requested again.
     *
     * @throws FileAuditException {@code NOT_FOUND} for an unknown id, {@code NOT_ARCHIVED} when the
     *                            record has no archived object, or a collaborator kind when the
     *                            provider call fails
     */
    public RestoreOutcome requestRestore(long id) {
        FileAuditRecord record = store.findById(id)
                .orElseThrow(() -> new FileAuditException(ErrorKind.NOT_FOUND, "No audit record with id " + id));
        String archiveRef = record.archiveRefValue()
                .orElseThrow(() -> new FileAuditException(ErrorKind.NOT_ARCHIVED,
                        "File is not archived: " + record.path()));

        boolean alreadyRestoring = switch (record.status()) {
            case RESTORING -> true;
            case ARCHIVED -> false;
            case ACTIVE, ARCHIVE_FAILED -> throw new FileAuditException(ErrorKind.NOT_ARCHIVED,
                    "File is not archived (status " + record.status().label() + "): " + record.path());
        };
        if (coldStorage == null) {
            throw new FileAuditException(ErrorKind.UNSUPPORTED_SOURCE, "Cold storage is not configured.");
        }
        ColdObjectRef ref = ColdObjectRef.parse(archiveRef);
        if (alreadyRestoring) {
            return renewIfLapsed(record, ref);
        }

        RestoreRequestResult result = coldStorage.requestRestore(ref, retentionDays, tier);
        boolean transitioned = store.markRestoring(id);
        if (!transitioned) {
            LOGGER.info("Record {} was already moved to Restoring by a concurrent request", id);
            return RestoreOutcome.ALREADY_IN_PROGRESS;
        }
        return result == RestoreRequestResult.INITIATED
                ? RestoreOutcome.INITIATED
                : RestoreOutcome.ALREADY_IN_PROGRESS;
    }

    private RestoreOutcome renewIfLapsed(FileAuditRecord record, ColdObjectRef ref) {
        if (coldStorage.rehydrationState(ref) != RehydrationState.NOT_REQUESTED) {
            LOGGER.info("Restore already requested for {}", record.path());
            return RestoreOutcome.ALREADY_IN_PROGRESS;
        }
        LOGGER.info("Rehydrated copy of {} is gone, requesting {} again", record.path(), ref);
        RestoreRequestResult result = coldStorage.requestRestore(ref, retentionDays, tier);
        return result == RestoreRequestResult.INITIATED
                ? RestoreOutcome.INITIATED
                : RestoreOutcome.ALREADY_IN_PROGRESS;
    }
}
