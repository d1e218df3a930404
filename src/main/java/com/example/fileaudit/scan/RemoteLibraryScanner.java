package com.example.fileaudit.scan;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.model.ObservedFile;
import com.example.fileaudit.remote.RemoteItem;
import com.example.fileaudit.remote.RemoteLibrary;
import com.example.fileaudit.store.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Syncs document-library items into the audit table.
 * <p>
 * The library exposes neither content nor access time cheaply, so the fingerprint is a
 * {@link FingerprintEngine#metadataFingerprint metadata fingerprint} and the modification time
 * stands in for the access time. Candidates are flagged only; the archiver works on local files.
 */
public final class RemoteLibraryScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteLibraryScanner.class);
    private static final int PROGRESS_INTERVAL = 50;

    private final RemoteLibrary library;
    private final AuditStore store;
    private final FingerprintEngine fingerprints;
    private final RetentionPolicy retention;
    private final Clock clock;

    public RemoteLibraryScanner(AuditConfig.Scan settings,
                                RemoteLibrary library,
                                AuditStore store,
                                FingerprintEngine fingerprints,
                                Clock clock) {
        this.library = library;
        this.store = store;
        this.fingerprints = fingerprints;
        this.retention = new RetentionPolicy(settings.retentionThreshold());
        this.clock = clock;
    }

    /**
     * Runs one pass. A failure to list the library ends the pass with the collaborator error;
     * failures on single items are counted and reported.
     */
    public ScanSummary scan() {
        Instant now = clock.instant();
        LOGGER.info("Starting remote library scan");
        ScanSummary.Accumulator accumulator = new ScanSummary.Accumulator(FileSource.REMOTE_LIBRARY, now, PROGRESS_INTERVAL);
        library.forEachItem(item -> {
            if (!item.file()) {
                return;
            }
            long progress = accumulator.add(process(item, now));
            if (progress > 0) {
                LOGGER.info("Processed {} remote library files...", progress);
            }
        });
        ScanSummary summary = accumulator.finish(clock.instant());
        LOGGER.info("Remote library scan completed. Processed {}, candidates {}, skipped {}, failed {}.",
                summary.processed(), summary.candidates(), summary.skipped(), summary.failed());
        return summary;
    }

    ScanItemResult process(RemoteItem item, Instant now) {
        String label = item.webUrl() == null ? item.name() : item.webUrl();
        if (!item.isScannable()) {
            return ScanItemResult.skipped(label, item.deleted() ? "deleted in library" : "missing url or modification time");
        }
        try {
            ObservedFile observed = new ObservedFile(
                    FileSource.REMOTE_LIBRARY,
                    item.webUrl(),
                    fingerprints.metadataFingerprint(item.webUrl(), item.lastModified()),
                    item.lastModified(),
                    item.lastModified(),
                    item.owner()
            );
            store.upsertObserved(observed);
            boolean candidate = retention.isCandidate(observed.lastAccessed(), now);
            if (candidate) {
                LOGGER.info("Remote file eligible for archiving: {}", item.webUrl());
            }
            return ScanItemResult.processed(item.webUrl(), candidate, false);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to process remote library file {}", label, ex);
            return ScanItemResult.failed(label, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }
}
