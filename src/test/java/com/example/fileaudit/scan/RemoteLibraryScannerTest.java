package com.example.fileaudit.scan;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.remote.RemoteItem;
import com.example.fileaudit.remote.RemoteLibrary;
import com.example.fileaudit.store.InMemoryAuditStore;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoteLibraryScannerTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final InMemoryAuditStore store = new InMemoryAuditStore(CLOCK);
    private final FingerprintEngine fingerprints = new FingerprintEngine();

    @Test
    void upsertsFilesWithMetadataFingerprint() {
        Instant modified = NOW.minus(Duration.ofDays(10));
        RemoteItem item = file("https://contoso.sharepoint.com/a.docx", modified, "Ana Lopez");

        ScanSummary summary = scanner(List.of(item)).scan();

        assertEquals(1, summary.processed());
        assertEquals(0, summary.candidates());
        FileAuditRecord record = store.findByPath(item.webUrl()).orElseThrow();
        assertEquals(FileSource.REMOTE_LIBRARY, record.source());
        assertEquals(fingerprints.metadataFingerprint(item.webUrl(), modified), record.fingerprint());
        assertEquals(modified, record.lastAccessed());
        assertEquals("Ana Lopez", record.owner());
        assertEquals(ArchiveStatus.ACTIVE, record.status());
    }

    @Test
    void flagsOldItemsWithoutArchivingThem() {
        RemoteItem old = file("https://contoso.sharepoint.com/old.docx", NOW.minus(Duration.ofDays(400)), "Ana");

        ScanSummary summary = scanner(List.of(old)).scan();

        assertEquals(1, summary.candidates());
        assertEquals(0, summary.migrated());
        assertEquals(ArchiveStatus.ACTIVE, store.findByPath(old.webUrl()).orElseThrow().status());
    }

    @Test
    void ignoresFoldersAndSkipsDeletedItems() {
        RemoteItem folder = new RemoteItem("https://contoso.sharepoint.com/Shared", "Shared", NOW, NOW, "Ana", false, false);
        RemoteItem deleted = new RemoteItem("https://contoso.sharepoint.com/x.docx", "x.docx", NOW, NOW, "Ana", true, true);
        RemoteItem noUrl = new RemoteItem(null, "y.docx", NOW, NOW, "Ana", true, false);

        ScanSummary summary = scanner(List.of(folder, deleted, noUrl)).scan();

        assertEquals(0, summary.processed());
        assertEquals(2, summary.skipped());
        assertEquals(0, store.size());
    }

    @Test
    void listingFailureEndsThePass() {
        RemoteLibrary failing = new RemoteLibrary() {
            @Override
            public void forEachItem(Consumer<RemoteItem> consumer) {
                throw new FileAuditException(ErrorKind.COLLABORATOR_UNAUTHORIZED, "sign-in failed");
            }

            @Override
            public InputStream openContent(String webUrl) {
                throw new UnsupportedOperationException();
            }
        };
        RemoteLibraryScanner scanner = new RemoteLibraryScanner(settings(), failing, store, fingerprints, CLOCK);

        FileAuditException ex = assertThrows(FileAuditException.class, scanner::scan);
        assertEquals(ErrorKind.COLLABORATOR_UNAUTHORIZED, ex.kind());
    }

    @Test
    void rescanRefreshesExistingRecord() {
        RemoteItem first = file("https://contoso.sharepoint.com/a.docx", NOW.minus(Duration.ofDays(3)), "Ana");
        RemoteItem edited = file("https://contoso.sharepoint.com/a.docx", NOW.minus(Duration.ofDays(1)), "Ana");

        scanner(List.of(first)).scan();
        ScanSummary summary = scanner(List.of(edited)).scan();

        assertEquals(1, summary.processed());
        assertEquals(1, store.size());
        assertTrue(store.findByPath(first.webUrl()).orElseThrow().lastModified().equals(edited.lastModified()));
    }

    private RemoteLibraryScanner scanner(List<RemoteItem> items) {
        RemoteLibrary library = new RemoteLibrary() {
            @Override
            public void forEachItem(Consumer<RemoteItem> consumer) {
                items.forEach(consumer);
            }

            @Override
            public InputStream openContent(String webUrl) {
                throw new UnsupportedOperationException();
            }
        };
        return new RemoteLibraryScanner(settings(), library, store, fingerprints, CLOCK);
    }

    private static RemoteItem file(String url, Instant modified, String owner) {
        return new RemoteItem(url, url.substring(url.lastIndexOf('/') + 1), modified, modified, owner, true, false);
    }

    private static AuditConfig.Scan settings() {
        return new AuditConfig.Scan(Optional.empty(), Duration.ofDays(180), 1, false, List.of(), List.of(), Optional.empty());
    }
}
