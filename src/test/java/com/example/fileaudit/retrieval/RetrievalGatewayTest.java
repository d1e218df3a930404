package com.example.fileaudit.retrieval;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.archive.ArchiveMetadata;
import com.example.fileaudit.archive.BoundaryPathResolver;
import com.example.fileaudit.archive.ColdObjectRef;
import com.example.fileaudit.archive.InMemoryColdStorage;
import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.remote.RemoteItem;
import com.example.fileaudit.remote.RemoteLibrary;
import com.example.fileaudit.store.InMemoryAuditStore;
import org.apache.tika.Tika;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalGatewayTest {
    private static final String REMOTE_URL = "https://contoso.sharepoint.com/sites/Finance/Shared Documents/Q1 report.xlsx";

    @TempDir
    Path workspace;

    private Path root;
    private Path staging;
    private InMemoryAuditStore store;
    private InMemoryColdStorage coldStorage;
    private final FingerprintEngine fingerprints = new FingerprintEngine();
    private RetrievalGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectory(workspace.resolve("share"));
        staging = workspace.resolve("staging");
        store = new InMemoryAuditStore();
        coldStorage = new InMemoryColdStorage();
        gateway = gateway(new StubLibrary());
    }

    @Test
    void activeLocalFileIsStreamedFromSource() throws IOException {
        Path file = Files.writeString(root.resolve("notes.txt"), "hello audit");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, file.toString(), ArchiveStatus.ACTIVE, null);

        try (Download download = gateway.download(record.id())) {
            assertEquals("notes.txt", download.fileName());
            assertEquals(OptionalLong.of(11), download.contentLength());
            assertEquals("text/plain", download.contentType());
            assertEquals("hello audit", new String(download.content().readAllBytes(), StandardCharsets.UTF_8));
        }
        assertTrue(Files.exists(file));
    }

    @Test
    void failedArchiveIsStillServedFromSource() throws IOException {
        Path file = Files.writeString(root.resolve("kept.txt"), "still here");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, file.toString(), ArchiveStatus.ARCHIVE_FAILED, null);

        try (Download download = gateway.download(record.id())) {
            assertEquals("still here", new String(download.content().readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void missingLocalFileIsNotFound() {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("gone.txt").toString(), ArchiveStatus.ACTIVE, null);

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertTrue(ex.getMessage().startsWith("Local file missing"));
    }

    @Test
    void storedPathOutsideRootIsRejected() throws IOException {
        Path outside = Files.writeString(workspace.resolve("secret.txt"), "secret");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, outside.toString(), ArchiveStatus.ACTIVE, null);

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.PATH_ESCAPE, ex.kind());
    }

    @Test
    void unknownRecordIsNotFound() {
        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(99));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    }

    @Test
    void archivedFileNeedsRestoreFirst() {
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.ARCHIVED, "s3://archive-test/old.txt");

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.INVALID_STATE, ex.kind());
        assertEquals(RetrievalGateway.RESTORE_FIRST, ex.getMessage());
    }

    @Test
    void restoreInProgressIsRefusedWithRetryGuidance() throws IOException {
        ColdObjectRef ref = archive("old.txt", "archived content");
        coldStorage.requestRestore(ref, 5, "Standard");
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.RESTORING, ref.uri());

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.INVALID_STATE, ex.kind());
        assertEquals(RetrievalGateway.RESTORE_PENDING, ex.getMessage());
    }

    @Test
    void expiredRehydrationAsksForAnotherRestore() throws IOException {
        ColdObjectRef ref = archive("old.txt", "archived content");
        coldStorage.completeRehydration(ref);
        coldStorage.expireRehydration(ref);
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.RESTORING, ref.uri());

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.INVALID_STATE, ex.kind());
        assertEquals(RetrievalGateway.RESTORE_LAPSED, ex.getMessage());
        assertEquals(0, stagedFiles());
    }

    @Test
    void rehydratedCopyIsVerifiedServedAndCleanedUp() throws IOException {
        ColdObjectRef ref = archive("old.txt", "archived content");
        coldStorage.completeRehydration(ref);
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.RESTORING, ref.uri());

        try (Download download = gateway.download(record.id())) {
            assertEquals("old.txt", download.fileName());
            assertEquals(OptionalLong.of(16), download.contentLength());
            assertEquals("archived content", new String(download.content().readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(0, stagedFiles());
    }

    @Test
    void corruptedCopyFailsIntegrityCheckAndIsDiscarded() throws IOException {
        ColdObjectRef ref = archive("old.txt", "archived content");
        coldStorage.completeRehydration(ref);
        coldStorage.corrupt(ref, "tampered".getBytes(StandardCharsets.UTF_8));
        FileAuditRecord record = store.put(FileSource.FILE_SERVER, root.resolve("old.txt").toString(),
                ArchiveStatus.RESTORING, ref.uri());

        FileAuditException ex = assertThrows(FileAuditException.class, () -> gateway.download(record.id()));
        assertEquals(ErrorKind.FINGERPRINT_MISMATCH, ex.kind());
        assertEquals(0, stagedFiles());
    }

    @Test
    void remoteLibraryItemIsStreamedByUrl() throws IOException {
        FileAuditRecord record = store.put(FileSource.REMOTE_LIBRARY, REMOTE_URL, ArchiveStatus.ACTIVE, null);

        try (Download download = gateway.download(record.id())) {
            assertEquals("Q1 report.xlsx", download.fileName());
            assertFalse(download.contentLength().isPresent());
            assertEquals("remote:" + REMOTE_URL, new String(download.content().readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void remoteItemWithoutLibraryIsUnsupported() {
        RetrievalGateway withoutLibrary = gateway(null);
        FileAuditRecord record = store.put(FileSource.REMOTE_LIBRARY, REMOTE_URL, ArchiveStatus.ACTIVE, null);

        FileAuditException ex = assertThrows(FileAuditException.class, () -> withoutLibrary.download(record.id()));
        assertEquals(ErrorKind.UNSUPPORTED_SOURCE, ex.kind());
    }

    @Test
    void derivesFileNameFromRemoteUrl() {
        assertEquals("Q1 report.xlsx", RetrievalGateway.remoteFileName(REMOTE_URL));
        assertEquals("a.docx", RetrievalGateway.remoteFileName("https://contoso.sharepoint.com/a.docx?web=1"));
        assertEquals("download", RetrievalGateway.remoteFileName("https://contoso.sharepoint.com/"));
    }

    private ColdObjectRef archive(String name, String content) throws IOException {
        Path source = Files.writeString(workspace.resolve(name), content);
        ArchiveMetadata metadata = new ArchiveMetadata(root.resolve(name).toString(), fingerprints.fingerprint(source),
                "file-audit", Instant.now());
        ColdObjectRef ref = coldStorage.upload(name, source, metadata);
        Files.delete(source);
        return ref;
    }

    private long stagedFiles() throws IOException {
        if (!Files.exists(staging)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(staging)) {
            return files.count();
        }
    }

    private RetrievalGateway gateway(RemoteLibrary library) {
        return new RetrievalGateway(store, new BoundaryPathResolver(root), library, coldStorage, fingerprints,
                new AuditConfig.Retrieval(staging), new Tika());
    }

    private static final class StubLibrary implements RemoteLibrary {
        @Override
        public void forEachItem(Consumer<RemoteItem> consumer) {
        }

        @Override
        public InputStream openContent(String webUrl) {
            return new ByteArrayInputStream(("remote:" + webUrl).getBytes(StandardCharsets.UTF_8));
        }
    }
}
