package com.example.fileaudit.retrieval;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.archive.BoundaryPathResolver;
import com.example.fileaudit.archive.ColdObjectRef;
import com.example.fileaudit.archive.ColdStorage;
import com.example.fileaudit.archive.RehydrationState;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.remote.RemoteLibrary;
import com.example.fileaudit.store.AuditStore;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Routes a download by the record's status and source.
 *
 * <table>
 *   <caption>Dispatch</caption>
 *   <tr><th>status</th><th>behaviour</th></tr>
 *   <tr><td>Active / ArchiveFailed</td><td>stream from the source: local file or remote library</td></tr>
 *   <tr><td>Archived</td><td>rejected, a restore must be requested first</td></tr>
 *   <tr><td>Restoring</td><td>rejected while rehydration runs; once the copy is available it is
 *   staged, verified against the archived fingerprint, then served</td></tr>
 * </table>
 * <p>
 * Unverified cold-tier bytes are never served: on mismatch or any other failure the staged file is
 * deleted.
 */
public final class RetrievalGateway {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalGateway.class);
    static final String RESTORE_FIRST = "File is in cold storage. Request a restore first.";
    static final String RESTORE_PENDING = "File is being restored from cold storage. Try again in 12-48 hours.";
    static final String RESTORE_LAPSED = "The restored copy is no longer available. Request a restore again.";

    private final AuditStore store;
    private final BoundaryPathResolver resolver;
    private final RemoteLibrary remoteLibrary;
    private final ColdStorage coldStorage;
    private final FingerprintEngine fingerprints;
    private final Path stagingDirectory;
    private final Tika tika;

    /**
     * {@code resolver}, {@code remoteLibrary} and {@code coldStorage} may be {@code null} when the
     * corresponding source is not configured; requests that need them fail with
     * {@link ErrorKind#UNSUPPORTED_SOURCE}.
     */
    public RetrievalGateway(AuditStore store,
                            BoundaryPathResolver resolver,
                            RemoteLibrary remoteLibrary,
                            ColdStorage coldStorage,
                            FingerprintEngine fingerprints,
                            AuditConfig.Retrieval settings,
                            Tika tika) {
        this.store = store;
        this.resolver = resolver;
        this.remoteLibrary = remoteLibrary;
        this.coldStorage = coldStorage;
        this.fingerprints = fingerprints;
        this.stagingDirectory = settings.stagingDirectory();
        this.tika = tika;
    }

    public Download download(long id) {
        FileAuditRecord record = store.findById(id)
                .orElseThrow(() -> new FileAuditException(ErrorKind.NOT_FOUND, "File not found: no audit record " + id));
        return switch (record.status()) {
            case ACTIVE, ARCHIVE_FAILED -> fromSource(record);
            case ARCHIVED -> throw new FileAuditException(ErrorKind.INVALID_STATE, RESTORE_FIRST);
            case RESTORING -> fromColdTier(record);
        };
    }

    private Download fromSource(FileAuditRecord record) {
        return switch (record.source()) {
            case FILE_SERVER -> fromLocal(record);
            case REMOTE_LIBRARY -> fromRemote(record);
        };
    }

    private Download fromLocal(FileAuditRecord record) {
        if (resolver == null) {
            throw new FileAuditException(ErrorKind.UNSUPPORTED_SOURCE, "File server root is not configured.");
        }
        Path local = resolver.resolve(record.path());
        if (!Files.exists(local, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAuditException(ErrorKind.NOT_FOUND, "Local file missing: " + record.path());
        }
        if (!Files.isRegularFile(local, LinkOption.NOFOLLOW_LINKS) || !Files.isReadable(local)) {
            throw new FileAuditException(ErrorKind.NOT_READABLE, "Permission denied: " + record.path());
        }
        try {
            long size = Files.size(local);
            InputStream in = Files.newInputStream(local);
            String name = local.getFileName().toString();
            return new Download(name, OptionalLong.of(size), tika.detect(name), in);
        } catch (NoSuchFileException ex) {
            throw new FileAuditException(ErrorKind.NOT_FOUND, "Local file missing: " + record.path(), ex);
        } catch (AccessDeniedException ex) {
            throw new FileAuditException(ErrorKind.NOT_READABLE, "Permission denied: " + record.path(), ex);
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.NOT_READABLE, "Failed to open " + record.path() + ": " + ex.getMessage(), ex);
        }
    }

    private Download fromRemote(FileAuditRecord record) {
        if (remoteLibrary == null) {
            throw new FileAuditException(ErrorKind.UNSUPPORTED_SOURCE, "Remote library is not configured.");
        }
        String name = remoteFileName(record.path());
        InputStream in = remoteLibrary.openContent(record.path());
        return new Download(name, OptionalLong.empty(), tika.detect(name), in);
    }

    private Download fromColdTier(FileAuditRecord record) {
        if (coldStorage == null) {
            throw new FileAuditException(ErrorKind.UNSUPPORTED_SOURCE, "Cold storage is not configured.");
        }
        ColdObjectRef ref = record.archiveRefValue()
                .map(ColdObjectRef::parse)
                .orElseThrow(() -> new FileAuditException(ErrorKind.NOT_ARCHIVED, "File is not archived: " + record.path()));
        RehydrationState state = coldStorage.rehydrationState(ref);
        if (state != RehydrationState.AVAILABLE) {
            LOGGER.info("Download of {} refused: rehydration state {}", ref, state);
            String message = switch (state) {
                case NOT_REQUESTED -> RESTORE_LAPSED;
                case IN_PROGRESS, AVAILABLE -> RESTORE_PENDING;
            };
            throw new FileAuditException(ErrorKind.INVALID_STATE, message);
        }
        return stageAndVerify(record, ref);
    }

    private Download stageAndVerify(FileAuditRecord record, ColdObjectRef ref) {
        Path staged;
        try {
            Files.createDirectories(stagingDirectory);
            staged = Files.createTempFile(stagingDirectory, "restored-", ".part");
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE, "Cannot create staging file: " + ex.getMessage(), ex);
        }
        try {
            coldStorage.download(ref, staged);
            String expected = coldStorage.readMetadata(ref).fingerprint();
            String actual = fingerprints.fingerprint(staged);
            if (expected == null || !expected.equals(actual)) {
                LOGGER.error("Fingerprint mismatch for {}: recorded {}, downloaded {}", ref, expected, actual);
                throw new FileAuditException(ErrorKind.FINGERPRINT_MISMATCH,
                        "Restored copy of " + record.path() + " failed the integrity check and was discarded.");
            }
            String name = fileName(record.path());
            long size = Files.size(staged);
            return new Download(name, OptionalLong.of(size), tika.detect(name), new StagedFileInputStream(staged));
        } catch (IOException ex) {
            StagedFileInputStream.discard(staged);
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Failed to stage restored copy of " + record.path() + ": " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            StagedFileInputStream.discard(staged);
            throw ex;
        }
    }

    private static String fileName(String path) {
        Path name = Path.of(path).getFileName();
        return name == null ? path : name.toString();
    }

    static String remoteFileName(String webUrl) {
        String path;
        try {
            path = URI.create(webUrl.replace(" ", "%20")).getPath();
        } catch (IllegalArgumentException ex) {
            path = webUrl;
        }
        if (path == null) {
            return "download";
        }
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isEmpty() ? "download" : last;
    }
}
