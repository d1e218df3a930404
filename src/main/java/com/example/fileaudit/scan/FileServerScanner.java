package com.example.fileaudit.scan;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.FingerprintEngine;
import com.example.fileaudit.archive.ArchiveOutcome;
import com.example.fileaudit.archive.Archiver;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.model.ObservedFile;
import com.example.fileaudit.store.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Walks the file-server root, upserts an audit record per file and archives candidates.
 * <p>
 * Directories are walked breadth-first on the calling thread; stat, fingerprint, upsert and
 * archive run on a fixed worker pool. Files that are unreadable or vanish mid-scan are skipped and
 * reported, never fatal to the pass.
 */
public final class FileServerScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileServerScanner.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final Path root;
    private final AuditConfig.Scan settings;
    private final AuditStore store;
    private final FingerprintEngine fingerprints;
    private final Archiver archiver;
    private final RetentionPolicy retention;
    private final Clock clock;
    private final List<PathMatcher> fileExcludes;
    private final List<PathMatcher> directoryExcludes;

    /**
     * @param archiver archiver for candidates, or {@code null} to only flag them
     */
    public FileServerScanner(AuditConfig.Scan settings,
                             AuditStore store,
                             FingerprintEngine fingerprints,
                             Archiver archiver,
                             Clock clock) {
        this.root = settings.requireFileServerRoot().toAbsolutePath().normalize();
        this.settings = settings;
        this.store = store;
        this.fingerprints = fingerprints;
        this.archiver = archiver;
        this.retention = new RetentionPolicy(settings.retentionThreshold());
        this.clock = clock;
        this.fileExcludes = matchers(settings.excludeFilePatterns());
        this.directoryExcludes = matchers(settings.excludeDirectoryPatterns());
    }

    public ScanSummary scan() throws InterruptedException {
        Instant now = clock.instant();
        if (!Files.isDirectory(root)) {
            LOGGER.warn("File server path not found: {}", root);
            return ScanSummary.empty(FileSource.FILE_SERVER, now);
        }
        LOGGER.info("Starting file server scan at {}", root);
        LOGGER.info("Archive threshold: last access before {}", retention.cutoff(now));
        if (archiver == null) {
            LOGGER.warn("Cold storage is not configured; candidates will be flagged but not archived.");
        }

        ScanSummary.Accumulator accumulator = new ScanSummary.Accumulator(FileSource.FILE_SERVER, now, PROGRESS_INTERVAL);
        ExecutorService workers = Executors.newFixedThreadPool(settings.threadCount());
        try {
            Deque<Path> pending = new ArrayDeque<>();
            pending.add(root);
            while (!pending.isEmpty()) {
                Path current = pending.removeFirst();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                    for (Path entry : stream) {
                        if (shouldSkipLink(entry)) {
                            continue;
                        }
                        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS) || (settings.followLinks() && Files.isDirectory(entry))) {
                            if (!matches(directoryExcludes, entry)) {
                                pending.addLast(entry);
                            }
                        } else if (!matches(fileExcludes, entry)) {
                            workers.submit(() -> record(accumulator, process(entry, now)));
                        }
                    }
                } catch (IOException ex) {
                    LOGGER.warn("Failed to list directory {}", current, ex);
                    accumulator.add(ScanItemResult.skipped(current.toString(), "directory not listable: " + ex.getMessage()));
                }
            }
        } finally {
            workers.shutdown();
        }
        workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);

        ScanSummary summary = accumulator.finish(clock.instant());
        LOGGER.info("File server scan completed. Processed {}, candidates {}, archived {}, skipped {}, failed {}.",
                summary.processed(), summary.candidates(), summary.migrated(), summary.skipped(), summary.failed());
        return summary;
    }

    ScanItemResult process(Path file, Instant now) {
        String path = file.toAbsolutePath().normalize().toString();
        try {
            if (!Files.isReadable(file)) {
                LOGGER.warn("Skipping unreadable file (locked?): {}", path);
                return ScanItemResult.skipped(path, "not readable");
            }
            LinkOption[] linkOptions = settings.followLinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class, linkOptions);
            if (!attributes.isRegularFile()) {
                return ScanItemResult.skipped(path, "not a regular file");
            }
            String fingerprint = fingerprints.fingerprint(file);
            ObservedFile observed = new ObservedFile(
                    FileSource.FILE_SERVER,
                    path,
                    fingerprint,
                    attributes.lastModifiedTime().toInstant(),
                    attributes.lastAccessTime().toInstant(),
                    owner(file)
            );
            FileAuditRecord record = store.upsertObserved(observed);

            if (!retention.isCandidate(observed.lastAccessed(), now)) {
                return ScanItemResult.processed(path, false, false);
            }
            LOGGER.info("File eligible for archiving: {}", path);
            if (archiver == null) {
                return ScanItemResult.processed(path, true, false);
            }
            ArchiveOutcome outcome = archiver.archive(record);
            return outcome.isArchived()
                    ? ScanItemResult.processed(path, true, true)
                    : ScanItemResult.archiveFailed(path, outcome.failureKind().map(Enum::name).orElse("FAILED") + ": " + outcome.message());
        } catch (AccessDeniedException ex) {
            LOGGER.warn("Access denied: {}", path);
            return ScanItemResult.skipped(path, "permission denied");
        } catch (NoSuchFileException ex) {
            LOGGER.warn("File deleted during scan: {}", path);
            return ScanItemResult.skipped(path, "disappeared during scan");
        } catch (IOException | RuntimeException ex) {
            LOGGER.error("Unexpected error processing {}", path, ex);
            return ScanItemResult.failed(path, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private void record(ScanSummary.Accumulator accumulator, ScanItemResult result) {
        long progress = accumulator.add(result);
        if (progress > 0) {
            LOGGER.info("Processed {} files...", progress);
        }
    }

    private String owner(Path file) {
        try {
            return Files.getOwner(file, LinkOption.NOFOLLOW_LINKS).getName();
        } catch (IOException | UnsupportedOperationException ex) {
            LOGGER.debug("Owner not available for {}", file, ex);
            return ObservedFile.UNKNOWN_OWNER;
        }
    }

    private boolean shouldSkipLink(Path path) {
        return !settings.followLinks() && Files.isSymbolicLink(path);
    }

    private static boolean matches(List<PathMatcher> matchers, Path path) {
        Path name = path.getFileName();
        return name != null && matchers.stream().anyMatch(matcher -> matcher.matches(name));
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        return patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }
}
