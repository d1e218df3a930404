package com.example.fileaudit.scan;

import com.example.fileaudit.model.FileSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

public record ScanSummary(
        FileSource source,
        Instant startedAt,
        Instant finishedAt,
        long processed,
        long candidates,
        long migrated,
        long skipped,
        long failed,
        List<ScanItemResult> problems
) {
    public static ScanSummary empty(FileSource source, Instant at) {
        return new ScanSummary(source, at, at, 0, 0, 0, 0, 0, List.of());
    }

    // Thread-safe; fed by scan workers.
    static final class Accumulator {
        private final FileSource source;
        private final Instant startedAt;
        private final int progressInterval;
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong candidates = new AtomicLong();
        private final AtomicLong migrated = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final ConcurrentLinkedQueue<ScanItemResult> problems = new ConcurrentLinkedQueue<>();

        Accumulator(FileSource source, Instant startedAt, int progressInterval) {
            this.source = source;
            this.startedAt = startedAt;
            this.progressInterval = progressInterval;
        }

        /**
         * Records an item and returns the processed count when a progress line is due, otherwise -1.
         */
        long add(ScanItemResult result) {
            if (result.isProblem()) {
                problems.add(result);
            }
            switch (result.kind()) {
                case SKIPPED -> skipped.incrementAndGet();
                case FAILED -> failed.incrementAndGet();
                case PROCESSED -> {
                    if (result.candidate()) {
                        candidates.incrementAndGet();
                    }
                    if (result.migrated()) {
                        migrated.incrementAndGet();
                    }
                    long count = processed.incrementAndGet();
                    return count % progressInterval == 0 ? count : -1;
                }
            }
            return -1;
        }

        ScanSummary finish(Instant finishedAt) {
            return new ScanSummary(
                    source,
                    startedAt,
                    finishedAt,
                    processed.get(),
                    candidates.get(),
                    migrated.get(),
                    skipped.get(),
                    failed.get(),
                    List.copyOf(new ArrayList<>(problems))
            );
        }
    }
}
