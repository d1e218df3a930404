package com.example.fileaudit.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class StagedFileInputStream extends FilterInputStream {
    private static final Logger LOGGER = LoggerFactory.getLogger(StagedFileInputStream.class);
    private final Path staged;
    private boolean closed;

    StagedFileInputStream(Path staged) throws IOException {
        super(Files.newInputStream(staged));
        this.staged = staged;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            super.close();
        } finally {
            discard(staged);
        }
    }

    static void discard(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove staged file {}", staged, ex);
        }
    }
}
