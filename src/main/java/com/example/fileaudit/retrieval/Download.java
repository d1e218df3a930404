package com.example.fileaudit.retrieval;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;

/**
 * An open download. The caller streams {@code content} in bounded chunks and must close it;
 * closing also removes any staged copy.
 */
public record Download(
        String fileName,
        OptionalLong contentLength,
        String contentType,
        InputStream content
) implements Closeable {

    @Override
    public void close() throws IOException {
        content.close();
    }
}
