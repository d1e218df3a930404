package com.example.fileaudit.remote;

import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Cloud document library as seen by the scanner and the retrieval gateway.
 */
public interface RemoteLibrary {

    /**
     * Streams every item of the library to {@code consumer}, page by page. Failing to fetch a page
     * ends the listing with a {@link com.example.fileaudit.FileAuditException}.
     */
    void forEachItem(Consumer<RemoteItem> consumer);

    /**
     * Opens the content of the item at {@code webUrl}. The caller closes the stream.
     */
    InputStream openContent(String webUrl);
}
