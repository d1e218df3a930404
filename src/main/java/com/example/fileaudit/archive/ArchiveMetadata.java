package com.example.fileaudit.archive;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

// Original path is URL-encoded; object metadata values must be US-ASCII.
public record ArchiveMetadata(
        String originalPath,
        String fingerprint,
        String archivedBy,
        Instant archivedAt
) {
    public static final String ORIGINAL_PATH = "original-path";
    public static final String CHECKSUM = "checksum-sha256";
    public static final String ARCHIVED_BY = "archived-by";
    public static final String ARCHIVE_DATE = "archive-date";

    public Map<String, String> toUserMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ORIGINAL_PATH, URLEncoder.encode(originalPath, StandardCharsets.UTF_8));
        metadata.put(CHECKSUM, fingerprint);
        metadata.put(ARCHIVED_BY, archivedBy);
        metadata.put(ARCHIVE_DATE, Long.toString(archivedAt.getEpochSecond()));
        return metadata;
    }

    public static ArchiveMetadata fromUserMetadata(Map<String, String> metadata) {
        String originalPath = Optional.ofNullable(metadata.get(ORIGINAL_PATH))
                .map(value -> URLDecoder.decode(value, StandardCharsets.UTF_8))
                .orElse(null);
        Instant archivedAt = Optional.ofNullable(metadata.get(ARCHIVE_DATE))
                .map(Long::parseLong)
                .map(Instant::ofEpochSecond)
                .orElse(null);
        return new ArchiveMetadata(originalPath, metadata.get(CHECKSUM), metadata.get(ARCHIVED_BY), archivedAt);
    }
}
