package com.example.fileaudit.remote;

import com.example.fileaudit.model.ObservedFile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * A drive item from the document library. Optional fields are resolved once in
 * {@link #fromJson(JsonNode)}: a missing creator becomes {@value ObservedFile#UNKNOWN_OWNER} and
 * a missing creation time falls back to the modification time.
 */
public record RemoteItem(
        String webUrl,
        String name,
        Instant lastModified,
        Instant created,
        String owner,
        boolean file,
        boolean deleted
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteItem.class);

    public static RemoteItem fromJson(JsonNode node) {
        String webUrl = text(node, "webUrl").orElse(null);
        String name = text(node, "name").orElse(webUrl);
        Instant lastModified = text(node, "lastModifiedDateTime").map(RemoteItem::parseTimestamp).orElse(null);
        Instant created = text(node, "createdDateTime").map(RemoteItem::parseTimestamp).orElse(lastModified);
        String owner = text(node.path("createdBy").path("user"), "displayName").orElse(ObservedFile.UNKNOWN_OWNER);
        return new RemoteItem(
                webUrl,
                name,
                lastModified,
                created,
                owner,
                node.has("file"),
                node.has("deleted")
        );
    }

    /**
     * True for live files that carry the fields a scan needs.
     */
    public boolean isScannable() {
        return file && !deleted && webUrl != null && lastModified != null;
    }

    /**
     * Parses an ISO-8601 timestamp; values without an offset are taken as UTC. Unparseable values
     * yield null, which leaves the item unscannable.
     */
    static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException unparseable) {
                LOGGER.warn("Ignoring unparseable timestamp '{}'", value);
                return null;
            }
        }
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText()).filter(text -> !text.isBlank());
    }
}
