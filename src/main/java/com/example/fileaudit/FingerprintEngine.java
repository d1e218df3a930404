package com.example.fileaudit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

public final class FingerprintEngine {
    public static final int BUFFER_SIZE = 8192;

    public String fingerprint(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return fingerprint(inputStream);
        }
    }

    public String fingerprint(InputStream inputStream) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return toHex(digest.digest());
    }

    /**
     * Digest of {@code path + lastModified} for items whose content the scanner does not read.
     * Detects moves and edits reported by the source; does not prove the bytes are unchanged.
     */
    public String metadataFingerprint(String path, Instant lastModified) {
        MessageDigest digest = newDigest();
        String input = path + DateTimeFormatter.ISO_INSTANT.format(lastModified);
        return toHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
