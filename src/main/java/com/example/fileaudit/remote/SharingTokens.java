package com.example.fileaudit.remote;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Sharing tokens address a drive item by its URL through {@code /shares/{token}}.
 * <p>
 * Encoding: base64url of the UTF-8 URL, trailing {@code '='} padding removed, prefixed with
 * {@code "u!"}. Example: {@code https://contoso.sharepoint.com/a.docx} becomes
 * {@code u!aHR0cHM6Ly9jb250b3NvLnNoYXJlcG9pbnQuY29tL2EuZG9jeA}.
 */
public final class SharingTokens {
    static final String PREFIX = "u!";

    private SharingTokens() {
    }

    public static String encode(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Sharing URI must not be blank");
        }
        return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(uri.getBytes(StandardCharsets.UTF_8));
    }
}
