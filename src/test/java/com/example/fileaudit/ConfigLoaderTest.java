package com.example.fileaudit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWithoutFileOrEnvironment() {
        AuditConfig config = new ConfigLoader(Map.of()).loadFromEnvironment();

        assertEquals("jdbc:postgresql://localhost:5432/file_audit", config.database().url());
        assertEquals(Duration.ofDays(180), config.scan().retentionThreshold());
        assertTrue(config.scan().fileServerRoot().isEmpty());
        assertTrue(config.scan().excludeFilePatterns().contains("Thumbs.db"));
        assertEquals("DEEP_ARCHIVE", config.archive().storageClass());
        assertTrue(config.archive().strictVerification());
        assertEquals(5, config.restore().retentionDays());
        assertEquals("Standard", config.restore().tier());
        assertFalse(config.remote().isConfigured());
        assertEquals("127.0.0.1", config.web().host());
        assertEquals(5000, config.web().port());
    }

    @Test
    void environmentOverridesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("file-audit.json");
        Files.writeString(file, """
                {
                  "database": {"url": "jdbc:postgresql://db:5432/from_file", "username": "file"},
                  "scan": {"fileServerRoot": "/from/file", "retentionDays": 90, "excludeFilePatterns": ["*.tmp"]},
                  "archive": {"bucket": "file-bucket", "strictVerification": false},
                  "web": {"port": 8080},
                  "unknownSection": {"ignored": true}
                }
                """);
        Map<String, String> env = Map.of(
                "DB_URL", "jdbc:postgresql://env:5432/audit",
                "FILE_SERVER_ROOT", "/from/env",
                "ARCHIVE_BUCKET", "env-bucket",
                "WEB_PORT", "9090"
        );

        AuditConfig config = new ConfigLoader(env).load(file);

        assertEquals("jdbc:postgresql://env:5432/audit", config.database().url());
        assertEquals("file", config.database().username());
        assertEquals(Path.of("/from/env"), config.scan().requireFileServerRoot());
        assertEquals(Duration.ofDays(90), config.scan().retentionThreshold());
        assertTrue(config.scan().excludeFilePatterns().contains("*.tmp"));
        assertTrue(config.scan().excludeFilePatterns().contains("desktop.ini"));
        assertEquals("env-bucket", config.archive().bucket().orElseThrow());
        assertFalse(config.archive().strictVerification());
        assertEquals(9090, config.web().port());
    }

    @Test
    void remoteLibraryIsConfiguredOnlyWithAllCredentials() {
        Map<String, String> env = Map.of(
                "SHAREPOINT_SITE_ID", "contoso.sharepoint.com,site-guid,web-guid",
                "GRAPH_TENANT_ID", "tenant",
                "GRAPH_CLIENT_ID", "client"
        );
        assertFalse(new ConfigLoader(env).loadFromEnvironment().remote().isConfigured());

        Map<String, String> complete = new java.util.HashMap<>(env);
        complete.put("GRAPH_CLIENT_SECRET", "secret");
        assertTrue(new ConfigLoader(complete).loadFromEnvironment().remote().isConfigured());
    }

    @Test
    void rejectsMalformedSiteId() {
        ConfigLoader loader = new ConfigLoader(Map.of("SHAREPOINT_SITE_ID", "contoso.sharepoint.com"));
        assertThrows(IllegalArgumentException.class, loader::loadFromEnvironment);
    }

    @Test
    void rejectsRestoreRetentionAboveThirtyDays(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("file-audit.json");
        Files.writeString(file, "{\"restore\": {\"retentionDays\": 31}}");
        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(Map.of()).load(file));
    }

    @Test
    void missingFileServerRootIsReportedWhenRequired() {
        AuditConfig config = new ConfigLoader(Map.of()).loadFromEnvironment();
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> config.scan().requireFileServerRoot());
        assertTrue(ex.getMessage().contains("FILE_SERVER_ROOT"));
    }
}
