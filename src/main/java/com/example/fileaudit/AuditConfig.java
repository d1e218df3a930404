package com.example.fileaudit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public record AuditConfig(
        Database database,
        Scan scan,
        Archive archive,
        Restore restore,
        Retrieval retrieval,
        Remote remote,
        Web web
) {
    public record Database(
            String url,
            String username,
            String password,
            int maximumPoolSize
    ) {
    }

    public record Scan(
            Optional<Path> fileServerRoot,
            Duration retentionThreshold,
            int threadCount,
            boolean followLinks,
            List<String> excludeFilePatterns,
            List<String> excludeDirectoryPatterns,
            Optional<Path> reportDirectory
    ) {
        public Path requireFileServerRoot() {
            return fileServerRoot.orElseThrow(
                    () -> new IllegalArgumentException("scan.fileServerRoot (FILE_SERVER_ROOT) is not configured."));
        }
    }

    public record Archive(
            Optional<String> bucket,
            Optional<String> prefix,
            Optional<String> region,
            String storageClass,
            boolean strictVerification,
            Duration apiCallTimeout
    ) {
    }

    public record Restore(
            int retentionDays,
            String tier
    ) {
    }

    public record Retrieval(
            Path stagingDirectory
    ) {
    }

    public record Remote(
            Optional<String> siteId,
            Optional<String> tenantId,
            Optional<String> clientId,
            Optional<String> clientSecret,
            Duration requestTimeout
    ) {
        public boolean isConfigured() {
            return siteId.isPresent() && tenantId.isPresent() && clientId.isPresent() && clientSecret.isPresent();
        }
    }

    public record Web(
            String host,
            int port
    ) {
    }
}
