package com.example.fileaudit;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_DATABASE_URL = "jdbc:postgresql://localhost:5432/file_audit";
    private static final int DEFAULT_POOL_SIZE = 5;
    private static final int DEFAULT_RETENTION_DAYS = 180;
    private static final int DEFAULT_RESTORE_DAYS = 5;
    private static final String DEFAULT_RESTORE_TIER = "Standard";
    private static final String DEFAULT_STORAGE_CLASS = "DEEP_ARCHIVE";
    private static final int DEFAULT_API_CALL_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_REMOTE_TIMEOUT_SECONDS = 60;
    private static final String DEFAULT_WEB_HOST = "127.0.0.1";
    private static final int DEFAULT_WEB_PORT = 5000;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "pagefile.sys",
            "hiberfil.sys",
            "swapfile.sys"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.environment = environment;
    }

    public AuditConfig load(Path path) throws IOException {
        return build(mapper.readValue(path.toFile(), RawConfig.class));
    }

    public AuditConfig loadFromEnvironment() {
        return build(new RawConfig());
    }

    private AuditConfig build(RawConfig raw) {
        RawDatabase db = raw.database == null ? new RawDatabase() : raw.database;
        RawScan scan = raw.scan == null ? new RawScan() : raw.scan;
        RawArchive archive = raw.archive == null ? new RawArchive() : raw.archive;
        RawRestore restore = raw.restore == null ? new RawRestore() : raw.restore;
        RawRetrieval retrieval = raw.retrieval == null ? new RawRetrieval() : raw.retrieval;
        RawRemote remote = raw.remote == null ? new RawRemote() : raw.remote;
        RawWeb web = raw.web == null ? new RawWeb() : raw.web;

        AuditConfig.Database database = new AuditConfig.Database(
                env("DB_URL").orElse(optionalString(db.url, DEFAULT_DATABASE_URL)),
                env("DB_USERNAME").orElse(optionalString(db.username, "")),
                env("DB_PASSWORD").orElse(optionalString(db.password, "")),
                positiveOr(db.maximumPoolSize, DEFAULT_POOL_SIZE)
        );

        int retentionDays = positiveOr(scan.retentionDays, DEFAULT_RETENTION_DAYS);
        int threadCount = scan.threadCount != null && scan.threadCount > 0
                ? scan.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        AuditConfig.Scan scanSettings = new AuditConfig.Scan(
                env("FILE_SERVER_ROOT").or(() -> nonBlank(scan.fileServerRoot)).map(Path::of),
                Duration.ofDays(retentionDays),
                threadCount,
                scan.followLinks != null && scan.followLinks,
                mergePatterns(DEFAULT_EXCLUDE_FILES, scan.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, scan.excludeDirectoryPatterns),
                nonBlank(scan.reportDirectory).map(Path::of)
        );

        AuditConfig.Archive archiveSettings = new AuditConfig.Archive(
                env("ARCHIVE_BUCKET").or(() -> nonBlank(archive.bucket)),
                nonBlank(archive.prefix),
                env("AWS_REGION").or(() -> nonBlank(archive.region)),
                optionalString(archive.storageClass, DEFAULT_STORAGE_CLASS),
                archive.strictVerification == null || archive.strictVerification,
                Duration.ofSeconds(positiveOr(archive.apiCallTimeoutSeconds, DEFAULT_API_CALL_TIMEOUT_SECONDS))
        );

        int restoreDays = positiveOr(restore.retentionDays, DEFAULT_RESTORE_DAYS);
        if (restoreDays > 30) {
            throw new IllegalArgumentException("restore.retentionDays must be between 1 and 30.");
        }
        AuditConfig.Restore restoreSettings = new AuditConfig.Restore(
                restoreDays,
                optionalString(restore.tier, DEFAULT_RESTORE_TIER)
        );

        AuditConfig.Retrieval retrievalSettings = new AuditConfig.Retrieval(
                nonBlank(retrieval.stagingDirectory)
                        .map(Path::of)
                        .orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"), "file-audit-staging"))
        );

        AuditConfig.Remote remoteSettings = new AuditConfig.Remote(
                env("SHAREPOINT_SITE_ID").or(() -> nonBlank(remote.siteId)),
                env("GRAPH_TENANT_ID").or(() -> nonBlank(remote.tenantId)),
                env("GRAPH_CLIENT_ID").or(() -> nonBlank(remote.clientId)),
                env("GRAPH_CLIENT_SECRET").or(() -> nonBlank(remote.clientSecret)),
                Duration.ofSeconds(positiveOr(remote.requestTimeoutSeconds, DEFAULT_REMOTE_TIMEOUT_SECONDS))
        );
        remoteSettings.siteId().ifPresent(ConfigLoader::validateSiteId);

        AuditConfig.Web webSettings = new AuditConfig.Web(
                env("WEB_HOST").orElse(optionalString(web.host, DEFAULT_WEB_HOST)),
                env("WEB_PORT").map(Integer::parseInt).orElse(positiveOr(web.port, DEFAULT_WEB_PORT))
        );

        return new AuditConfig(
                database,
                scanSettings,
                archiveSettings,
                restoreSettings,
                retrievalSettings,
                remoteSettings,
                webSettings
        );
    }

    private static void validateSiteId(String siteId) {
        if (siteId.split(",").length != 3) {
            throw new IllegalArgumentException("SHAREPOINT_SITE_ID must be in format: hostname,site-id,web-id");
        }
    }

    private Optional<String> env(String name) {
        return nonBlank(environment.get(name));
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    private static String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static class RawConfig {
        public RawDatabase database;
        public RawScan scan;
        public RawArchive archive;
        public RawRestore restore;
        public RawRetrieval retrieval;
        public RawRemote remote;
        public RawWeb web;
    }

    private static class RawDatabase {
        public String url;
        public String username;
        public String password;
        public Integer maximumPoolSize;
    }

    private static class RawScan {
        public String fileServerRoot;
        public Integer retentionDays;
        public Integer threadCount;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public String reportDirectory;
    }

    private static class RawArchive {
        public String bucket;
        public String prefix;
        public String region;
        public String storageClass;
        public Boolean strictVerification;
        public Integer apiCallTimeoutSeconds;
    }

    private static class RawRestore {
        public Integer retentionDays;
        public String tier;
    }

    private static class RawRetrieval {
        public String stagingDirectory;
    }

    private static class RawRemote {
        public String siteId;
        public String tenantId;
        public String clientId;
        public String clientSecret;
        public Integer requestTimeoutSeconds;
    }

    private static class RawWeb {
        public String host;
        public Integer port;
    }
}
