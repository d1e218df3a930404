package com.example.fileaudit;

import com.example.fileaudit.archive.Archiver;
import com.example.fileaudit.archive.BoundaryPathResolver;
import com.example.fileaudit.archive.ColdStorage;
import com.example.fileaudit.archive.S3ColdStorage;
import com.example.fileaudit.remote.GraphRemoteLibrary;
import com.example.fileaudit.remote.RemoteLibrary;
import com.example.fileaudit.restore.RestoreOrchestrator;
import com.example.fileaudit.retrieval.RetrievalGateway;
import com.example.fileaudit.scan.FileServerScanner;
import com.example.fileaudit.scan.RemoteLibraryScanner;
import com.example.fileaudit.store.AuditDataSources;
import com.example.fileaudit.store.AuditStore;
import com.example.fileaudit.store.JdbcAuditStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

public final class AuditContext implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuditContext.class);

    private final AuditConfig config;
    private final HikariDataSource dataSource;
    private final AuditStore store;
    private final FingerprintEngine fingerprints = new FingerprintEngine();
    private final Clock clock = Clock.systemUTC();
    private final BoundaryPathResolver resolver;
    private final ColdStorage coldStorage;
    private final RemoteLibrary remoteLibrary;
    private final Archiver archiver;

    private AuditContext(AuditConfig config) {
        this.config = config;
        this.dataSource = AuditDataSources.create(config.database());
        this.store = new JdbcAuditStore(dataSource);
        this.resolver = config.scan().fileServerRoot().map(BoundaryPathResolver::new).orElse(null);
        this.coldStorage = config.archive().bucket().isPresent() ? new S3ColdStorage(config.archive()) : null;
        this.remoteLibrary = config.remote().isConfigured()
                ? new GraphRemoteLibrary(config.remote(), new ObjectMapper().registerModule(new JavaTimeModule()), clock)
                : null;
        this.archiver = resolver != null && coldStorage != null
                ? new Archiver(store, coldStorage, resolver, fingerprints, config.archive(), clock)
                : null;
    }

    public static AuditContext open(AuditConfig config) {
        return new AuditContext(config);
    }

    public AuditConfig config() {
        return config;
    }

    public AuditStore store() {
        return store;
    }

    public FileServerScanner fileServerScanner() {
        return new FileServerScanner(config.scan(), store, fingerprints, archiver, clock);
    }

    /**
     * Empty when the remote library credentials or site are missing.
     */
    public Optional<RemoteLibraryScanner> remoteLibraryScanner() {
        return Optional.ofNullable(remoteLibrary)
                .map(library -> new RemoteLibraryScanner(config.scan(), library, store, fingerprints, clock));
    }

    public RestoreOrchestrator restoreOrchestrator() {
        return new RestoreOrchestrator(store, coldStorage, config.restore());
    }

    public RetrievalGateway retrievalGateway() {
        return new RetrievalGateway(store, resolver, remoteLibrary, coldStorage, fingerprints, config.retrieval(), new Tika());
    }

    @Override
    public void close() {
        if (coldStorage != null) {
            try {
                coldStorage.close();
            } catch (RuntimeException ex) {
                LOGGER.warn("Failed to close cold storage client", ex);
            }
        }
        dataSource.close();
    }
}
