package com.example.fileaudit.store;

import com.example.fileaudit.model.ArchiveStatus;
import com.example.fileaudit.model.FileAuditRecord;
import com.example.fileaudit.model.FileSource;
import com.example.fileaudit.model.ObservedFile;
import com.example.fileaudit.model.StatusCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Each call borrows its own connection in auto-commit mode.
public final class JdbcAuditStore implements AuditStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcAuditStore.class);
    private static final String SCHEMA_RESOURCE = "/db/schema.sql";

    private static final String COLUMNS = "id, source, file_path, last_modified, last_accessed, owner, "
            + "checksum, status, archive_url, failure_reason, created_at, updated_at";

    private static final String UPSERT = """
            INSERT INTO file_audit
                (source, file_path, last_modified, last_accessed, owner, checksum, status)
            VALUES (?, ?, ?, ?, ?, ?, 'Active')
            ON CONFLICT (file_path) DO UPDATE SET
                source = EXCLUDED.source,
                last_modified = EXCLUDED.last_modified,
                last_accessed = EXCLUDED.last_accessed,
                owner = EXCLUDED.owner,
                checksum = EXCLUDED.checksum,
                status = 'Active',
                archive_url = NULL,
                failure_reason = NULL,
                updated_at = CURRENT_TIMESTAMP
            RETURNING
            """ + COLUMNS;

    private final DataSource dataSource;

    public JdbcAuditStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void initSchema() {
        String script = loadSchemaScript();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(script);
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to initialize audit schema", ex);
        }
        LOGGER.info("Audit schema initialized.");
    }

    @Override
    public FileAuditRecord upsertObserved(ObservedFile observed) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(UPSERT)) {
            statement.setString(1, observed.source().label());
            statement.setString(2, observed.path());
            statement.setObject(3, toTimestamp(observed.lastModified()));
            statement.setObject(4, toTimestamp(observed.lastAccessed()));
            statement.setString(5, observed.owner());
            statement.setString(6, observed.fingerprint());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    throw new AuditStoreException("Upsert returned no row for " + observed.path(), null);
                }
                return map(rs);
            }
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to upsert audit record for " + observed.path(), ex);
        }
    }

    @Override
    public Optional<FileAuditRecord> findById(long id) {
        return findOne("SELECT " + COLUMNS + " FROM file_audit WHERE id = ?", statement -> statement.setLong(1, id));
    }

    @Override
    public Optional<FileAuditRecord> findByPath(String path) {
        return findOne("SELECT " + COLUMNS + " FROM file_audit WHERE file_path = ?",
                statement -> statement.setString(1, path));
    }

    @Override
    public void markArchived(long id, String archiveRef) {
        int updated = update("""
                UPDATE file_audit
                SET status = 'Archived', archive_url = ?, failure_reason = NULL, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """, statement -> {
            statement.setString(1, archiveRef);
            statement.setLong(2, id);
        });
        requireRow(updated, id);
    }

    @Override
    public boolean markArchiveFailed(long id, String reason, String uploadedRef) {
        int updated = update("""
                UPDATE file_audit
                SET status = 'ArchiveFailed', archive_url = NULL, failure_reason = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                  AND (status IN ('Active', 'ArchiveFailed') OR (status = 'Archived' AND archive_url = ?))
                """, statement -> {
            statement.setString(1, reason);
            statement.setLong(2, id);
            statement.setString(3, uploadedRef);
        });
        return updated == 1;
    }

    @Override
    public boolean markRestoring(long id) {
        int updated = update("""
                UPDATE file_audit
                SET status = 'Restoring', updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND status = 'Archived'
                """, statement -> statement.setLong(1, id));
        return updated == 1;
    }

    @Override
    public List<FileAuditRecord> recent(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM file_audit ORDER BY created_at DESC, id DESC LIMIT ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, limit);
            List<FileAuditRecord> records = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
            return records;
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to list recent audit records", ex);
        }
    }

    @Override
    public StatusCounts countByStatus() {
        String sql = "SELECT status, COUNT(*) AS total FROM file_audit GROUP BY status";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet rs = statement.executeQuery()) {
            Map<ArchiveStatus, Long> counts = new EnumMap<>(ArchiveStatus.class);
            while (rs.next()) {
                counts.put(ArchiveStatus.fromLabel(rs.getString("status")), rs.getLong("total"));
            }
            return new StatusCounts(counts);
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to count audit records by status", ex);
        }
    }

    private Optional<FileAuditRecord> findOne(String sql, StatementBinder binder) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            binder.bind(statement);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to read audit record", ex);
        }
    }

    private int update(String sql, StatementBinder binder) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            binder.bind(statement);
            return statement.executeUpdate();
        } catch (SQLException ex) {
            throw new AuditStoreException("Failed to update audit record", ex);
        }
    }

    private static void requireRow(int updated, long id) {
        if (updated != 1) {
            throw new AuditStoreException("No audit record with id " + id, null);
        }
    }

    private static FileAuditRecord map(ResultSet rs) throws SQLException {
        return new FileAuditRecord(
                rs.getLong("id"),
                FileSource.fromLabel(rs.getString("source")),
                rs.getString("file_path"),
                rs.getString("checksum"),
                toInstant(rs.getObject("last_modified", OffsetDateTime.class)),
                toInstant(rs.getObject("last_accessed", OffsetDateTime.class)),
                rs.getString("owner"),
                ArchiveStatus.fromLabel(rs.getString("status")),
                rs.getString("archive_url"),
                rs.getString("failure_reason"),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                toInstant(rs.getObject("updated_at", OffsetDateTime.class))
        );
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }

    private static String loadSchemaScript() {
        try (InputStream in = JdbcAuditStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + SCHEMA_RESOURCE, ex);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement statement) throws SQLException;
    }
}
