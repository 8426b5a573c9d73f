package io.secondbrain.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.secondbrain.memory.StorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed document bookkeeping, sharing the memory store's database.
 * A document in a terminal status is never rewritten.
 */
@Component
public class SQLiteDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDocumentStore.class);
    private static final TypeReference<List<String>> IDS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public SQLiteDocumentStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS documents (
                    id TEXT PRIMARY KEY,
                    owner_id TEXT NOT NULL,
                    title TEXT,
                    raw_content TEXT NOT NULL,
                    status TEXT NOT NULL,
                    memory_ids TEXT NOT NULL DEFAULT '[]',
                    error_message TEXT,
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_documents_owner ON documents(owner_id, created_at)");
            log.info("SQLiteDocumentStore initialized");
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite document store", e);
            throw new StorageException("Document store initialization failed", e);
        }
    }

    @Override
    public void save(Document document) {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("""
                     INSERT INTO documents (id, owner_id, title, raw_content, status, memory_ids, error_message,
                                            created_at, updated_at)
                     VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                     """)) {
            stmt.setString(1, document.id());
            stmt.setString(2, document.ownerId());
            stmt.setString(3, document.title());
            stmt.setString(4, document.rawContent());
            stmt.setString(5, document.status().name());
            stmt.setString(6, toJson(document.memoryIds()));
            stmt.setString(7, document.errorMessage());
            stmt.setLong(8, document.createdAt().toEpochMilli());
            stmt.setLong(9, document.updatedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to save document " + document.id(), e);
        }
    }

    @Override
    public void update(Document document) {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("""
                     UPDATE documents SET status = ?, memory_ids = ?, error_message = ?, updated_at = ?
                     WHERE id = ? AND status NOT IN ('DONE', 'FAILED')
                     """)) {
            stmt.setString(1, document.status().name());
            stmt.setString(2, toJson(document.memoryIds()));
            stmt.setString(3, document.errorMessage());
            stmt.setLong(4, document.updatedAt().toEpochMilli());
            stmt.setString(5, document.id());
            if (stmt.executeUpdate() == 0) {
                throw new IllegalStateException("Document %s is unknown or already finished".formatted(document.id()));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to update document " + document.id(), e);
        }
    }

    @Override
    public Optional<Document> findById(String documentId) {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("SELECT * FROM documents WHERE id = ?")) {
            stmt.setString(1, documentId);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toDocument(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read document " + documentId, e);
        }
    }

    @Override
    public List<Document> findByOwner(String ownerId) {
        List<Document> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("SELECT * FROM documents WHERE owner_id = ? ORDER BY created_at")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toDocument(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list documents of " + ownerId, e);
        }
        return results;
    }

    @Override
    public int deleteOwner(String ownerId) {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("DELETE FROM documents WHERE owner_id = ?")) {
            stmt.setString(1, ownerId);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete documents of " + ownerId, e);
        }
    }

    private Document toDocument(ResultSet rs) throws SQLException {
        List<String> memoryIds;
        try {
            memoryIds = objectMapper.readValue(rs.getString("memory_ids"), IDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unreadable document " + rs.getString("id"), e);
        }
        return new Document(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("title"),
                rs.getString("raw_content"),
                DocumentStatus.fromString(rs.getString("status")),
                memoryIds,
                rs.getString("error_message"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at"))
        );
    }

    private String toJson(List<String> ids) {
        try {
            return objectMapper.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize memory ids", e);
        }
    }
}
