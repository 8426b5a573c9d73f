package io.secondbrain.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.secondbrain.config.SecondBrainProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * SQLite-backed memory store with an in-memory hot-tier vector index.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memories}: content, embedding BLOB, JSON keywords and entities, tier, access counters,
 *       and the versioned {@code is_latest} flag</li>
 *   <li>{@code relationships}: directed typed edges, unique per (from_id, to_id, kind)</li>
 * </ul>
 *
 * <p>Each operation borrows its own connection. Timestamps are epoch milliseconds so they sort numerically.
 * Hot rows are loaded into the {@link VectorIndex} on startup; cold rows are scanned on demand.</p>
 */
@Component
public class SQLiteMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);
    private static final TypeReference<List<String>> KEYWORDS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<EntityCategory, Set<String>>> ENTITIES_TYPE = new TypeReference<>() {};

    private static final String MEMORY_COLUMNS = """
            id, owner_id, content, embedding, keywords, entities, created_at, access_count,
            last_accessed_at, is_latest, tier, source_document_id, chunk_index, version
            """;

    private static final int TIER_LOCK_STRIPES = 64;

    private final DataSource dataSource;
    private final VectorIndex index;
    private final ObjectMapper objectMapper;
    private final int dimensions;
    // row update and index update of one memory's tier move happen under the same stripe
    private final Object[] tierLocks = new Object[TIER_LOCK_STRIPES];

    public SQLiteMemoryStore(DataSource dataSource, VectorIndex index, ObjectMapper objectMapper,
                             SecondBrainProperties properties) {
        this.dataSource = dataSource;
        this.index = index;
        this.objectMapper = objectMapper;
        this.dimensions = properties.embedding().dimensions();
        for (int i = 0; i < tierLocks.length; i++) {
            tierLocks[i] = new Object();
        }
    }

    @PostConstruct
    public void init() {
        try (Connection conn = dataSource.getConnection()) {
            createSchema(conn);
            int hydrated = hydrateHotIndex(conn);
            log.info("SQLiteMemoryStore initialized, {} hot memories indexed", hydrated);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store", e);
            throw new StorageException("Memory store initialization failed", e);
        }
    }

    private void createSchema(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id TEXT PRIMARY KEY,
                    owner_id TEXT NOT NULL,
                    content TEXT NOT NULL,
                    embedding BLOB NOT NULL,
                    keywords TEXT NOT NULL DEFAULT '[]',
                    entities TEXT NOT NULL DEFAULT '{}',
                    created_at INTEGER NOT NULL,
                    access_count INTEGER NOT NULL DEFAULT 0,
                    last_accessed_at INTEGER,
                    is_latest INTEGER NOT NULL DEFAULT 1,
                    tier TEXT NOT NULL DEFAULT 'HOT',
                    source_document_id TEXT,
                    chunk_index INTEGER NOT NULL DEFAULT 0,
                    version INTEGER NOT NULL DEFAULT 0
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_owner ON memories(owner_id, created_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_owner_tier ON memories(owner_id, tier)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_document ON memories(source_document_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS relationships (
                    id TEXT PRIMARY KEY,
                    owner_id TEXT NOT NULL,
                    from_id TEXT NOT NULL,
                    to_id TEXT NOT NULL,
                    kind TEXT NOT NULL,
                    confidence REAL NOT NULL,
                    reason TEXT NOT NULL DEFAULT '',
                    created_at INTEGER NOT NULL,
                    UNIQUE (from_id, to_id, kind)
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_relationships_from ON relationships(from_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_relationships_to ON relationships(to_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_relationships_owner ON relationships(owner_id)");
        }
    }

    private int hydrateHotIndex(Connection conn) throws SQLException {
        int count = 0;
        try (var stmt = conn.prepareStatement("SELECT id, owner_id, embedding FROM memories WHERE tier = 'HOT'");
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                byte[] blob = rs.getBytes("embedding");
                if (blob == null || blob.length != dimensions * Float.BYTES) {
                    log.warn("Not indexing memory {}: malformed embedding", rs.getString("id"));
                    continue;
                }
                float[] vector = Vectors.fromBytes(blob);
                index.put(rs.getString("owner_id"), rs.getString("id"), vector);
                count++;
            }
        }
        return count;
    }

    @Override
    public void commit(MemoryCommit commit) {
        Memory memory = commit.memory();
        if (memory.embedding().length != dimensions) {
            throw new IllegalArgumentException("Embedding of memory %s has %d dimensions, expected %d"
                    .formatted(memory.id(), memory.embedding().length, dimensions));
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                insertMemory(conn, memory);
                for (Map.Entry<String, Long> superseded : commit.superseded().entrySet()) {
                    markSuperseded(conn, superseded.getKey(), superseded.getValue());
                }
                for (Relationship relationship : commit.relationships()) {
                    insertRelationship(conn, relationship);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to commit memory {}", memory.id(), e);
            throw new StorageException("Failed to commit memory " + memory.id(), e);
        }

        if (memory.tier() == Tier.HOT) {
            index.put(memory.ownerId(), memory.id(), memory.embedding());
        }
        log.debug("Committed memory {} with {} relationships, {} superseded",
                memory.id(), commit.relationships().size(), commit.superseded().size());
    }

    private void insertMemory(Connection conn, Memory memory) throws SQLException {
        String sql = "INSERT INTO memories (" + MEMORY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, memory.id());
            stmt.setString(2, memory.ownerId());
            stmt.setString(3, memory.content());
            stmt.setBytes(4, Vectors.toBytes(memory.embedding()));
            stmt.setString(5, toJson(memory.keywords()));
            stmt.setString(6, toJson(memory.entities()));
            stmt.setLong(7, memory.createdAt().toEpochMilli());
            stmt.setInt(8, memory.accessCount());
            setInstant(stmt, 9, memory.lastAccessedAt());
            stmt.setInt(10, memory.latest() ? 1 : 0);
            stmt.setString(11, memory.tier().name());
            stmt.setString(12, memory.sourceDocumentId());
            stmt.setInt(13, memory.chunkIndex());
            stmt.setLong(14, memory.version());
            stmt.executeUpdate();
        }
    }

    private void markSuperseded(Connection conn, String memoryId, long expectedVersion) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "UPDATE memories SET is_latest = 0, version = version + 1 WHERE id = ? AND version = ?")) {
            stmt.setString(1, memoryId);
            stmt.setLong(2, expectedVersion);
            if (stmt.executeUpdate() == 0) {
                throw new ConcurrencyConflictException(memoryId, expectedVersion);
            }
        }
    }

    private void insertRelationship(Connection conn, Relationship relationship) throws SQLException {
        try (var stmt = conn.prepareStatement("""
                INSERT OR IGNORE INTO relationships (id, owner_id, from_id, to_id, kind, confidence, reason, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, relationship.id());
            stmt.setString(2, relationship.ownerId());
            stmt.setString(3, relationship.fromId());
            stmt.setString(4, relationship.toId());
            stmt.setString(5, relationship.kind().name());
            stmt.setDouble(6, relationship.confidence());
            stmt.setString(7, relationship.reason());
            stmt.setLong(8, relationship.createdAt().toEpochMilli());
            stmt.executeUpdate();
        }
    }

    @Override
    public Optional<Memory> findById(String memoryId) {
        try (Connection conn = dataSource.getConnection()) {
            return findById(conn, memoryId);
        } catch (SQLException e) {
            throw new StorageException("Failed to read memory " + memoryId, e);
        }
    }

    private Optional<Memory> findById(Connection conn, String memoryId) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT " + MEMORY_COLUMNS + " FROM memories WHERE id = ?")) {
            stmt.setString(1, memoryId);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toMemory(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Memory> findAllById(Collection<String> memoryIds) {
        if (memoryIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = List.copyOf(memoryIds);
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM memories WHERE id IN (" + placeholders(ids.size()) + ")";
        return queryMemories(sql, ids.toArray());
    }

    @Override
    public List<Memory> findByOwner(String ownerId) {
        return queryMemories("SELECT " + MEMORY_COLUMNS + " FROM memories WHERE owner_id = ? ORDER BY created_at",
                ownerId);
    }

    @Override
    public List<Memory> findByDocument(String documentId) {
        return queryMemories("SELECT " + MEMORY_COLUMNS
                + " FROM memories WHERE source_document_id = ? ORDER BY chunk_index", documentId);
    }

    /** Runs a memory query, skipping rows that cannot be decoded. */
    private List<Memory> queryMemories(String sql, Object... params) {
        List<Memory> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    try {
                        results.add(toMemory(rs));
                    } catch (StorageException e) {
                        log.warn("Skipping unreadable memory {}: {}", rs.getString("id"), e.getMessage());
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query memories", e);
        }
        return results;
    }

    @Override
    public List<VectorMatch> nearestHot(String ownerId, float[] query, int limit, double minSimilarity) {
        return index.nearest(ownerId, query, limit, minSimilarity);
    }

    @Override
    public List<VectorMatch> nearestCold(String ownerId, float[] query, int limit, double minSimilarity) {
        var top = new Vectors.TopMatches(limit, minSimilarity);
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(
                     "SELECT id, embedding FROM memories WHERE owner_id = ? AND tier = 'COLD'")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    byte[] blob = rs.getBytes("embedding");
                    if (blob == null || blob.length != dimensions * Float.BYTES) {
                        log.warn("Skipping cold memory {} with malformed embedding", rs.getString("id"));
                        continue;
                    }
                    top.offer(rs.getString("id"), Vectors.cosine(query, Vectors.fromBytes(blob)));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to scan cold tier of " + ownerId, e);
        }
        return top.sorted();
    }

    @Override
    public List<Relationship> findRelationships(String memoryId) {
        return findRelationships(List.of(memoryId)).getOrDefault(memoryId, List.of());
    }

    @Override
    public Map<String, List<Relationship>> findRelationships(Collection<String> memoryIds) {
        if (memoryIds.isEmpty()) {
            return Map.of();
        }
        List<String> ids = List.copyOf(memoryIds);
        String in = placeholders(ids.size());
        String sql = "SELECT * FROM relationships WHERE from_id IN (" + in + ") OR to_id IN (" + in + ")"
                + " ORDER BY created_at";

        Map<String, List<Relationship>> grouped = new LinkedHashMap<>();
        Set<String> wanted = Set.copyOf(ids);
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < ids.size(); i++) {
                stmt.setString(i + 1, ids.get(i));
                stmt.setString(ids.size() + i + 1, ids.get(i));
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Relationship relationship = toRelationship(rs);
                    if (wanted.contains(relationship.fromId())) {
                        grouped.computeIfAbsent(relationship.fromId(), k -> new ArrayList<>()).add(relationship);
                    }
                    if (wanted.contains(relationship.toId())) {
                        grouped.computeIfAbsent(relationship.toId(), k -> new ArrayList<>()).add(relationship);
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read relationships", e);
        }
        return grouped;
    }

    @Override
    public List<Relationship> findRelationshipsByOwner(String ownerId) {
        List<Relationship> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("SELECT * FROM relationships WHERE owner_id = ? ORDER BY created_at")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toRelationship(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read relationships of " + ownerId, e);
        }
        return results;
    }

    @Override
    public Optional<Memory> recordAccess(String memoryId, Instant accessedAt) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<Memory> updated;
                try (var stmt = conn.prepareStatement(
                        "UPDATE memories SET access_count = access_count + 1, last_accessed_at = ? WHERE id = ?")) {
                    stmt.setLong(1, accessedAt.toEpochMilli());
                    stmt.setString(2, memoryId);
                    updated = stmt.executeUpdate() == 0 ? Optional.empty() : findById(conn, memoryId);
                }
                conn.commit();
                return updated;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to record access of " + memoryId, e);
        }
    }

    @Override
    public boolean updateTier(String memoryId, Tier tier) {
        return moveTier(memoryId, tier, "UPDATE memories SET tier = ? WHERE id = ? AND tier <> ?", stmt -> {
        });
    }

    @Override
    public boolean demoteIfStale(String memoryId, Instant createdBefore, int accessThreshold) {
        return moveTier(memoryId, Tier.COLD, """
                UPDATE memories SET tier = ?
                WHERE id = ? AND tier <> ? AND created_at < ? AND access_count < ?
                """, stmt -> {
            stmt.setLong(4, createdBefore.toEpochMilli());
            stmt.setInt(5, accessThreshold);
        });
    }

    private boolean moveTier(String memoryId, Tier tier, String sql, StatementBinder extraParameters) {
        synchronized (tierLocks[Math.floorMod(memoryId.hashCode(), tierLocks.length)]) {
            String ownerId;
            float[] vector;
            try (Connection conn = dataSource.getConnection()) {
                try (var select = conn.prepareStatement("SELECT owner_id, embedding FROM memories WHERE id = ?")) {
                    select.setString(1, memoryId);
                    try (var rs = select.executeQuery()) {
                        if (!rs.next()) {
                            return false;
                        }
                        ownerId = rs.getString("owner_id");
                        vector = Vectors.fromBytes(rs.getBytes("embedding"));
                    }
                }
                try (var update = conn.prepareStatement(sql)) {
                    update.setString(1, tier.name());
                    update.setString(2, memoryId);
                    update.setString(3, tier.name());
                    extraParameters.bind(update);
                    if (update.executeUpdate() == 0) {
                        return false;
                    }
                }
            } catch (SQLException e) {
                throw new StorageException("Failed to move memory %s to %s".formatted(memoryId, tier), e);
            }

            if (tier == Tier.HOT) {
                index.put(ownerId, memoryId, vector);
            } else {
                index.remove(ownerId, memoryId);
            }
            return true;
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @Override
    public List<TierSnapshot> tierSnapshots(String ownerId) {
        List<TierSnapshot> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(
                     "SELECT id, owner_id, created_at, access_count, tier FROM memories WHERE owner_id = ?")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new TierSnapshot(
                            rs.getString("id"),
                            rs.getString("owner_id"),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            rs.getInt("access_count"),
                            Tier.fromString(rs.getString("tier"))));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read tiers of " + ownerId, e);
        }
        return results;
    }

    @Override
    public List<String> listOwners() {
        List<String> owners = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT DISTINCT owner_id FROM memories ORDER BY owner_id")) {
            while (rs.next()) {
                owners.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list owners", e);
        }
        return owners;
    }

    @Override
    public int countMemories(String ownerId) {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("SELECT COUNT(*) FROM memories WHERE owner_id = ?")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count memories of " + ownerId, e);
        }
    }

    @Override
    public Map<Tier, Long> countByTier(String ownerId) {
        Map<Tier, Long> counts = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            counts.put(tier, 0L);
        }
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(
                     "SELECT tier, COUNT(*) FROM memories WHERE owner_id = ? GROUP BY tier")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(Tier.fromString(rs.getString(1)), rs.getLong(2));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count tiers of " + ownerId, e);
        }
        return counts;
    }

    @Override
    public Map<RelationshipKind, Long> countRelationshipsByKind(String ownerId) {
        Map<RelationshipKind, Long> counts = new EnumMap<>(RelationshipKind.class);
        for (RelationshipKind kind : RelationshipKind.values()) {
            counts.put(kind, 0L);
        }
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(
                     "SELECT kind, COUNT(*) FROM relationships WHERE owner_id = ? GROUP BY kind")) {
            stmt.setString(1, ownerId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(RelationshipKind.fromString(rs.getString(1)), rs.getLong(2));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count relationships of " + ownerId, e);
        }
        return counts;
    }

    @Override
    public int deleteOwner(String ownerId) {
        int deleted;
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (var stmt = conn.prepareStatement("DELETE FROM relationships WHERE owner_id = ?")) {
                    stmt.setString(1, ownerId);
                    stmt.executeUpdate();
                }
                try (var stmt = conn.prepareStatement("DELETE FROM memories WHERE owner_id = ?")) {
                    stmt.setString(1, ownerId);
                    deleted = stmt.executeUpdate();
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to delete memories of " + ownerId, e);
        }
        index.dropOwner(ownerId);
        log.info("Deleted {} memories of owner {}", deleted, ownerId);
        return deleted;
    }

    private Memory toMemory(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        float[] embedding;
        List<String> keywords;
        Map<EntityCategory, Set<String>> entities;
        try {
            embedding = Vectors.fromBytes(rs.getBytes("embedding"));
            keywords = objectMapper.readValue(rs.getString("keywords"), KEYWORDS_TYPE);
            entities = objectMapper.readValue(rs.getString("entities"), ENTITIES_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Unreadable memory " + id, e);
        }
        if (embedding.length != dimensions) {
            throw new StorageException("Memory %s has %d dimensions, expected %d"
                    .formatted(id, embedding.length, dimensions));
        }

        long lastAccessed = rs.getLong("last_accessed_at");
        Instant lastAccessedAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastAccessed);

        return new Memory(
                id,
                rs.getString("owner_id"),
                rs.getString("content"),
                embedding,
                keywords,
                entities == null ? Map.of() : Collections.unmodifiableMap(entities),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                rs.getInt("access_count"),
                lastAccessedAt,
                rs.getInt("is_latest") == 1,
                Tier.fromString(rs.getString("tier")),
                rs.getString("source_document_id"),
                rs.getInt("chunk_index"),
                rs.getLong("version")
        );
    }

    private Relationship toRelationship(ResultSet rs) throws SQLException {
        return new Relationship(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("from_id"),
                rs.getString("to_id"),
                RelationshipKind.fromString(rs.getString("kind")),
                rs.getDouble("confidence"),
                rs.getString("reason"),
                Instant.ofEpochMilli(rs.getLong("created_at"))
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize memory field", e);
        }
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, instant.toEpochMilli());
        }
    }

    private static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }
}
