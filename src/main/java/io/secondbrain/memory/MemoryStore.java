package io.secondbrain.memory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable collection of memories and relationships, indexed by vector similarity and by owner.
 * Implementations own every memory and relationship record.
 */
public interface MemoryStore {

    /**
     * Atomically persists a new memory, its outgoing edges and the supersession of older memories.
     * The memory becomes visible to searches only after everything is committed.
     *
     * @throws ConcurrencyConflictException if a superseded memory changed since it was read
     * @throws StorageException             if the store is unavailable; nothing is written
     */
    void commit(MemoryCommit commit);

    /** Retrieves a memory by id. */
    Optional<Memory> findById(String memoryId);

    /** Retrieves memories by id in no particular order, skipping ids that are unknown or unreadable. */
    List<Memory> findAllById(Collection<String> memoryIds);

    /** All memories of an owner, oldest first. */
    List<Memory> findByOwner(String ownerId);

    /** Memories produced from one document, in chunk order. */
    List<Memory> findByDocument(String documentId);

    /** Nearest hot-tier memories of the owner. */
    List<VectorMatch> nearestHot(String ownerId, float[] query, int limit, double minSimilarity);

    /** Nearest cold-tier memories of the owner, scanned from disk. */
    List<VectorMatch> nearestCold(String ownerId, float[] query, int limit, double minSimilarity);

    /** Edges touching the memory in either direction. */
    List<Relationship> findRelationships(String memoryId);

    /** Edges touching any of the memories, grouped by memory id. */
    Map<String, List<Relationship>> findRelationships(Collection<String> memoryIds);

    List<Relationship> findRelationshipsByOwner(String ownerId);

    /**
     * Atomically increments the access count and stamps the access time.
     *
     * @return the memory after the update, empty if unknown
     */
    Optional<Memory> recordAccess(String memoryId, Instant accessedAt);

    /**
     * Moves a memory to a tier, changing only its index membership.
     *
     * @return true if the tier changed
     */
    boolean updateTier(String memoryId, Tier tier);

    /**
     * Moves a memory to the cold tier only if, at the time of the write, it is still older than
     * {@code createdBefore} and has fewer than {@code accessThreshold} accesses.
     *
     * @return true if the memory was demoted
     */
    boolean demoteIfStale(String memoryId, Instant createdBefore, int accessThreshold);

    List<TierSnapshot> tierSnapshots(String ownerId);

    List<String> listOwners();

    int countMemories(String ownerId);

    Map<Tier, Long> countByTier(String ownerId);

    Map<RelationshipKind, Long> countRelationshipsByKind(String ownerId);

    /**
     * Deletes every memory and relationship of the owner. Irreversible.
     *
     * @return number of memories deleted
     */
    int deleteOwner(String ownerId);
}
