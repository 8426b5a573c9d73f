package io.secondbrain.memory;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A stored, embedded, searchable unit of text.
 * Content, embedding, keywords and entities never change; access counters, tier and the latest flag do.
 *
 * @param embedding copied on the way in and out; equality compares its values
 * @param version   optimistic version of the {@code latest} flag, bumped whenever it is rewritten
 */
public record Memory(
        String id,
        String ownerId,
        String content,
        float[] embedding,
        List<String> keywords,
        Map<EntityCategory, Set<String>> entities,
        Instant createdAt,
        int accessCount,
        Instant lastAccessedAt,
        boolean latest,
        Tier tier,
        String sourceDocumentId,
        int chunkIndex,
        long version
) {

    public Memory {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Memory id is required");
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("Memory owner is required");
        if (content == null) throw new IllegalArgumentException("Memory content is required");
        if (embedding == null) throw new IllegalArgumentException("Memory embedding is required");
        embedding = embedding.clone();
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        entities = entities == null ? Map.of() : Map.copyOf(entities);
        if (tier == null) tier = Tier.HOT;
    }

    /** A freshly ingested memory: hot, latest, never accessed. */
    public static Memory create(String ownerId, String content, float[] embedding, List<String> keywords,
                                Map<EntityCategory, Set<String>> entities, Instant createdAt,
                                String sourceDocumentId, int chunkIndex) {
        return new Memory(UUID.randomUUID().toString(), ownerId, content, embedding, keywords, entities,
                createdAt, 0, null, true, Tier.HOT, sourceDocumentId, chunkIndex, 0);
    }

    public Memory withTier(Tier tier) {
        return new Memory(id, ownerId, content, embedding, keywords, entities, createdAt, accessCount,
                lastAccessedAt, latest, tier, sourceDocumentId, chunkIndex, version);
    }

    public Memory withAccess(int accessCount, Instant lastAccessedAt) {
        return new Memory(id, ownerId, content, embedding, keywords, entities, createdAt, accessCount,
                lastAccessedAt, latest, tier, sourceDocumentId, chunkIndex, version);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Memory other)) return false;
        return accessCount == other.accessCount
                && latest == other.latest
                && chunkIndex == other.chunkIndex
                && version == other.version
                && id.equals(other.id)
                && ownerId.equals(other.ownerId)
                && content.equals(other.content)
                && Arrays.equals(embedding, other.embedding)
                && keywords.equals(other.keywords)
                && entities.equals(other.entities)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(lastAccessedAt, other.lastAccessedAt)
                && tier == other.tier
                && Objects.equals(sourceDocumentId, other.sourceDocumentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ownerId, content, Arrays.hashCode(embedding), keywords, entities, createdAt,
                accessCount, lastAccessedAt, latest, tier, sourceDocumentId, chunkIndex, version);
    }

    @Override
    public String toString() {
        return "Memory[id=%s, ownerId=%s, tier=%s, latest=%s, dimensions=%d]"
                .formatted(id, ownerId, tier, latest, embedding.length);
    }

    /** Values of all entity categories, flattened. */
    public Set<String> entityValues() {
        return entities.values().stream()
                .flatMap(Set::stream)
                .collect(java.util.stream.Collectors.toUnmodifiableSet());
    }

    public boolean hasEntityIn(Set<EntityCategory> categories) {
        return categories.stream().anyMatch(c -> !entities.getOrDefault(c, Set.of()).isEmpty());
    }
}
