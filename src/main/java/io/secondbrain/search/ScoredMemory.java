package io.secondbrain.search;

import io.secondbrain.memory.EntityCategory;
import io.secondbrain.memory.Memory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A search hit.
 *
 * @param score          final score after time decay
 * @param similarity     raw cosine similarity
 * @param keywordScore   keyword match score in [0,1]
 * @param decay          time decay factor applied
 * @param explanation    why the memory matched
 * @param relatedIds     up to five directly related memories
 */
public record ScoredMemory(
        Memory memory,
        double score,
        double similarity,
        double keywordScore,
        double decay,
        String explanation,
        List<String> relatedIds
) {

    public String memoryId() {
        return memory.id();
    }

    public String content() {
        return memory.content();
    }

    public Map<EntityCategory, Set<String>> entities() {
        return memory.entities();
    }

    public Instant createdAt() {
        return memory.createdAt();
    }
}
