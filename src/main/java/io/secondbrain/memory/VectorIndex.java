package io.secondbrain.memory;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory vector index of the hot tier, partitioned by owner.
 *
 * <p>Holds only references to vectors the store already persists; adding or removing an entry
 * changes index membership, never the data. Search is an exact cosine scan of the owner's partition,
 * so readers never wait on writers of another owner.</p>
 *
 * <p>Thread-safe implementation using {@link ConcurrentHashMap}.</p>
 */
@Component
public class VectorIndex {

    private final ConcurrentMap<String, ConcurrentMap<String, float[]>> partitions = new ConcurrentHashMap<>();

    public void put(String ownerId, String memoryId, float[] vector) {
        partitions.computeIfAbsent(ownerId, k -> new ConcurrentHashMap<>()).put(memoryId, vector);
    }

    public void remove(String ownerId, String memoryId) {
        Map<String, float[]> partition = partitions.get(ownerId);
        if (partition != null) {
            partition.remove(memoryId);
        }
    }

    public boolean contains(String ownerId, String memoryId) {
        Map<String, float[]> partition = partitions.get(ownerId);
        return partition != null && partition.containsKey(memoryId);
    }

    public int size(String ownerId) {
        Map<String, float[]> partition = partitions.get(ownerId);
        return partition == null ? 0 : partition.size();
    }

    public void dropOwner(String ownerId) {
        partitions.remove(ownerId);
    }

    /**
     * Returns up to {@code limit} hot memories of the owner with similarity at or above the floor,
     * most similar first.
     */
    public List<VectorMatch> nearest(String ownerId, float[] query, int limit, double minSimilarity) {
        Map<String, float[]> partition = partitions.get(ownerId);
        if (partition == null || partition.isEmpty()) {
            return List.of();
        }
        var top = new Vectors.TopMatches(limit, minSimilarity);
        partition.forEach((memoryId, vector) -> top.offer(memoryId, Vectors.cosine(query, vector)));
        return top.sorted();
    }
}
