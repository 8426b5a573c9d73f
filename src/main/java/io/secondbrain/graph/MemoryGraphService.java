package io.secondbrain.graph;

import io.secondbrain.ingest.DocumentStore;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.memory.NotFoundException;
import io.secondbrain.memory.Relationship;
import io.secondbrain.memory.RelationshipKind;
import io.secondbrain.memory.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read and maintenance operations over an owner's memory graph.
 */
@Service
public class MemoryGraphService {

    private static final Logger log = LoggerFactory.getLogger(MemoryGraphService.class);
    static final int MAX_DEPTH = 5;
    static final int LABEL_LENGTH = 100;

    private final MemoryStore memoryStore;
    private final DocumentStore documentStore;

    public MemoryGraphService(MemoryStore memoryStore, DocumentStore documentStore) {
        this.memoryStore = memoryStore;
        this.documentStore = documentStore;
    }

    /**
     * @throws NotFoundException if the memory is unknown
     */
    public Memory getMemory(String memoryId) {
        return memoryStore.findById(memoryId)
                .orElseThrow(() -> new NotFoundException("Memory", memoryId));
    }

    public Subgraph getRelated(String memoryId, int maxDepth) {
        return getRelated(memoryId, maxDepth, Set.of());
    }

    /**
     * Breadth-first traversal over edges in both directions.
     *
     * @param kinds edge kinds to follow, all kinds when empty
     * @throws NotFoundException        if the root memory is unknown
     * @throws IllegalArgumentException if the depth is outside 1..5
     */
    public Subgraph getRelated(String memoryId, int maxDepth, Set<RelationshipKind> kinds) {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH) {
            throw new IllegalArgumentException("Depth must be between 1 and " + MAX_DEPTH);
        }
        Memory root = getMemory(memoryId);

        Map<String, Integer> depths = new LinkedHashMap<>();
        Map<String, Relationship> edges = new LinkedHashMap<>();
        depths.put(root.id(), 0);
        List<String> frontier = List.of(root.id());

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();
            for (Map.Entry<String, List<Relationship>> entry : memoryStore.findRelationships(frontier).entrySet()) {
                for (Relationship relationship : entry.getValue()) {
                    if (!kinds.isEmpty() && !kinds.contains(relationship.kind())) {
                        continue;
                    }
                    edges.putIfAbsent(relationship.id(), relationship);
                    String neighbor = relationship.otherEnd(entry.getKey());
                    if (!depths.containsKey(neighbor)) {
                        depths.put(neighbor, depth);
                        next.add(neighbor);
                    }
                }
            }
            frontier = next;
        }

        List<Memory> nodes = new ArrayList<>(memoryStore.findAllById(depths.keySet()));
        nodes.sort(Comparator.comparing((Memory m) -> depths.get(m.id())).thenComparing(Memory::createdAt));
        return new Subgraph(root.id(), nodes, List.copyOf(edges.values()), depths);
    }

    public GraphExport exportGraph(String ownerId) {
        List<GraphExport.Node> nodes = memoryStore.findByOwner(ownerId).stream()
                .map(m -> new GraphExport.Node(m.id(), label(m.content()), m.latest(), m.tier(), m.createdAt(),
                        m.content()))
                .toList();
        List<GraphExport.Edge> edges = memoryStore.findRelationshipsByOwner(ownerId).stream()
                .map(r -> new GraphExport.Edge(r.id(), r.fromId(), r.toId(), r.kind(), r.confidence(), r.reason()))
                .toList();
        return new GraphExport(nodes, edges, graphStats(ownerId));
    }

    public GraphStats graphStats(String ownerId) {
        Map<RelationshipKind, Long> byKind = memoryStore.countRelationshipsByKind(ownerId);
        Map<Tier, Long> byTier = memoryStore.countByTier(ownerId);
        long relationships = byKind.values().stream().mapToLong(Long::longValue).sum();
        return new GraphStats(
                memoryStore.countMemories(ownerId),
                relationships,
                byKind,
                byTier.getOrDefault(Tier.HOT, 0L),
                byTier.getOrDefault(Tier.COLD, 0L));
    }

    /**
     * Removes every memory, relationship and document of the owner. Irreversible.
     */
    public ClearResult clearAll(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        long relationships = memoryStore.countRelationshipsByKind(ownerId).values().stream()
                .mapToLong(Long::longValue).sum();
        int memories = memoryStore.deleteOwner(ownerId);
        int documents = documentStore.deleteOwner(ownerId);
        log.warn("Cleared all data of owner {}: {} memories, {} relationships, {} documents",
                ownerId, memories, relationships, documents);
        return new ClearResult(memories, relationships, documents);
    }

    static String label(String content) {
        return content.length() <= LABEL_LENGTH ? content : content.substring(0, LABEL_LENGTH) + "...";
    }
}
