package io.secondbrain.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.secondbrain.ingest.Document;
import io.secondbrain.ingest.SQLiteDocumentStore;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryCommit;
import io.secondbrain.memory.NotFoundException;
import io.secondbrain.memory.Relationship;
import io.secondbrain.memory.RelationshipKind;
import io.secondbrain.memory.SQLiteMemoryStore;
import io.secondbrain.memory.Tier;
import io.secondbrain.memory.VectorIndex;
import io.secondbrain.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.secondbrain.testsupport.FakeEmbeddingProvider.axis;
import static io.secondbrain.testsupport.TestFixtures.DIMENSIONS;
import static io.secondbrain.testsupport.TestFixtures.OWNER;
import static org.junit.jupiter.api.Assertions.*;

class MemoryGraphServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private SQLiteMemoryStore memoryStore;
    private SQLiteDocumentStore documentStore;
    private MemoryGraphService graph;

    private Memory a;
    private Memory b;
    private Memory c;
    private Memory d;

    @BeforeEach
    void setUp() {
        var dataSource = TestFixtures.dataSource(tempDir);
        memoryStore = new SQLiteMemoryStore(dataSource, new VectorIndex(), new ObjectMapper(),
                TestFixtures.properties());
        memoryStore.init();
        documentStore = new SQLiteDocumentStore(dataSource, new ObjectMapper());
        documentStore.init();
        graph = new MemoryGraphService(memoryStore, documentStore);

        // a <-UPDATES- b <-EXTENDS- c <-SIMILAR- d
        a = commit("A: first fact", 0, List.of(), Map.of());
        b = memory("B: changed fact", 1);
        memoryStore.commit(new MemoryCommit(b, List.of(edge(b, a, RelationshipKind.UPDATES)), Map.of(a.id(), 0L)));
        c = commit("C: more detail", 2, List.of(RelationshipKind.EXTENDS), Map.of());
        d = commit("D: loosely related", 3, List.of(RelationshipKind.SIMILAR), Map.of());
    }

    private Memory memory(String content, int index) {
        return Memory.create(OWNER, content, axis(DIMENSIONS, index), List.of(), Map.of(),
                NOW.plus(Duration.ofHours(index)), "doc-" + index, 0);
    }

    /** Commits a memory linked to the previously committed one by each given kind. */
    private Memory commit(String content, int index, List<RelationshipKind> kinds, Map<String, Long> superseded) {
        Memory memory = memory(content, index);
        Memory previous = switch (index) {
            case 2 -> b;
            case 3 -> c;
            default -> null;
        };
        List<Relationship> edges = kinds.stream().map(k -> edge(memory, previous, k)).toList();
        memoryStore.commit(new MemoryCommit(memory, edges, superseded));
        return memory;
    }

    private static Relationship edge(Memory from, Memory to, RelationshipKind kind) {
        return Relationship.create(OWNER, from.id(), to.id(), kind, 0.75, kind.name().toLowerCase(), NOW);
    }

    @Test
    void shouldReturnDirectNeighborsAtDepthOne() {
        Subgraph subgraph = graph.getRelated(b.id(), 1);

        assertEquals(b.id(), subgraph.rootId());
        assertEquals(List.of(b.id(), a.id(), c.id()), subgraph.nodes().stream().map(Memory::id).toList());
        assertEquals(2, subgraph.edges().size());
        assertEquals(Map.of(b.id(), 0, a.id(), 1, c.id(), 1), subgraph.depths());
    }

    @Test
    void shouldTraverseBothDirectionsUpToDepth() {
        Subgraph subgraph = graph.getRelated(a.id(), 3);

        assertEquals(4, subgraph.nodes().size());
        assertEquals(3, subgraph.edges().size());
        assertEquals(3, subgraph.depths().get(d.id()));
    }

    @Test
    void shouldFollowOnlyRequestedKinds() {
        Subgraph subgraph = graph.getRelated(c.id(), 5, Set.of(RelationshipKind.EXTENDS));

        assertEquals(Set.of(c.id(), b.id()), subgraph.depths().keySet());
        assertEquals(RelationshipKind.EXTENDS, subgraph.edges().get(0).kind());
    }

    @Test
    void shouldRejectDepthOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> graph.getRelated(a.id(), 0));
        assertThrows(IllegalArgumentException.class, () -> graph.getRelated(a.id(), 6));
    }

    @Test
    void shouldThrowNotFoundForUnknownMemory() {
        assertThrows(NotFoundException.class, () -> graph.getRelated("missing", 2));
        assertThrows(NotFoundException.class, () -> graph.getMemory("missing"));
    }

    @Test
    void shouldReturnMemoryWithoutCountingAccess() {
        Memory loaded = graph.getMemory(a.id());

        assertEquals("A: first fact", loaded.content());
        assertFalse(loaded.latest());
        assertEquals(0, memoryStore.findById(a.id()).orElseThrow().accessCount());
    }

    @Test
    void shouldExportWholeGraphWithStats() {
        memoryStore.updateTier(d.id(), Tier.COLD);

        GraphExport export = graph.exportGraph(OWNER);

        assertEquals(4, export.nodes().size());
        assertEquals(3, export.edges().size());
        GraphExport.Edge update = export.edges().stream()
                .filter(e -> e.kind() == RelationshipKind.UPDATES).findFirst().orElseThrow();
        assertEquals(b.id(), update.source());
        assertEquals(a.id(), update.target());
        assertEquals(4, export.stats().totalMemories());
        assertEquals(3, export.stats().totalRelationships());
        assertEquals(1L, export.stats().relationshipTypeCounts().get(RelationshipKind.UPDATES));
        assertEquals(0L, export.stats().relationshipTypeCounts().get(RelationshipKind.DERIVES));
        assertEquals(3, export.stats().hotMemories());
        assertEquals(1, export.stats().coldMemories());
    }

    @Test
    void shouldShortenLongLabels() {
        assertEquals("short", MemoryGraphService.label("short"));
        String label = MemoryGraphService.label("x".repeat(150));
        assertEquals(103, label.length());
        assertTrue(label.endsWith("..."));
    }

    @Test
    void shouldClearEverythingOfOwner() {
        documentStore.save(Document.queued(OWNER, null, "Some content here", NOW));
        Memory other = Memory.create("bob", "Bob's fact", axis(DIMENSIONS, 4), List.of(), Map.of(), NOW, "doc-b", 0);
        memoryStore.commit(MemoryCommit.of(other));

        ClearResult result = graph.clearAll(OWNER);

        assertEquals(new ClearResult(4, 3, 1), result);
        assertEquals(0, graph.graphStats(OWNER).totalMemories());
        assertEquals(1, graph.graphStats("bob").totalMemories());
        assertThrows(IllegalArgumentException.class, () -> graph.clearAll(" "));
    }
}
