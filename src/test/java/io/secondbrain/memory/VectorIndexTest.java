package io.secondbrain.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorIndexTest {

    private final VectorIndex index = new VectorIndex();

    @Test
    void shouldReturnNearestMostSimilarFirst() {
        index.put("alice", "a", new float[]{1f, 0f, 0f});
        index.put("alice", "b", new float[]{0.6f, 0.8f, 0f});
        index.put("alice", "c", new float[]{0f, 0f, 1f});

        List<VectorMatch> matches = index.nearest("alice", new float[]{1f, 0f, 0f}, 2, 0.0);

        assertEquals(2, matches.size());
        assertEquals("a", matches.get(0).memoryId());
        assertEquals(1.0, matches.get(0).similarity(), 1e-6);
        assertEquals("b", matches.get(1).memoryId());
        assertEquals(0.6, matches.get(1).similarity(), 1e-6);
    }

    @Test
    void shouldApplySimilarityFloor() {
        index.put("alice", "a", new float[]{1f, 0f});
        index.put("alice", "b", new float[]{0f, 1f});

        List<VectorMatch> matches = index.nearest("alice", new float[]{1f, 0f}, 10, 0.3);

        assertEquals(List.of("a"), matches.stream().map(VectorMatch::memoryId).toList());
    }

    @Test
    void shouldKeepOwnersApart() {
        index.put("alice", "a", new float[]{1f, 0f});
        index.put("bob", "b", new float[]{1f, 0f});

        assertEquals(1, index.nearest("alice", new float[]{1f, 0f}, 10, 0.0).size());
        assertTrue(index.nearest("carol", new float[]{1f, 0f}, 10, 0.0).isEmpty());

        index.dropOwner("alice");
        assertEquals(0, index.size("alice"));
        assertEquals(1, index.size("bob"));
    }

    @Test
    void shouldRemoveEntries() {
        index.put("alice", "a", new float[]{1f, 0f});
        index.remove("alice", "a");
        index.remove("nobody", "a");

        assertFalse(index.contains("alice", "a"));
        assertTrue(index.nearest("alice", new float[]{1f, 0f}, 10, 0.0).isEmpty());
    }

    @Test
    void shouldComputeCosineSimilarity() {
        assertEquals(1.0, Vectors.cosine(new float[]{2f, 0f}, new float[]{5f, 0f}), 1e-9);
        assertEquals(0.0, Vectors.cosine(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-9);
        assertEquals(-1.0, Vectors.cosine(new float[]{1f, 0f}, new float[]{-1f, 0f}), 1e-9);
        assertEquals(0.0, Vectors.cosine(new float[]{0f, 0f}, new float[]{1f, 0f}));
        assertEquals(0.0, Vectors.cosine(new float[]{1f}, new float[]{1f, 0f}));
    }

    @Test
    void shouldEncodeEmbeddingAsLittleEndianFloats() {
        byte[] bytes = Vectors.toBytes(new float[]{1.0f});

        assertArrayEquals(new byte[]{0, 0, (byte) 0x80, 0x3f}, bytes);
        assertThrows(IllegalArgumentException.class, () -> Vectors.fromBytes(new byte[]{1, 2, 3}));
    }
}
