package io.secondbrain.memory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/** Vector math and the BLOB encoding used to persist embeddings. */
public final class Vectors {

    private Vectors() {
    }

    /** Cosine similarity; 0 when either vector has zero length or dimensions differ. */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) return 0.0;
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }

    public static float[] fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Malformed embedding blob");
        }
        float[] vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
        return vector;
    }

    /** Bounded collector that keeps the {@code limit} most similar matches at or above a floor. */
    static final class TopMatches {

        private final int limit;
        private final double minSimilarity;
        private final PriorityQueue<VectorMatch> heap =
                new PriorityQueue<>(Comparator.comparingDouble(VectorMatch::similarity));

        TopMatches(int limit, double minSimilarity) {
            this.limit = limit;
            this.minSimilarity = minSimilarity;
        }

        void offer(String memoryId, double similarity) {
            if (limit <= 0 || similarity < minSimilarity) return;
            if (heap.size() < limit) {
                heap.add(new VectorMatch(memoryId, similarity));
            } else if (heap.peek().similarity() < similarity) {
                heap.poll();
                heap.add(new VectorMatch(memoryId, similarity));
            }
        }

        /** Matches, most similar first. */
        List<VectorMatch> sorted() {
            List<VectorMatch> matches = new ArrayList<>(heap);
            matches.sort(Comparator.comparingDouble(VectorMatch::similarity).reversed());
            return matches;
        }
    }
}
