package io.secondbrain.memory;

import java.time.Instant;
import java.util.UUID;

/**
 * A directed, typed, confidence-scored edge between two memories of the same owner.
 * {@code fromId} is the newer memory, {@code toId} the older one.
 */
public record Relationship(
        String id,
        String ownerId,
        String fromId,
        String toId,
        RelationshipKind kind,
        double confidence,
        String reason,
        Instant createdAt
) {

    public Relationship {
        if (fromId == null || toId == null) throw new IllegalArgumentException("Relationship endpoints are required");
        if (fromId.equals(toId)) throw new IllegalArgumentException("A memory cannot relate to itself: " + fromId);
        if (kind == null) throw new IllegalArgumentException("Relationship kind is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
        }
        if (reason == null) reason = "";
    }

    public static Relationship create(String ownerId, String fromId, String toId, RelationshipKind kind,
                                      double confidence, String reason, Instant createdAt) {
        return new Relationship(UUID.randomUUID().toString(), ownerId, fromId, toId, kind,
                Math.min(1.0, Math.max(0.0, confidence)), reason, createdAt);
    }

    /** The endpoint opposite to {@code memoryId}. */
    public String otherEnd(String memoryId) {
        return fromId.equals(memoryId) ? toId : fromId;
    }
}
