package io.secondbrain.memory;

import java.time.Instant;

/** The fields the tier policy reads, without loading content or embedding. */
public record TierSnapshot(String memoryId, String ownerId, Instant createdAt, int accessCount, Tier tier) {
}
