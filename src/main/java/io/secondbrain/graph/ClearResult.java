package io.secondbrain.graph;

/** What {@code clearAll} removed. */
public record ClearResult(int memories, long relationships, int documents) {
}
