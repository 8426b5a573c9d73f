package io.secondbrain.memory;

/** A memory id with its cosine similarity to a query vector. */
public record VectorMatch(String memoryId, double similarity) {
}
