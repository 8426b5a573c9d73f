package io.secondbrain.classify;

/**
 * Measurements comparing a new memory with one candidate.
 *
 * @param similarity     cosine similarity of the embeddings
 * @param keywordOverlap Jaccard overlap of the keyword sets
 * @param sharedKeywords size of the keyword intersection
 * @param contradiction  whether the new text appears to supersede the candidate
 */
public record RelationshipSignals(double similarity, double keywordOverlap, int sharedKeywords, boolean contradiction) {
}
