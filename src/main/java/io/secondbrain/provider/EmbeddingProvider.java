package io.secondbrain.provider;

/**
 * Maps text to a fixed-length dense vector.
 * Deterministic for identical input.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single text.
     *
     * @throws EmbeddingUnavailableException on provider error
     */
    float[] embed(String text);
}
