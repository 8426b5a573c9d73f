package io.secondbrain.provider;

/**
 * Extracts named entities by category and a ranked keyword list from text.
 * Best-effort: an empty result is valid.
 */
public interface EntityExtractor {

    /**
     * @throws ExtractionUnavailableException on provider error
     */
    ExtractionResult extract(String text);
}
