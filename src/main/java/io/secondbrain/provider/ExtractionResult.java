package io.secondbrain.provider;

import io.secondbrain.memory.EntityCategory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entities and keywords found in a text.
 *
 * @param keywords most relevant first
 */
public record ExtractionResult(Map<EntityCategory, Set<String>> entities, List<String> keywords) {

    public ExtractionResult {
        entities = entities == null ? Map.of() : Map.copyOf(entities);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(Map.of(), List.of());
    }
}
