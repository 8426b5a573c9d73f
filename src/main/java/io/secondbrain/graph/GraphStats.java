package io.secondbrain.graph;

import io.secondbrain.memory.RelationshipKind;

import java.util.Map;

public record GraphStats(
        long totalMemories,
        long totalRelationships,
        Map<RelationshipKind, Long> relationshipTypeCounts,
        long hotMemories,
        long coldMemories
) {
}
