package io.secondbrain.graph;

import io.secondbrain.memory.RelationshipKind;
import io.secondbrain.memory.Tier;

import java.time.Instant;
import java.util.List;

/** An owner's whole graph, shaped for visualization. */
public record GraphExport(List<Node> nodes, List<Edge> edges, GraphStats stats) {

    /** @param label content shortened for display */
    public record Node(String id, String label, boolean latest, Tier tier, Instant createdAt, String content) {
    }

    public record Edge(String id, String source, String target, RelationshipKind kind, double confidence, String reason) {
    }
}
