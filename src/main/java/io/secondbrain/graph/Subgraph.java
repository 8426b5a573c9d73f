package io.secondbrain.graph;

import io.secondbrain.memory.Memory;
import io.secondbrain.memory.Relationship;

import java.util.List;
import java.util.Map;

/**
 * Memories reachable from a root within a depth bound.
 *
 * @param depths hop distance of each memory from the root, the root at 0
 */
public record Subgraph(String rootId, List<Memory> nodes, List<Relationship> edges, Map<String, Integer> depths) {
}
