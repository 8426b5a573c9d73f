package io.secondbrain.memory;

import java.util.List;
import java.util.Map;

/**
 * Everything written atomically when a memory is indexed.
 *
 * @param memory        the new memory
 * @param relationships edges from the new memory
 * @param superseded    memories to mark no longer latest, keyed by id, with the version they were read at
 */
public record MemoryCommit(Memory memory, List<Relationship> relationships, Map<String, Long> superseded) {

    public MemoryCommit {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        superseded = superseded == null ? Map.of() : Map.copyOf(superseded);
    }

    public static MemoryCommit of(Memory memory) {
        return new MemoryCommit(memory, List.of(), Map.of());
    }
}
