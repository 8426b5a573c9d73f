package io.secondbrain.classify;

import io.secondbrain.memory.RelationshipKind;

/** The edge a rule decided on, before it is attached to concrete memories. */
public record RelationshipDecision(RelationshipKind kind, double confidence, String reason) {
}
