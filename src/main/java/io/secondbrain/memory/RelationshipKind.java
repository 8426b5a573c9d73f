package io.secondbrain.memory;

/**
 * Kinds of directed edges between memories. The edge always points from the newer memory to the older one.
 *
 * <ul>
 *   <li>{@code UPDATES}: the newer memory supersedes the older; the older is no longer latest.</li>
 *   <li>{@code EXTENDS}: the newer memory adds detail to the older.</li>
 *   <li>{@code DERIVES}: the newer memory shares enough keywords to be built on the older.</li>
 *   <li>{@code SIMILAR}: loosely related.</li>
 * </ul>
 */
public enum RelationshipKind {
    UPDATES,
    EXTENDS,
    DERIVES,
    SIMILAR;

    /** Parses a kind name case-insensitively; unknown names are rejected. */
    public static RelationshipKind fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Relationship kind is required");
        }
        return switch (s.trim().toLowerCase()) {
            case "updates" -> UPDATES;
            case "extends" -> EXTENDS;
            case "derives" -> DERIVES;
            case "similar" -> SIMILAR;
            default -> throw new IllegalArgumentException("Unknown relationship kind: " + s);
        };
    }
}
