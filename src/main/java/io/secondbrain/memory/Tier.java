package io.secondbrain.memory;

/**
 * Index membership of a memory.
 *
 * <ul>
 *   <li>{@code HOT}: recent or frequently accessed; held in the in-memory vector index.</li>
 *   <li>{@code COLD}: scanned from disk only when hot results are insufficient.</li>
 * </ul>
 */
public enum Tier {
    HOT,
    COLD;

    public static Tier fromString(String s) {
        if (s == null || s.isBlank()) return HOT;
        return switch (s.toLowerCase()) {
            case "cold" -> COLD;
            default -> HOT;
        };
    }
}
