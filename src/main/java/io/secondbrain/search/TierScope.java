package io.secondbrain.search;

/** Which tiers a search reads. */
public enum TierScope {
    /** Hot tier first; cold tier merged in only when hot results fall short of the limit. */
    HOT_FIRST,
    HOT_ONLY,
    ALL;

    public static TierScope fromString(String s) {
        if (s == null || s.isBlank()) return HOT_FIRST;
        return switch (s.trim().toLowerCase().replace('-', '_')) {
            case "hot_only", "hot" -> HOT_ONLY;
            case "all" -> ALL;
            default -> HOT_FIRST;
        };
    }
}
