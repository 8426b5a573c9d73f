package io.secondbrain.tier;

/** Hot/cold distribution of one owner's memories. */
public record TierStats(long hotCount, long coldCount, double hotPercentage, double coldPercentage) {

    public static TierStats of(long hotCount, long coldCount) {
        long total = hotCount + coldCount;
        if (total == 0) {
            return new TierStats(0, 0, 0.0, 0.0);
        }
        return new TierStats(hotCount, coldCount, 100.0 * hotCount / total, 100.0 * coldCount / total);
    }

    public long total() {
        return hotCount + coldCount;
    }
}
