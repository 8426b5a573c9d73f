package io.secondbrain.tier;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.memory.Tier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides which tier a memory belongs in: hot if it is younger than the recency window
 * or has been accessed at least the promotion threshold, cold otherwise.
 */
@Component
public class TierPolicy {

    private final Duration recencyWindow;
    private final int promotionThreshold;
    private final boolean coldStorageEnabled;

    public TierPolicy(SecondBrainProperties properties) {
        this.recencyWindow = properties.tiering().recencyWindow();
        this.promotionThreshold = properties.tiering().promotionThreshold();
        this.coldStorageEnabled = properties.tiering().coldStorageEnabled();
    }

    public Tier tierFor(Instant createdAt, int accessCount, Instant now) {
        if (!coldStorageEnabled) {
            return Tier.HOT;
        }
        boolean recent = !createdAt.isBefore(recencyCutoff(now));
        return recent || accessCount >= promotionThreshold ? Tier.HOT : Tier.COLD;
    }

    /** Memories created before this instant are no longer recent. */
    public Instant recencyCutoff(Instant now) {
        return now.minus(recencyWindow);
    }

    public int promotionThreshold() {
        return promotionThreshold;
    }
}
