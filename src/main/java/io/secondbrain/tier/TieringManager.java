package io.secondbrain.tier;

import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.memory.StorageException;
import io.secondbrain.memory.Tier;
import io.secondbrain.memory.TierSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains memory tiers.
 *
 * <p>Promotion happens synchronously on the access that earns it. Demotion only happens in
 * {@link #rebalance()}, a periodic sweep that rewrites one memory's tier at a time. The sweep works from a
 * snapshot, so each demotion re-checks the policy against the row it writes.</p>
 */
@Service
public class TieringManager {

    private static final Logger log = LoggerFactory.getLogger(TieringManager.class);

    private final MemoryStore store;
    private final TierPolicy policy;
    private final Clock clock;

    public TieringManager(MemoryStore store, TierPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Records an access and promotes the memory if it now qualifies for the hot tier.
     *
     * @return the tier after the access, empty if the memory is unknown
     */
    public Optional<Tier> onAccess(String memoryId) {
        Instant now = clock.instant();
        Optional<Memory> accessed = store.recordAccess(memoryId, now);
        if (accessed.isEmpty()) {
            log.debug("Access to unknown memory {} ignored", memoryId);
            return Optional.empty();
        }

        Memory memory = accessed.get();
        if (memory.tier() == Tier.COLD
                && policy.tierFor(memory.createdAt(), memory.accessCount(), now) == Tier.HOT
                && store.updateTier(memoryId, Tier.HOT)) {
            log.debug("Promoted memory {} to HOT after {} accesses", memoryId, memory.accessCount());
            return Optional.of(Tier.HOT);
        }
        return Optional.of(memory.tier());
    }

    /**
     * Sweeps every owner's memories, demoting and promoting them to match the policy.
     * A memory that fails to move is logged and left for the next sweep.
     */
    public RebalanceResult rebalance() {
        Instant now = clock.instant();
        int scanned = 0;
        int promoted = 0;
        int demoted = 0;

        for (String ownerId : store.listOwners()) {
            for (TierSnapshot snapshot : store.tierSnapshots(ownerId)) {
                scanned++;
                Tier target = policy.tierFor(snapshot.createdAt(), snapshot.accessCount(), now);
                if (target == snapshot.tier()) {
                    continue;
                }
                try {
                    if (target == Tier.HOT) {
                        if (store.updateTier(snapshot.memoryId(), Tier.HOT)) promoted++;
                    } else if (store.demoteIfStale(snapshot.memoryId(), policy.recencyCutoff(now),
                            policy.promotionThreshold())) {
                        demoted++;
                    }
                } catch (StorageException e) {
                    log.warn("Failed to move memory {} to {}: {}", snapshot.memoryId(), target, e.getMessage());
                }
            }
        }

        log.info("Tier rebalance: scanned={}, promoted={}, demoted={}", scanned, promoted, demoted);
        return new RebalanceResult(scanned, promoted, demoted);
    }

    public TierStats tierStats(String ownerId) {
        Map<Tier, Long> counts = store.countByTier(ownerId);
        return TierStats.of(counts.getOrDefault(Tier.HOT, 0L), counts.getOrDefault(Tier.COLD, 0L));
    }
}
