package io.secondbrain.search;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.memory.Relationship;
import io.secondbrain.memory.StorageException;
import io.secondbrain.memory.VectorMatch;
import io.secondbrain.provider.EmbeddingProvider;
import io.secondbrain.provider.ExternalCallExecutor;
import io.secondbrain.tier.TieringManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranked semantic search over one owner's memories.
 *
 * <p>Each candidate scores {@code w * similarity + (1 - w) * keywordMatch}, multiplied by the time decay
 * {@code exp(-ageDays / halfLifeDays)}. Without a keyword list the score is the similarity alone.
 * Results are ordered by score, newer first on ties, and every returned memory counts as an access.</p>
 */
@Service
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final int MAX_RELATED = 5;

    private static final Comparator<ScoredMemory> RANKING = Comparator
            .comparingDouble(ScoredMemory::score).reversed()
            .thenComparing(ScoredMemory::createdAt, Comparator.reverseOrder());

    private final MemoryStore store;
    private final EmbeddingProvider embeddingProvider;
    private final ExternalCallExecutor externalCalls;
    private final TieringManager tieringManager;
    private final Clock clock;
    private final SecondBrainProperties.Ranking config;

    public RankingEngine(MemoryStore store, EmbeddingProvider embeddingProvider, ExternalCallExecutor externalCalls,
                         TieringManager tieringManager, Clock clock, SecondBrainProperties properties) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.externalCalls = externalCalls;
        this.tieringManager = tieringManager;
        this.clock = clock;
        this.config = properties.ranking();
    }

    /**
     * Searches the owner's memories.
     *
     * @throws IllegalArgumentException                        on an invalid request
     * @throws io.secondbrain.provider.EmbeddingUnavailableException if the query cannot be embedded
     */
    public List<ScoredMemory> search(SearchRequest request) {
        validate(request);
        float[] query = externalCalls.embed(embeddingProvider, request.query());
        List<ScoredMemory> results = rank(request, query);
        for (ScoredMemory result : results) {
            recordAccess(result.memoryId());
        }
        log.debug("Search for owner {} returned {} results", request.ownerId(), results.size());
        return results;
    }

    /**
     * Memories about a topic across both tiers, superseded versions included, oldest first.
     */
    public List<ScoredMemory> timeline(String ownerId, String topic, int limit) {
        SearchFilters filters = SearchFilters.none().withTierScope(TierScope.ALL);
        List<ScoredMemory> results = new ArrayList<>(search(new SearchRequest(ownerId, topic, limit, filters, null)));
        results.sort(Comparator.comparing(ScoredMemory::createdAt));
        return results;
    }

    List<ScoredMemory> rank(SearchRequest request, float[] query) {
        SearchFilters filters = request.filters();
        int fetch = request.limit() * config.candidateMultiplier();
        double weight = request.semanticWeight() != null ? request.semanticWeight() : config.semanticWeight();
        Instant now = clock.instant();

        List<ScoredMemory> scored = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (filters.tierScope() != TierScope.ALL) {
            List<VectorMatch> hot = store.nearestHot(request.ownerId(), query, fetch, 0.0);
            scored.addAll(score(hot, filters, weight, now, seen));
        }
        boolean needCold = filters.tierScope() == TierScope.ALL
                || (filters.tierScope() == TierScope.HOT_FIRST && scored.size() < request.limit());
        if (needCold) {
            List<VectorMatch> cold = store.nearestCold(request.ownerId(), query, fetch, 0.0);
            if (filters.tierScope() == TierScope.ALL) {
                cold = mergeHot(request.ownerId(), query, fetch, cold);
            }
            scored.addAll(score(cold, filters, weight, now, seen));
        }

        scored.sort(RANKING);
        return scored.size() > request.limit() ? List.copyOf(scored.subList(0, request.limit())) : scored;
    }

    private List<VectorMatch> mergeHot(String ownerId, float[] query, int fetch, List<VectorMatch> cold) {
        List<VectorMatch> all = new ArrayList<>(store.nearestHot(ownerId, query, fetch, 0.0));
        all.addAll(cold);
        all.sort(Comparator.comparingDouble(VectorMatch::similarity).reversed());
        return all.size() > fetch ? all.subList(0, fetch) : all;
    }

    private List<ScoredMemory> score(List<VectorMatch> matches, SearchFilters filters, double weight,
                                     Instant now, Set<String> seen) {
        Map<String, Double> similarities = new LinkedHashMap<>();
        for (VectorMatch match : matches) {
            if (seen.add(match.memoryId())) {
                similarities.put(match.memoryId(), match.similarity());
            }
        }
        if (similarities.isEmpty()) {
            return List.of();
        }

        List<Memory> memories = store.findAllById(similarities.keySet());
        Map<String, List<Relationship>> edges = store.findRelationships(similarities.keySet());

        List<ScoredMemory> results = new ArrayList<>();
        for (Memory memory : memories) {
            List<Relationship> memoryEdges = edges.getOrDefault(memory.id(), List.of());
            if (!passes(memory, memoryEdges, filters)) {
                continue;
            }
            double similarity = similarities.get(memory.id());
            double keywordScore = filters.keywords().isEmpty()
                    ? similarity
                    : keywordMatch(filters.keywords(), memory.keywords());
            double combined = weight * similarity + (1 - weight) * keywordScore;
            double decay = decay(memory.createdAt(), now);

            results.add(new ScoredMemory(memory, combined * decay, similarity, keywordScore, decay,
                    explain(memory, similarity, keywordScore, !filters.keywords().isEmpty()),
                    relatedIds(memory, memoryEdges)));
        }
        return results;
    }

    private boolean passes(Memory memory, List<Relationship> edges, SearchFilters filters) {
        if (filters.onlyLatest() && !memory.latest()) {
            return false;
        }
        if (!filters.entityCategories().isEmpty() && !memory.hasEntityIn(filters.entityCategories())) {
            return false;
        }
        if (!filters.relationshipKinds().isEmpty()
                && edges.stream().noneMatch(e -> filters.relationshipKinds().contains(e.kind()))) {
            return false;
        }
        KeywordFilterMode mode = filters.keywordMode() != null ? filters.keywordMode() : config.keywordFilterMode();
        if (mode == KeywordFilterMode.REQUIRE_ANY && !filters.keywords().isEmpty()
                && filters.keywords().stream().noneMatch(memory.keywords()::contains)) {
            return false;
        }
        return true;
    }

    /** {@code exp(-ageDays / halfLifeDays)}; memories dated in the future are not boosted. */
    double decay(Instant createdAt, Instant now) {
        double ageDays = Math.max(0.0, Duration.between(createdAt, now).toMillis() / MILLIS_PER_DAY);
        return Math.exp(-ageDays / config.halfLifeDays());
    }

    /** Jaccard overlap of the query keywords and the memory keywords. */
    static double keywordMatch(List<String> queryKeywords, List<String> memoryKeywords) {
        Set<String> query = new HashSet<>(queryKeywords);
        Set<String> memory = new HashSet<>(memoryKeywords);
        Set<String> union = new HashSet<>(query);
        union.addAll(memory);
        if (union.isEmpty()) {
            return 0.0;
        }
        query.retainAll(memory);
        return (double) query.size() / union.size();
    }

    private static String explain(Memory memory, double similarity, double keywordScore, boolean keywordsGiven) {
        List<String> parts = new ArrayList<>();
        if (similarity > 0.8) {
            parts.add("High semantic similarity (%.2f)".formatted(similarity));
        } else if (similarity > 0.6) {
            parts.add("Good semantic match");
        } else {
            parts.add("Moderate relevance");
        }
        if (keywordsGiven && keywordScore > 0) {
            parts.add("keyword match");
        }
        if (!memory.latest()) {
            parts.add("older version");
        }
        return String.join("; ", parts);
    }

    private static List<String> relatedIds(Memory memory, List<Relationship> edges) {
        return edges.stream()
                .map(e -> e.otherEnd(memory.id()))
                .distinct()
                .limit(MAX_RELATED)
                .toList();
    }

    private void recordAccess(String memoryId) {
        try {
            tieringManager.onAccess(memoryId);
        } catch (StorageException e) {
            log.warn("Failed to record access of memory {}: {}", memoryId, e.getMessage());
        }
    }

    private void validate(SearchRequest request) {
        if (request.ownerId() == null || request.ownerId().isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        if (request.limit() < 1 || request.limit() > config.maxLimit()) {
            throw new IllegalArgumentException("Limit must be between 1 and " + config.maxLimit());
        }
        Double weight = request.semanticWeight();
        if (weight != null && (weight < 0.0 || weight > 1.0 || weight.isNaN())) {
            throw new IllegalArgumentException("Semantic weight must be in [0,1]: " + weight);
        }
    }
}
