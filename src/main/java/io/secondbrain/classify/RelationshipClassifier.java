package io.secondbrain.classify;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.memory.Relationship;
import io.secondbrain.memory.RelationshipKind;
import io.secondbrain.memory.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Links a new memory to its nearest existing memories of the same owner.
 *
 * <p>Candidates are the K most similar memories of any tier above the similarity floor, excluding
 * earlier chunks of the same document. Each candidate is evaluated independently against
 * {@link RelationshipRules}; UPDATES edges also report the candidate's version so the store can
 * clear its latest flag atomically with the edge.</p>
 */
@Component
public class RelationshipClassifier {

    private static final Logger log = LoggerFactory.getLogger(RelationshipClassifier.class);

    private final MemoryStore store;
    private final RelationshipRules rules;
    private final ContradictionDetector contradictionDetector;
    private final Clock clock;
    private final int candidateCount;
    private final double similarityFloor;

    public RelationshipClassifier(MemoryStore store, RelationshipRules rules,
                                  ContradictionDetector contradictionDetector, Clock clock,
                                  SecondBrainProperties properties) {
        this.store = store;
        this.rules = rules;
        this.contradictionDetector = contradictionDetector;
        this.clock = clock;
        this.candidateCount = properties.classifier().candidateCount();
        this.similarityFloor = properties.classifier().similarityFloor();
    }

    /**
     * Edges of the new memory, plus the memories it supersedes.
     * Reads the store but writes nothing.
     */
    public Classification classify(Memory memory) {
        List<VectorMatch> matches = findCandidates(memory);
        if (matches.isEmpty()) {
            return Classification.none();
        }

        Map<String, Memory> byId = store.findAllById(matches.stream().map(VectorMatch::memoryId).toList())
                .stream()
                .collect(Collectors.toMap(Memory::id, Function.identity()));

        Instant now = clock.instant();
        List<Relationship> relationships = new ArrayList<>();
        Map<String, Long> superseded = new LinkedHashMap<>();
        int evaluated = 0;

        for (VectorMatch match : matches) {
            Memory candidate = byId.get(match.memoryId());
            if (candidate == null || isSameDocument(memory, candidate)) {
                continue;
            }
            if (evaluated++ >= candidateCount) {
                break;
            }

            RelationshipSignals signals = signals(memory, candidate, match.similarity());
            rules.decide(signals).ifPresent(decision -> {
                relationships.add(Relationship.create(memory.ownerId(), memory.id(), candidate.id(),
                        decision.kind(), decision.confidence(), decision.reason(), now));
                if (decision.kind() == RelationshipKind.UPDATES) {
                    superseded.put(candidate.id(), candidate.version());
                }
            });
        }

        log.debug("Classified memory {}: {} relationships, {} superseded",
                memory.id(), relationships.size(), superseded.size());
        return new Classification(relationships, superseded);
    }

    RelationshipSignals signals(Memory memory, Memory candidate, double similarity) {
        Set<String> newKeywords = new HashSet<>(memory.keywords());
        Set<String> oldKeywords = new HashSet<>(candidate.keywords());

        Set<String> shared = new HashSet<>(newKeywords);
        shared.retainAll(oldKeywords);
        Set<String> union = new HashSet<>(newKeywords);
        union.addAll(oldKeywords);
        double overlap = union.isEmpty() ? 0.0 : (double) shared.size() / union.size();

        Set<String> sharedEntities = new HashSet<>(memory.entityValues());
        sharedEntities.retainAll(candidate.entityValues());
        Set<String> sharedTerms = new HashSet<>(shared);
        sharedTerms.addAll(sharedEntities);

        boolean contradiction = contradictionDetector.detect(memory.content(), candidate.content(), sharedTerms);
        return new RelationshipSignals(similarity, overlap, shared.size(), contradiction);
    }

    /** Nearest memories across both tiers, most similar first, with room for skipped same-document chunks. */
    private List<VectorMatch> findCandidates(Memory memory) {
        int limit = candidateCount + memory.chunkIndex();
        List<VectorMatch> hot = store.nearestHot(memory.ownerId(), memory.embedding(), limit, similarityFloor);
        List<VectorMatch> cold = store.nearestCold(memory.ownerId(), memory.embedding(), limit, similarityFloor);

        Map<String, VectorMatch> merged = new LinkedHashMap<>();
        Stream.concat(hot.stream(), cold.stream())
                .filter(m -> !m.memoryId().equals(memory.id()))
                .forEach(m -> merged.merge(m.memoryId(), m,
                        (a, b) -> a.similarity() >= b.similarity() ? a : b));

        return merged.values().stream()
                .sorted(Comparator.comparingDouble(VectorMatch::similarity).reversed())
                .limit(limit)
                .toList();
    }

    private static boolean isSameDocument(Memory memory, Memory candidate) {
        return memory.sourceDocumentId() != null
                && Objects.equals(memory.sourceDocumentId(), candidate.sourceDocumentId());
    }

    /**
     * @param superseded memory id to the version it was read at
     */
    public record Classification(List<Relationship> relationships, Map<String, Long> superseded) {

        public static Classification none() {
            return new Classification(List.of(), Map.of());
        }
    }
}
