package io.secondbrain.classify;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.memory.RelationshipKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipRulesTest {

    private final RelationshipRules rules = new RelationshipRules(SecondBrainProperties.defaults());

    private Optional<RelationshipKind> classify(double similarity, double overlap, int shared, boolean contradiction) {
        return rules.classify(new RelationshipSignals(similarity, overlap, shared, contradiction));
    }

    @Test
    void shouldClassifyContradictingCloseMemoryAsUpdate() {
        assertEquals(Optional.of(RelationshipKind.UPDATES), classify(0.80, 0.5, 3, true));
        assertEquals(Optional.of(RelationshipKind.UPDATES), classify(0.70, 0.0, 0, true));
    }

    @Test
    void shouldPreferUpdateOverEveryOtherRule() {
        assertEquals(Optional.of(RelationshipKind.UPDATES), classify(0.99, 1.0, 10, true));
    }

    @Test
    void shouldClassifyNearDuplicateAsSimilar() {
        assertEquals(Optional.of(RelationshipKind.SIMILAR), classify(0.97, 0.9, 5, false));
    }

    @Test
    void shouldClassifyCloseNonContradictingMemoryAsExtension() {
        assertEquals(Optional.of(RelationshipKind.EXTENDS), classify(0.65, 0.0, 0, false));
        assertEquals(Optional.of(RelationshipKind.EXTENDS), classify(0.80, 0.5, 3, false));
    }

    @Test
    void shouldFallBackToExtendWhenContradictionIsBelowUpdateThreshold() {
        assertEquals(Optional.of(RelationshipKind.EXTENDS), classify(0.65, 0.2, 1, true));
    }

    @Test
    void shouldClassifyKeywordOverlapAsDerivation() {
        assertEquals(Optional.of(RelationshipKind.DERIVES), classify(0.45, 0.40, 2, false));
    }

    @Test
    void shouldRequireEnoughSharedKeywordsForDerivation() {
        assertEquals(Optional.of(RelationshipKind.SIMILAR), classify(0.45, 0.50, 1, false));
    }

    @Test
    void shouldClassifyLooselyRelatedMemoryAsSimilar() {
        assertEquals(Optional.of(RelationshipKind.SIMILAR), classify(0.35, 0.0, 0, false));
        assertEquals(Optional.of(RelationshipKind.SIMILAR), classify(0.30, 0.0, 0, false));
    }

    @Test
    void shouldCreateNoEdgeBelowFloor() {
        assertTrue(classify(0.29, 0.1, 1, false).isEmpty());
    }

    @Test
    void shouldDeriveBelowSimilarityFloorWhenKeywordsOverlap() {
        assertEquals(Optional.of(RelationshipKind.DERIVES), classify(0.10, 0.60, 3, false));
    }

    @Test
    void shouldUseSimilarityAsConfidenceAndExplainDecision() {
        RelationshipDecision decision = rules.decide(new RelationshipSignals(0.82, 0.3, 2, true)).orElseThrow();

        assertEquals(RelationshipKind.UPDATES, decision.kind());
        assertEquals(0.82, decision.confidence(), 1e-9);
        assertTrue(decision.reason().startsWith("New information supersedes"));
    }

    @Test
    void shouldHonorConfiguredThresholds() {
        var strict = new RelationshipRules(SecondBrainProperties.defaults().withClassifier(
                new SecondBrainProperties.Classifier(10, 0.5, 0.9, 0.8, 0.3, 2, 0.95)));

        assertEquals(Optional.of(RelationshipKind.SIMILAR),
                strict.classify(new RelationshipSignals(0.75, 0.0, 0, true)));
        assertTrue(strict.classify(new RelationshipSignals(0.45, 0.0, 0, false)).isEmpty());
    }
}
