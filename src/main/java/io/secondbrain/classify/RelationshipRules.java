package io.secondbrain.classify;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.memory.RelationshipKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Relationship decision policy as an ordered rule list; the first matching rule wins.
 *
 * <ol>
 *   <li>UPDATES: similarity at or above the update threshold with a contradiction signal.</li>
 *   <li>SIMILAR: similarity at or above the duplicate threshold without contradiction (a restatement).</li>
 *   <li>EXTENDS: similarity at or above the extend threshold.</li>
 *   <li>DERIVES: keyword overlap at or above the overlap threshold with enough shared keywords.</li>
 *   <li>SIMILAR: similarity at or above the similarity floor.</li>
 * </ol>
 *
 * Pure: depends only on the signals and the configured thresholds.
 */
@Component
public class RelationshipRules {

    private record Rule(
            RelationshipKind kind,
            Predicate<RelationshipSignals> matches,
            ToDoubleFunction<RelationshipSignals> confidence,
            Function<RelationshipSignals, String> reason
    ) {
    }

    private final List<Rule> rules;

    public RelationshipRules(SecondBrainProperties properties) {
        SecondBrainProperties.Classifier t = properties.classifier();
        this.rules = List.of(
                new Rule(RelationshipKind.UPDATES,
                        s -> s.similarity() >= t.updateThreshold() && s.contradiction(),
                        RelationshipSignals::similarity,
                        s -> "New information supersedes earlier memory (similarity: %.2f)".formatted(s.similarity())),
                new Rule(RelationshipKind.SIMILAR,
                        s -> s.similarity() >= t.duplicateThreshold() && !s.contradiction(),
                        RelationshipSignals::similarity,
                        s -> "Restates earlier memory (similarity: %.2f)".formatted(s.similarity())),
                new Rule(RelationshipKind.EXTENDS,
                        s -> s.similarity() >= t.extendThreshold(),
                        RelationshipSignals::similarity,
                        s -> "Adds detail to earlier memory (similarity: %.2f)".formatted(s.similarity())),
                new Rule(RelationshipKind.DERIVES,
                        s -> s.keywordOverlap() >= t.overlapThreshold() && s.sharedKeywords() >= t.minSharedKeywords(),
                        RelationshipSignals::keywordOverlap,
                        s -> "Shares %d keywords (overlap: %.2f)".formatted(s.sharedKeywords(), s.keywordOverlap())),
                new Rule(RelationshipKind.SIMILAR,
                        s -> s.similarity() >= t.similarityFloor(),
                        RelationshipSignals::similarity,
                        s -> "Related topic (similarity: %.2f)".formatted(s.similarity()))
        );
    }

    /** The kind of edge the signals call for, empty when no rule matches. */
    public Optional<RelationshipKind> classify(RelationshipSignals signals) {
        return decide(signals).map(RelationshipDecision::kind);
    }

    public Optional<RelationshipDecision> decide(RelationshipSignals signals) {
        for (Rule rule : rules) {
            if (rule.matches().test(signals)) {
                return Optional.of(new RelationshipDecision(
                        rule.kind(), rule.confidence().applyAsDouble(signals), rule.reason().apply(signals)));
            }
        }
        return Optional.empty();
    }
}
