package io.secondbrain.classify;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContradictionDetectorTest {

    private final ContradictionDetector detector = new ContradictionDetector();

    @Test
    void shouldDetectIntroducedSupersessionCue() {
        assertTrue(detector.detect(
                "I now work as a Manager at TechCorp",
                "I work as a Software Engineer at TechCorp",
                Set.of("techcorp", "work")));
    }

    @Test
    void shouldDetectCueEvenWhenOlderTextUsesItToo() {
        assertTrue(detector.detect("I now live in Berlin", "I now live in Paris", Set.of("live")));
    }

    @Test
    void shouldNotTreatRestatementAsContradiction() {
        assertFalse(detector.detect("I now live in Berlin", "i now  live in berlin.", Set.of("live", "berlin")));
        assertFalse(detector.detect("My rent is 1200 now", "My rent is 1200 now", Set.of("rent")));
    }

    @Test
    void shouldMatchMultiWordCueAcrossWhitespace() {
        assertTrue(detector.containsCue("I no  longer drink coffee"));
    }

    @Test
    void shouldNotMatchCueInsideAnotherWord() {
        assertFalse(detector.containsCue("I know the recipe"));
    }

    @Test
    void shouldDetectDifferingNumbers() {
        assertTrue(detector.detect("My rent is 1500 per month", "My rent is 1200 per month", Set.of("rent")));
        assertFalse(detector.numbersDiffer("My rent is 1200", "Rent of 1200 was paid"));
        assertFalse(detector.numbersDiffer("My rent is 1200", "My rent is high"));
    }

    @Test
    void shouldRequireSharedSubject() {
        assertFalse(detector.detect("I now prefer tea", "The meeting is at 3", Set.of()));
    }
}
