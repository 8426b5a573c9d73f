package io.secondbrain.provider;

import io.secondbrain.memory.EntityCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatternEntityExtractorTest {

    private final PatternEntityExtractor extractor = new PatternEntityExtractor();

    @Test
    void shouldClassifyProperNounsByIndicator() {
        Map<EntityCategory, Set<String>> entities =
                extractor.extractEntities("I work as a Software Engineer at TechCorp");

        assertEquals(Set.of("Software Engineer"), entities.get(EntityCategory.PERSON));
        assertEquals(Set.of("TechCorp"), entities.get(EntityCategory.ORGANIZATION));
        assertFalse(entities.containsKey(EntityCategory.LOCATION));
    }

    @Test
    void shouldDropUnclassifiedProperNouns() {
        Map<EntityCategory, Set<String>> entities = extractor.extractEntities("Yesterday Alice went hiking");

        assertTrue(entities.isEmpty());
    }

    @Test
    void shouldStripLeadingStopWords() {
        Map<EntityCategory, Set<String>> entities = extractor.extractEntities("The Springfield City council met");

        assertEquals(Set.of("Springfield City"), entities.get(EntityCategory.LOCATION));
    }

    @Test
    void shouldExtractContactDetails() {
        Map<EntityCategory, Set<String>> entities = extractor.extractEntities(
                "Mail jane.doe@example.com, see https://example.com/profile. Call 555-123-4567 today");

        assertEquals(Set.of("jane.doe@example.com"), entities.get(EntityCategory.EMAIL));
        assertEquals(Set.of("https://example.com/profile"), entities.get(EntityCategory.URL));
        assertEquals(Set.of("5551234567"), entities.get(EntityCategory.PHONE));
    }

    @Test
    void shouldRankKeywordsByFrequencyThenFirstOccurrence() {
        List<String> keywords = extractor.extractKeywords(
                "Coffee in the morning. Tea in the evening. Coffee again after lunch.");

        assertEquals(List.of("coffee", "morning", "tea", "evening", "lunch"), keywords);
    }

    @Test
    void shouldSkipStopWordsAndShortWords() {
        List<String> keywords = extractor.extractKeywords("I now work as an engineer and it is fun");

        assertEquals(List.of("work", "engineer", "fun"), keywords);
    }

    @Test
    void shouldCapKeywordCount() {
        List<String> keywords = extractor.extractKeywords(
                "alpha bravo charlie delta echo foxtrot golf hotel india juliet kilo lima");

        assertEquals(PatternEntityExtractor.MAX_KEYWORDS, keywords.size());
        assertEquals("alpha", keywords.get(0));
    }

    @Test
    void shouldReturnEmptyResultForBlankText() {
        ExtractionResult result = extractor.extract("   ");

        assertTrue(result.entities().isEmpty());
        assertTrue(result.keywords().isEmpty());
    }
}
