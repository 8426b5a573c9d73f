package io.secondbrain.provider;

import io.secondbrain.memory.EntityCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based entity and keyword extractor.
 *
 * <p>Emails, URLs and phone numbers are matched by regex. Runs of capitalized words are treated as
 * proper nouns and classified as person, organization or location when they contain an indicator word
 * ("engineer", "corp", "city", ...); unclassified proper nouns are dropped. Keywords are lowercase words
 * of three or more letters outside the stop-word list, ranked by frequency and then by first occurrence.</p>
 */
@Component
public class PatternEntityExtractor implements EntityExtractor {

    static final int MAX_KEYWORDS = 10;

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern URL = Pattern.compile("https?://[^\\s]+");
    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\d-])(?:\\+?1[-. ]?)?\\(?(\\d{3})\\)?[-. ]?(\\d{3})[-. ]?(\\d{4})(?![\\d-])");
    private static final Pattern PROPER_NOUN = Pattern.compile("\\b[A-Z][A-Za-z]+(?:\\s+[A-Z][A-Za-z]+)*\\b");
    private static final Pattern WORD = Pattern.compile("\\b[a-z]{3,}\\b");

    private static final Set<String> PERSON_INDICATORS = Set.of(
            "mr", "ms", "mrs", "dr", "prof", "ceo", "cto", "founder",
            "author", "engineer", "manager", "director", "president");
    private static final Set<String> ORGANIZATION_INDICATORS = Set.of(
            "inc", "corp", "ltd", "llc", "company", "organization",
            "university", "institute", "bank", "hospital", "agency");
    private static final Set<String> LOCATION_INDICATORS = Set.of(
            "city", "town", "state", "country", "region", "province",
            "district", "avenue", "street", "road", "boulevard");

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "but", "for", "with", "was", "are", "were", "been", "have", "has",
            "had", "does", "did", "will", "would", "should", "could", "may", "might", "must",
            "can", "this", "that", "these", "those", "you", "she", "they", "what", "which",
            "who", "when", "where", "why", "how", "from", "now", "also", "just", "very",
            "about", "into", "over", "then", "than", "there", "their", "them", "our", "your",
            "its", "not", "all", "any", "some", "more", "most", "such", "only", "own", "same",
            "too", "his", "her", "him", "being", "each", "other", "after", "before", "because",
            "while", "here", "out", "off", "again", "once", "both", "few", "nor", "yet", "get",
            "got", "my", "me", "am", "is", "it", "of", "on", "to", "in", "at", "an", "as", "by");

    @Override
    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.empty();
        }
        return new ExtractionResult(extractEntities(text), extractKeywords(text));
    }

    Map<EntityCategory, Set<String>> extractEntities(String text) {
        Map<EntityCategory, Set<String>> entities = new EnumMap<>(EntityCategory.class);

        collect(EMAIL, text, entities, EntityCategory.EMAIL);

        Matcher url = URL.matcher(text);
        while (url.find()) {
            add(entities, EntityCategory.URL, url.group().replaceAll("[.,;:!?)\\]]+$", ""));
        }

        Matcher phone = PHONE.matcher(text);
        while (phone.find()) {
            add(entities, EntityCategory.PHONE, phone.group(1) + phone.group(2) + phone.group(3));
        }

        Matcher proper = PROPER_NOUN.matcher(text);
        while (proper.find()) {
            String phrase = stripLeadingStopWords(proper.group());
            if (phrase.isEmpty()) continue;
            EntityCategory category = classifyProperNoun(phrase);
            if (category != null) {
                add(entities, category, phrase);
            }
        }
        return entities;
    }

    /** Keywords ranked by frequency, ties broken by first occurrence. */
    List<String> extractKeywords(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher word = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (word.find()) {
            String w = word.group();
            if (!STOP_WORDS.contains(w)) {
                counts.merge(w, 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts keep first-occurrence order.
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return ranked.stream()
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static EntityCategory classifyProperNoun(String phrase) {
        String lower = phrase.toLowerCase(Locale.ROOT);
        if (containsIndicator(lower, PERSON_INDICATORS)) return EntityCategory.PERSON;
        if (containsIndicator(lower, ORGANIZATION_INDICATORS)) return EntityCategory.ORGANIZATION;
        if (containsIndicator(lower, LOCATION_INDICATORS)) return EntityCategory.LOCATION;
        return null;
    }

    /** Short indicators must be whole words; longer ones may be embedded ("TechCorp"). */
    private static boolean containsIndicator(String phrase, Set<String> indicators) {
        Set<String> words = Set.of(phrase.split("\\s+"));
        for (String indicator : indicators) {
            if (indicator.length() <= 3 ? words.contains(indicator) : phrase.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    private static String stripLeadingStopWords(String phrase) {
        String[] words = phrase.split("\\s+");
        int start = 0;
        while (start < words.length && STOP_WORDS.contains(words[start].toLowerCase(Locale.ROOT))) {
            start++;
        }
        return String.join(" ", java.util.Arrays.copyOfRange(words, start, words.length));
    }

    private static void collect(Pattern pattern, String text, Map<EntityCategory, Set<String>> entities,
                                EntityCategory category) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            add(entities, category, m.group());
        }
    }

    private static void add(Map<EntityCategory, Set<String>> entities, EntityCategory category, String value) {
        if (!value.isBlank()) {
            entities.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(value);
        }
    }
}
