package io.secondbrain.classify;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic test for whether a new text supersedes an older one about the same subject.
 *
 * <p>The texts must share at least one keyword or entity. Given that, a contradiction is either a
 * supersession cue ("now", "instead", "no longer", ...) in the new text, or two differing sets of numbers.
 * Texts that are equal after case and whitespace normalization never contradict each other.</p>
 */
@Component
public class ContradictionDetector {

    static final List<String> SUPERSESSION_CUES = List.of(
            "now", "instead", "updated", "no longer", "changed", "switched",
            "currently", "revised", "modified", "anymore");

    private static final List<Pattern> CUE_PATTERNS = SUPERSESSION_CUES.stream()
            .map(cue -> Pattern.compile("\\b" + cue.replace(" ", "\\s+") + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param sharedTerms keywords and entity values both texts have in common
     */
    public boolean detect(String newText, String oldText, Set<String> sharedTerms) {
        if (sharedTerms.isEmpty() || sameContent(newText, oldText)) {
            return false;
        }
        return containsCue(newText) || numbersDiffer(newText, oldText);
    }

    boolean containsCue(String text) {
        for (Pattern cue : CUE_PATTERNS) {
            if (cue.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    static boolean sameContent(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    private static String normalize(String text) {
        String collapsed = WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return collapsed.replaceAll("[.!?]+$", "");
    }

    boolean numbersDiffer(String newText, String oldText) {
        Set<String> newNumbers = numbers(newText);
        Set<String> oldNumbers = numbers(oldText);
        return !newNumbers.isEmpty() && !oldNumbers.isEmpty() && !newNumbers.equals(oldNumbers);
    }

    private static Set<String> numbers(String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = NUMBER.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            found.add(m.group());
        }
        return found;
    }
}
