package io.secondbrain.ingest;

import io.secondbrain.config.SecondBrainProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into chunks of at most the configured size.
 *
 * <p>Paragraphs are kept whole when they fit; longer paragraphs are split into sentences, which are
 * aggregated greedily. A sentence longer than the limit is cut at whitespace, avoiding cuts between two
 * capitalized words so multi-word names stay together.</p>
 */
@Component
public class TextChunker {

    private static final Pattern PARAGRAPH = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE = Pattern.compile("(?<=[.!?])\\s+");

    private final int maxChunkSize;

    public TextChunker(SecondBrainProperties properties) {
        this.maxChunkSize = properties.chunking().maxChunkSize();
        if (maxChunkSize <= 0) throw new IllegalArgumentException("max chunk size must be positive");
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.strip();
        if (normalized.length() <= maxChunkSize) {
            return List.of(normalized);
        }

        List<String> pieces = new ArrayList<>();
        for (String paragraph : PARAGRAPH.split(normalized)) {
            String p = paragraph.strip();
            if (p.isEmpty()) continue;
            if (p.length() <= maxChunkSize) {
                pieces.add(p);
                continue;
            }
            for (String sentence : SENTENCE.split(p)) {
                String s = sentence.strip();
                if (s.isEmpty()) continue;
                if (s.length() <= maxChunkSize) {
                    pieces.add(s);
                } else {
                    pieces.addAll(splitLongSentence(s));
                }
            }
        }
        return aggregate(pieces);
    }

    /** Greedily joins consecutive pieces while they fit. */
    private List<String> aggregate(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : pieces) {
            if (current.length() > 0 && current.length() + 1 + piece.length() > maxChunkSize) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) current.append(' ');
            current.append(piece);
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    private List<String> splitLongSentence(String sentence) {
        List<String> parts = new ArrayList<>();
        String rest = sentence;
        while (rest.length() > maxChunkSize) {
            int cut = findCut(rest);
            parts.add(rest.substring(0, cut).strip());
            rest = rest.substring(cut).strip();
        }
        if (!rest.isEmpty()) {
            parts.add(rest);
        }
        return parts;
    }

    /** Index to cut at: the last suitable whitespace within the limit, or the limit itself. */
    private int findCut(String text) {
        int fallback = -1;
        for (int i = maxChunkSize; i > 0; i--) {
            if (!Character.isWhitespace(text.charAt(i))) continue;
            if (fallback < 0) fallback = i;
            if (!joinsCapitalizedWords(text, i)) return i;
        }
        return fallback > 0 ? fallback : maxChunkSize;
    }

    private static boolean joinsCapitalizedWords(String text, int space) {
        int before = space - 1;
        while (before >= 0 && Character.isLetter(text.charAt(before))) before--;
        boolean prevCapitalized = before + 1 < space && Character.isUpperCase(text.charAt(before + 1));
        boolean nextCapitalized = space + 1 < text.length() && Character.isUpperCase(text.charAt(space + 1));
        return prevCapitalized && nextCapitalized;
    }
}
