package io.secondbrain.ingest;

import io.secondbrain.config.SecondBrainProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates and cleans ingestion input before any document is created.
 * Every rejection is an {@link IllegalArgumentException}.
 */
@Component
public class InputSanitizer {

    private static final int MAX_OWNER_ID_LENGTH = 128;
    private static final Pattern OWNER_ID = Pattern.compile("[A-Za-z0-9._@-]+");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private final SecondBrainProperties.Ingestion limits;

    public InputSanitizer(SecondBrainProperties properties) {
        this.limits = properties.ingestion();
    }

    /**
     * Strips control characters (keeping newlines and tabs) and checks the length bounds.
     *
     * @param content the raw text
     * @return trimmed, cleaned content
     * @throws IllegalArgumentException if the content is missing, too short or too long
     */
    public String sanitizeContent(String content) {
        if (content == null) {
            throw new IllegalArgumentException("Content is required");
        }
        String cleaned = CONTROL_CHARS.matcher(content).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("Content cannot be empty");
        }
        if (cleaned.length() < limits.minContentLength()) {
            throw new IllegalArgumentException(
                    "Content too short: %d characters (min %d)".formatted(cleaned.length(), limits.minContentLength()));
        }
        if (cleaned.length() > limits.maxContentLength()) {
            throw new IllegalArgumentException(
                    "Content too long: %d characters (max %d)".formatted(cleaned.length(), limits.maxContentLength()));
        }
        return cleaned;
    }

    /** Blank titles become null. */
    public String sanitizeTitle(String title) {
        if (title == null) return null;
        String cleaned = CONTROL_CHARS.matcher(title).replaceAll("").trim();
        if (cleaned.isEmpty()) return null;
        if (cleaned.length() > limits.maxTitleLength()) {
            throw new IllegalArgumentException(
                    "Title too long: %d characters (max %d)".formatted(cleaned.length(), limits.maxTitleLength()));
        }
        return cleaned;
    }

    /**
     * @throws IllegalArgumentException if the owner id is blank, too long or has unsupported characters
     */
    public String validateOwnerId(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        String trimmed = ownerId.trim();
        if (trimmed.length() > MAX_OWNER_ID_LENGTH || !OWNER_ID.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid owner id: " + ownerId);
        }
        return trimmed;
    }
}
