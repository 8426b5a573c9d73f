package io.secondbrain.ingest;

/**
 * Pipeline stage of a document. Status only moves forward; DONE and FAILED are terminal.
 */
public enum DocumentStatus {
    QUEUED,
    EXTRACTING,
    CHUNKING,
    EMBEDDING,
    INDEXING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /** Whether a document in this status may move to {@code next}. */
    public boolean canAdvanceTo(DocumentStatus next) {
        if (isTerminal()) return false;
        return next == FAILED || next.ordinal() > ordinal();
    }

    public static DocumentStatus fromString(String s) {
        if (s == null || s.isBlank()) return QUEUED;
        return switch (s.toLowerCase()) {
            case "extracting" -> EXTRACTING;
            case "chunking" -> CHUNKING;
            case "embedding" -> EMBEDDING;
            case "indexing" -> INDEXING;
            case "done" -> DONE;
            case "failed" -> FAILED;
            default -> QUEUED;
        };
    }
}
