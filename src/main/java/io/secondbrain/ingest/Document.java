package io.secondbrain.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An ingested text and its progress through the pipeline.
 *
 * @param memoryIds    memories committed from this document, in chunk order
 * @param errorMessage why processing failed, null otherwise
 */
public record Document(
        String id,
        String ownerId,
        String title,
        String rawContent,
        DocumentStatus status,
        List<String> memoryIds,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {

    public Document {
        memoryIds = memoryIds == null ? List.of() : List.copyOf(memoryIds);
        if (status == null) status = DocumentStatus.QUEUED;
    }

    public static Document queued(String ownerId, String title, String rawContent, Instant now) {
        return new Document(UUID.randomUUID().toString(), ownerId, title, rawContent,
                DocumentStatus.QUEUED, List.of(), null, now, now);
    }

    /**
     * Moves the document to the next status.
     *
     * @throws IllegalStateException if the move would go backwards or leave a terminal status
     */
    public Document advance(DocumentStatus next, Instant now) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Document %s cannot move from %s to %s".formatted(id, status, next));
        }
        return new Document(id, ownerId, title, rawContent, next, memoryIds, errorMessage, createdAt, now);
    }

    public Document withMemory(String memoryId, Instant now) {
        List<String> ids = new ArrayList<>(memoryIds);
        ids.add(memoryId);
        return new Document(id, ownerId, title, rawContent, status, ids, errorMessage, createdAt, now);
    }

    public Document failed(String error, Instant now) {
        return new Document(id, ownerId, title, rawContent, status, memoryIds, error, createdAt, now)
                .advance(DocumentStatus.FAILED, now);
    }
}
