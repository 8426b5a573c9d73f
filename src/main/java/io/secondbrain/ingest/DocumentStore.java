package io.secondbrain.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Bookkeeping for ingested documents.
 */
public interface DocumentStore {

    void save(Document document);

    /**
     * Persists the document's new status, produced memories and error.
     *
     * @throws IllegalStateException if the stored status does not allow the transition
     */
    void update(Document document);

    Optional<Document> findById(String documentId);

    List<Document> findByOwner(String ownerId);

    /** Deletes every document of the owner, returning how many were removed. */
    int deleteOwner(String ownerId);
}
