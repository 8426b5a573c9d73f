package io.secondbrain.ingest;

import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.memory.NotFoundException;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Accepts text for ingestion and reports on its progress.
 *
 * <p>Instead of processing synchronously, each document is persisted as QUEUED and handed to
 * {@link IngestionJob} as a JobRunr background job. Callers poll {@link #getDocumentStatus(String)}.</p>
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final JobScheduler jobScheduler;
    private final IngestionJob ingestionJob;
    private final DocumentStore documentStore;
    private final MemoryStore memoryStore;
    private final InputSanitizer sanitizer;
    private final Clock clock;

    public IngestionService(JobScheduler jobScheduler, IngestionJob ingestionJob, DocumentStore documentStore,
                            MemoryStore memoryStore, InputSanitizer sanitizer, Clock clock) {
        this.jobScheduler = jobScheduler;
        this.ingestionJob = ingestionJob;
        this.documentStore = documentStore;
        this.memoryStore = memoryStore;
        this.sanitizer = sanitizer;
        this.clock = clock;
    }

    /**
     * Validates the input, records a QUEUED document and enqueues its processing.
     *
     * @return the queued document; its id is the handle for status polling
     * @throws IllegalArgumentException if the owner, text or title is invalid; no document is created
     */
    public Document ingest(String ownerId, String text, String title) {
        String owner = sanitizer.validateOwnerId(ownerId);
        String content = sanitizer.sanitizeContent(text);
        String cleanTitle = sanitizer.sanitizeTitle(title);

        Document document = Document.queued(owner, cleanTitle, content, clock.instant());
        documentStore.save(document);

        String documentId = document.id();
        jobScheduler.enqueue(() -> ingestionJob.process(documentId));
        log.info("Queued document {} for owner {} ({} characters)", documentId, owner, content.length());
        return document;
    }

    /**
     * @throws NotFoundException if the document is unknown
     */
    public DocumentStatus getDocumentStatus(String documentId) {
        return getDocument(documentId).status();
    }

    public Document getDocument(String documentId) {
        return documentStore.findById(documentId)
                .orElseThrow(() -> new NotFoundException("Document", documentId));
    }

    /** Memories produced from the document, in chunk order. */
    public List<Memory> getDocumentMemories(String documentId) {
        getDocument(documentId);
        return memoryStore.findByDocument(documentId);
    }

    public List<Document> listDocuments(String ownerId) {
        return documentStore.findByOwner(sanitizer.validateOwnerId(ownerId));
    }
}
