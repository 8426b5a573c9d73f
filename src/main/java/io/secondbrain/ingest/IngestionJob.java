package io.secondbrain.ingest;

import io.secondbrain.classify.RelationshipClassifier;
import io.secondbrain.memory.ConcurrencyConflictException;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.MemoryCommit;
import io.secondbrain.memory.MemoryStore;
import io.secondbrain.provider.EmbeddingProvider;
import io.secondbrain.provider.EntityExtractor;
import io.secondbrain.provider.ExternalCallExecutor;
import io.secondbrain.provider.ExtractionResult;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Processes one queued document through the pipeline stages.
 *
 * <p>EXTRACTING normalizes the text, CHUNKING splits it, EMBEDDING embeds and extracts every chunk,
 * INDEXING classifies and commits each chunk as a memory. A chunk is committed together with its
 * relationships or not at all; chunks committed before a failure stay in place and the document
 * ends FAILED with the error recorded.</p>
 */
@Component
public class IngestionJob {

    private static final Logger log = LoggerFactory.getLogger(IngestionJob.class);
    private static final int COMMIT_ATTEMPTS = 2;

    private final DocumentStore documentStore;
    private final MemoryStore memoryStore;
    private final TextChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final EntityExtractor entityExtractor;
    private final ExternalCallExecutor externalCalls;
    private final RelationshipClassifier classifier;
    private final Clock clock;

    public IngestionJob(DocumentStore documentStore, MemoryStore memoryStore, TextChunker chunker,
                        EmbeddingProvider embeddingProvider, EntityExtractor entityExtractor,
                        ExternalCallExecutor externalCalls, RelationshipClassifier classifier, Clock clock) {
        this.documentStore = documentStore;
        this.memoryStore = memoryStore;
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.entityExtractor = entityExtractor;
        this.externalCalls = externalCalls;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Job(name = "Ingest document %0", retries = 0)
    public void process(String documentId) {
        Optional<Document> found = documentStore.findById(documentId);
        if (found.isEmpty()) {
            log.warn("Document {} no longer exists, skipping", documentId);
            return;
        }
        Document document = found.get();
        if (document.status().isTerminal()) {
            log.info("Document {} already {}, skipping", documentId, document.status());
            return;
        }
        if (document.status() != DocumentStatus.QUEUED) {
            // an earlier run stopped mid-pipeline; its committed chunks stay, the document ends FAILED
            String reason = "Processing interrupted during %s after %d memories".formatted(
                    document.status(), document.memoryIds().size());
            log.warn("Document {}: {}", documentId, reason);
            documentStore.update(document.failed(reason, clock.instant()));
            return;
        }

        try {
            document = advance(document, DocumentStatus.EXTRACTING);
            String text = document.rawContent().replace("\r\n", "\n").replace('\r', '\n');

            document = advance(document, DocumentStatus.CHUNKING);
            List<String> chunks = chunker.chunk(text);
            if (chunks.isEmpty()) {
                throw new IllegalArgumentException("Document has no content to index");
            }

            document = advance(document, DocumentStatus.EMBEDDING);
            List<PreparedChunk> prepared = new ArrayList<>(chunks.size());
            for (String chunk : chunks) {
                float[] embedding = externalCalls.embed(embeddingProvider, chunk);
                ExtractionResult extraction = externalCalls.extract(entityExtractor, chunk);
                prepared.add(new PreparedChunk(chunk, embedding, extraction));
            }

            document = advance(document, DocumentStatus.INDEXING);
            for (int i = 0; i < prepared.size(); i++) {
                PreparedChunk chunk = prepared.get(i);
                Memory memory = Memory.create(document.ownerId(), chunk.text(), chunk.embedding(),
                        chunk.extraction().keywords(), chunk.extraction().entities(), clock.instant(),
                        document.id(), i);
                index(memory);
                document = document.withMemory(memory.id(), clock.instant());
                documentStore.update(document);
            }

            document = advance(document, DocumentStatus.DONE);
            log.info("Document {} done: {} memories", documentId, document.memoryIds().size());
        } catch (RuntimeException e) {
            log.error("Document {} failed during {}: {}", documentId, document.status(), e.getMessage(), e);
            documentStore.update(document.failed(describe(e), clock.instant()));
        }
    }

    /** Classifies and commits one memory, re-reading candidates once if a superseded memory changed meanwhile. */
    void index(Memory memory) {
        for (int attempt = 1; ; attempt++) {
            RelationshipClassifier.Classification classification = classifier.classify(memory);
            try {
                memoryStore.commit(new MemoryCommit(memory, classification.relationships(),
                        classification.superseded()));
                return;
            } catch (ConcurrencyConflictException e) {
                if (attempt >= COMMIT_ATTEMPTS) {
                    throw e;
                }
                log.warn("Conflict indexing memory {} on {}, retrying with fresh read", memory.id(), e.getMemoryId());
            }
        }
    }

    private Document advance(Document document, DocumentStatus next) {
        Document advanced = document.advance(next, clock.instant());
        documentStore.update(advanced);
        return advanced;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private record PreparedChunk(String text, float[] embedding, ExtractionResult extraction) {
    }
}
