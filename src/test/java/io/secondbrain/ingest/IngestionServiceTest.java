package io.secondbrain.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.secondbrain.memory.NotFoundException;
import io.secondbrain.memory.SQLiteMemoryStore;
import io.secondbrain.memory.VectorIndex;
import io.secondbrain.testsupport.MutableClock;
import io.secondbrain.testsupport.TestFixtures;
import org.jobrunr.jobs.lambdas.JobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Instant;

import static io.secondbrain.testsupport.TestFixtures.OWNER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private JobScheduler jobScheduler;
    private IngestionJob ingestionJob;
    private SQLiteDocumentStore documentStore;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        var properties = TestFixtures.properties();
        var dataSource = TestFixtures.dataSource(tempDir);
        jobScheduler = mock(JobScheduler.class);
        ingestionJob = mock(IngestionJob.class);
        documentStore = new SQLiteDocumentStore(dataSource, new ObjectMapper());
        documentStore.init();
        var memoryStore = new SQLiteMemoryStore(dataSource, new VectorIndex(), new ObjectMapper(), properties);
        memoryStore.init();
        service = new IngestionService(jobScheduler, ingestionJob, documentStore, memoryStore,
                new InputSanitizer(properties), new MutableClock(NOW));
    }

    @Test
    void shouldPersistQueuedDocumentAndEnqueueProcessing() throws Exception {
        Document document = service.ingest(OWNER, "I work as a Software Engineer at TechCorp", "Job");

        assertEquals(DocumentStatus.QUEUED, document.status());
        assertEquals(DocumentStatus.QUEUED, service.getDocumentStatus(document.id()));
        assertEquals("Job", service.getDocument(document.id()).title());
        assertEquals(NOW, service.getDocument(document.id()).createdAt());

        ArgumentCaptor<JobLambda> job = ArgumentCaptor.forClass(JobLambda.class);
        verify(jobScheduler).enqueue(job.capture());
        job.getValue().run();
        verify(ingestionJob).process(document.id());
    }

    @Test
    void shouldCreateNothingForInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> service.ingest(OWNER, "   ", null));
        assertThrows(IllegalArgumentException.class, () -> service.ingest("bad owner", "Long enough content", null));
        assertThrows(IllegalArgumentException.class, () -> service.ingest(OWNER, null, null));

        assertTrue(documentStore.findByOwner(OWNER).isEmpty());
        verify(jobScheduler, never()).enqueue(any(JobLambda.class));
    }

    @Test
    void shouldThrowNotFoundForUnknownDocument() {
        var error = assertThrows(NotFoundException.class, () -> service.getDocumentStatus("missing"));
        assertEquals("missing", error.getId());
        assertThrows(NotFoundException.class, () -> service.getDocumentMemories("missing"));
    }

    @Test
    void shouldListOwnerDocuments() {
        service.ingest(OWNER, "First document content", null);
        service.ingest(OWNER, "Second document content", null);
        service.ingest("bob", "Bob's document content", null);

        assertEquals(2, service.listDocuments(OWNER).size());
        assertTrue(service.getDocumentMemories(service.listDocuments(OWNER).get(0).id()).isEmpty());
    }
}
