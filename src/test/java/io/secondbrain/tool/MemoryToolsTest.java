package io.secondbrain.tool;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.ingest.Document;
import io.secondbrain.ingest.DocumentStatus;
import io.secondbrain.ingest.IngestionService;
import io.secondbrain.memory.Memory;
import io.secondbrain.memory.NotFoundException;
import io.secondbrain.provider.EmbeddingUnavailableException;
import io.secondbrain.search.RankingEngine;
import io.secondbrain.search.ScoredMemory;
import io.secondbrain.search.SearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MemoryToolsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private IngestionService ingestionService;
    private RankingEngine rankingEngine;
    private MemoryTools tools;

    @BeforeEach
    void setUp() {
        ingestionService = mock(IngestionService.class);
        rankingEngine = mock(RankingEngine.class);
        var properties = new SecondBrainProperties(null, null, null, null, null, null, null, null,
                new SecondBrainProperties.Tools("agent"));
        tools = new MemoryTools(ingestionService, rankingEngine, properties);
    }

    @Test
    void shouldQueueMemoryForConfiguredOwner() {
        var document = Document.queued("agent", "Job", "I work at TechCorp", NOW);
        when(ingestionService.ingest("agent", "I work at TechCorp", "Job")).thenReturn(document);

        String result = tools.addMemory("I work at TechCorp", "Job");

        assertEquals("Queued memory for processing (document " + document.id() + ")", result);
    }

    @Test
    void shouldReportValidationErrorsAsText() {
        when(ingestionService.ingest("agent", "   ", null))
                .thenThrow(new IllegalArgumentException("Content cannot be empty"));

        assertEquals("Error: Content cannot be empty", tools.addMemory("   ", null));
    }

    @Test
    void shouldSearchLatestMemoriesAndFormatResults() {
        Memory memory = Memory.create("agent", "I now work as a Manager at TechCorp", new float[]{1f}, List.of(),
                Map.of(), NOW, "doc", 0);
        when(rankingEngine.search(any())).thenReturn(List.of(
                new ScoredMemory(memory, 0.834, 0.834, 0.834, 1.0, "High semantic similarity", List.of())));

        String result = tools.searchMemories("where do I work", null);

        assertTrue(result.startsWith("Found 1 memories:"));
        assertTrue(result.contains("- I now work as a Manager at TechCorp [83%] (High semantic similarity)"));
        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(rankingEngine).search(request.capture());
        assertEquals("agent", request.getValue().ownerId());
        assertEquals(5, request.getValue().limit());
        assertTrue(request.getValue().filters().onlyLatest());
    }

    @Test
    void shouldHandleEmptyAndInvalidSearches() {
        when(rankingEngine.search(any())).thenReturn(List.of());

        assertEquals("No memories found matching: cats", tools.searchMemories("cats", 3));
        assertEquals("Error: 'query' is required.", tools.searchMemories(" ", 3));
    }

    @Test
    void shouldReportProviderOutageAsText() {
        when(rankingEngine.search(any())).thenThrow(new EmbeddingUnavailableException("embedding timed out"));

        assertEquals("Error: embedding timed out", tools.searchMemories("cats", 3));
    }

    @Test
    void shouldDescribeDocumentStatus() {
        var document = Document.queued("agent", null, "I work at TechCorp", NOW)
                .advance(DocumentStatus.EXTRACTING, NOW)
                .failed("EmbeddingUnavailableException: down", NOW);
        when(ingestionService.getDocument(document.id())).thenReturn(document);
        when(ingestionService.getDocument("missing")).thenThrow(new NotFoundException("Document", "missing"));

        assertEquals("Document " + document.id() + ": FAILED, 0 memories (EmbeddingUnavailableException: down)",
                tools.documentStatus(document.id()));
        assertEquals("Document not found: missing", tools.documentStatus("missing"));
    }
}
