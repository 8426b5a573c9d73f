package io.secondbrain.tool;

import io.secondbrain.config.SecondBrainProperties;
import io.secondbrain.ingest.Document;
import io.secondbrain.ingest.IngestionService;
import io.secondbrain.memory.NotFoundException;
import io.secondbrain.provider.ExternalServiceException;
import io.secondbrain.search.RankingEngine;
import io.secondbrain.search.ScoredMemory;
import io.secondbrain.search.SearchFilters;
import io.secondbrain.search.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.StringJoiner;

/**
 * Agent-callable tools over the memory engine.
 * Tools act on the configured tool owner and report errors as text so an agent can recover.
 */
@Component
public class MemoryTools {

    private static final Logger log = LoggerFactory.getLogger(MemoryTools.class);
    private static final int DEFAULT_LIMIT = 5;

    private final IngestionService ingestionService;
    private final RankingEngine rankingEngine;
    private final String ownerId;

    public MemoryTools(IngestionService ingestionService, RankingEngine rankingEngine,
                       SecondBrainProperties properties) {
        this.ingestionService = ingestionService;
        this.rankingEngine = rankingEngine;
        this.ownerId = properties.tools().ownerId();
    }

    @Tool(name = "add_memory", description = "Store a piece of information in long-term memory. "
            + "Processing happens in the background; the returned document id can be checked with document_status.")
    public String addMemory(
            @ToolParam(description = "The text to remember") String content,
            @ToolParam(description = "Optional short title", required = false) String title) {
        try {
            Document document = ingestionService.ingest(ownerId, content, title);
            return "Queued memory for processing (document %s)".formatted(document.id());
        } catch (IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }

    @Tool(name = "search_memories", description = "Search long-term memory. Returns the most relevant "
            + "current memories, newest information first when relevance is equal.")
    public String searchMemories(
            @ToolParam(description = "What to look for") String query,
            @ToolParam(description = "Maximum number of results, default 5", required = false) Integer limit) {
        if (query == null || query.isBlank()) {
            return "Error: 'query' is required.";
        }
        int max = limit == null || limit < 1 ? DEFAULT_LIMIT : limit;
        List<ScoredMemory> results;
        try {
            results = rankingEngine.search(new SearchRequest(ownerId, query, max, SearchFilters.latestOnly(), null));
        } catch (IllegalArgumentException | ExternalServiceException e) {
            return "Error: " + e.getMessage();
        }

        if (results.isEmpty()) {
            return "No memories found matching: " + query;
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("Found %d memories:".formatted(results.size()));
        for (ScoredMemory result : results) {
            int scorePercent = (int) Math.round(result.score() * 100);
            output.add("- %s [%d%%] (%s)".formatted(truncate(result.content(), 200), scorePercent, result.explanation()));
        }
        log.debug("search_memories returned {} results", results.size());
        return output.toString();
    }

    @Tool(name = "document_status", description = "Check the processing status of a document added with add_memory.")
    public String documentStatus(@ToolParam(description = "Document id returned by add_memory") String documentId) {
        try {
            Document document = ingestionService.getDocument(documentId);
            String status = "Document %s: %s, %d memories".formatted(
                    document.id(), document.status(), document.memoryIds().size());
            return document.errorMessage() == null ? status : status + " (" + document.errorMessage() + ")";
        } catch (NotFoundException e) {
            return "Document not found: " + documentId;
        }
    }

    private String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
