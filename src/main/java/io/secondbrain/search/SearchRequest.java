package io.secondbrain.search;

/**
 * A ranked search over one owner's memories.
 *
 * @param semanticWeight weight of vector similarity; null uses the configured default
 */
public record SearchRequest(String ownerId, String query, int limit, SearchFilters filters, Double semanticWeight) {

    public SearchRequest {
        if (filters == null) filters = SearchFilters.none();
    }

    public static SearchRequest of(String ownerId, String query, int limit) {
        return new SearchRequest(ownerId, query, limit, SearchFilters.none(), null);
    }
}
