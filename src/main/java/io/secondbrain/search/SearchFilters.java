package io.secondbrain.search;

import io.secondbrain.memory.EntityCategory;
import io.secondbrain.memory.RelationshipKind;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Optional search filters.
 *
 * @param onlyLatest        exclude memories superseded by an UPDATES edge
 * @param keywords          query keywords, scored by overlap with each memory's keywords
 * @param keywordMode       whether the keyword list also excludes non-matching memories; null uses the configured mode
 * @param entityCategories  keep memories having an entity in any of these categories
 * @param relationshipKinds keep memories taking part in an edge of any of these kinds
 * @param tierScope         which tiers to read
 */
public record SearchFilters(
        boolean onlyLatest,
        List<String> keywords,
        KeywordFilterMode keywordMode,
        Set<EntityCategory> entityCategories,
        Set<RelationshipKind> relationshipKinds,
        TierScope tierScope
) {

    public SearchFilters {
        keywords = keywords == null ? List.of() : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        entityCategories = entityCategories == null ? Set.of() : Set.copyOf(entityCategories);
        relationshipKinds = relationshipKinds == null ? Set.of() : Set.copyOf(relationshipKinds);
        if (tierScope == null) tierScope = TierScope.HOT_FIRST;
    }

    public static SearchFilters none() {
        return new SearchFilters(false, List.of(), null, Set.of(), Set.of(), TierScope.HOT_FIRST);
    }

    public static SearchFilters latestOnly() {
        return new SearchFilters(true, List.of(), null, Set.of(), Set.of(), TierScope.HOT_FIRST);
    }

    public SearchFilters withKeywords(List<String> keywords) {
        return new SearchFilters(onlyLatest, keywords, keywordMode, entityCategories, relationshipKinds, tierScope);
    }

    public SearchFilters withTierScope(TierScope tierScope) {
        return new SearchFilters(onlyLatest, keywords, keywordMode, entityCategories, relationshipKinds, tierScope);
    }

    public SearchFilters withRelationshipKinds(Set<RelationshipKind> kinds) {
        return new SearchFilters(onlyLatest, keywords, keywordMode, entityCategories, kinds, tierScope);
    }

    public SearchFilters withEntityCategories(Set<EntityCategory> categories) {
        return new SearchFilters(onlyLatest, keywords, keywordMode, categories, relationshipKinds, tierScope);
    }
}
