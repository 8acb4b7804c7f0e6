package com.esign.search.query;

import com.esign.search.model.SearchIntent;
import com.esign.search.model.SearchQuery;

/**
 * Query rewritten for execution, with the caller's original text kept for suggestions.
 */
public record EnhancedQuery(
    SearchQuery query,
    String originalText,
    SearchIntent intent,
    SpellCorrection correction
) {
    public static EnhancedQuery unmodified(SearchQuery query) {
        return new EnhancedQuery(query, query.getQuery(), SearchIntent.unknown(), SpellCorrection.unchanged(query.getQuery()));
    }
}
