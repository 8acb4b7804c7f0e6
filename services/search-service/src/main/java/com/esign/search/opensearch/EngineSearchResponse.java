package com.esign.search.opensearch;

import com.esign.search.model.FacetBucket;
import com.esign.search.model.SearchDocument;
import java.util.List;
import java.util.Map;

/**
 * Hits mapped back into documents plus the raw aggregation buckets keyed by facet field.
 */
public record EngineSearchResponse(
    List<SearchDocument> documents,
    long total,
    Map<String, List<FacetBucket>> aggregations,
    long tookMs
) {
}
