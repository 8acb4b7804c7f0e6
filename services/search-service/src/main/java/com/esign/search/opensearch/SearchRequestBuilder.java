package com.esign.search.opensearch;

import com.esign.search.model.EntityType;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SortSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the engine's bool query for one search request. The organization term is always a
 * {@code must} clause; the permission clause sits in {@code filter} so that it cannot be satisfied
 * by a scoring clause.
 */
public final class SearchRequestBuilder {
    static final List<String> TEXT_FIELDS = List.of(
        "title^3",
        "content^2",
        "tags^2",
        "metadata.description^1.5",
        "metadata.*"
    );
    static final List<String> PHRASE_FIELDS = List.of("title^5", "content^3");
    static final String HIGHLIGHT_PRE_TAG = "<mark>";
    static final String HIGHLIGHT_POST_TAG = "</mark>";

    private SearchRequestBuilder() {
    }

    public static Map<String, Object> build(
        SearchQuery query,
        String organizationId,
        String userId,
        List<FacetDefinition> facets
    ) {
        List<Object> must = new ArrayList<>();
        must.add(Map.of("term", Map.of("organizationId", organizationId)));

        List<Object> should = new ArrayList<>();
        if (query.hasText()) {
            String baseText = query.getMatchText();
            if (baseText != null && !baseText.isBlank() && !baseText.equals(query.getQuery())) {
                // expanded text only widens the base match
                Map<String, Object> either = new LinkedHashMap<>();
                either.put("should", List.of(textMatch(baseText, "and"), textMatch(query.getQuery(), "or")));
                either.put("minimum_should_match", 1);
                must.add(Map.of("bool", either));
            } else {
                baseText = query.getQuery();
                must.add(textMatch(baseText, "and"));
            }

            Map<String, Object> phrase = new LinkedHashMap<>();
            phrase.put("query", baseText);
            phrase.put("fields", PHRASE_FIELDS);
            phrase.put("type", "phrase");
            phrase.put("boost", 2);
            should.add(Map.of("multi_match", phrase));
        }

        List<Object> filter = new ArrayList<>();
        if (query.hasEntityTypes()) {
            List<String> types = query.getEntityTypes().stream().map(EntityType::getValue).toList();
            filter.add(Map.of("terms", Map.of("type", types)));
        }
        if (query.getFilters() != null) {
            for (Map.Entry<String, SearchFilter> entry : query.getFilters().entrySet()) {
                if (entry.getValue() != null) {
                    filter.add(filterClause(entry.getKey(), entry.getValue()));
                }
            }
        }
        if (userId != null && !userId.isBlank()) {
            filter.add(permissionClause(organizationId, userId));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", must);
        if (!should.isEmpty()) {
            bool.put("should", should);
        }
        if (!filter.isEmpty()) {
            bool.put("filter", filter);
        }

        int limit = query.effectivePagination().effectiveLimit();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", query.effectivePagination().offset());
        body.put("size", limit);
        body.put("track_total_hits", true);
        body.put("query", Map.of("bool", bool));
        body.put("sort", sort(query));

        if (query.isHighlight()) {
            body.put("highlight", highlight());
        }
        if (facets != null && !facets.isEmpty()) {
            Map<String, Object> aggs = new LinkedHashMap<>();
            for (FacetDefinition facet : facets) {
                aggs.put(facet.getField(), aggregation(facet));
            }
            body.put("aggs", aggs);
        }
        return body;
    }

    static Map<String, Object> textMatch(String text, String operator) {
        Map<String, Object> multiMatch = new LinkedHashMap<>();
        multiMatch.put("query", text);
        multiMatch.put("fields", TEXT_FIELDS);
        multiMatch.put("type", "best_fields");
        multiMatch.put("fuzziness", "AUTO");
        multiMatch.put("operator", operator);
        // metadata.* also expands to numeric and date subfields, which reject fuzzy terms
        multiMatch.put("lenient", true);
        return Map.of("multi_match", multiMatch);
    }

    static Map<String, Object> filterClause(String field, SearchFilter filter) {
        return switch (filter.getKind()) {
            case TERM -> Map.of("term", Map.of(field, filter.getValue()));
            case TERMS -> Map.of("terms", Map.of(field, filter.getValues()));
            case RANGE -> Map.of("range", Map.of(field, filter.getBounds()));
        };
    }

    static Map<String, Object> permissionClause(String organizationId, String userId) {
        List<Object> anyOf = new ArrayList<>();
        anyOf.add(Map.of("term", Map.of("userId", userId)));
        anyOf.add(Map.of("terms", Map.of("permissions", List.of(
            SearchDocument.PUBLIC_PERMISSION,
            SearchDocument.userPermission(userId),
            SearchDocument.organizationPermission(organizationId)
        ))));
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", anyOf);
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }

    static List<Object> sort(SearchQuery query) {
        List<Object> sort = new ArrayList<>();
        SortSpec explicit = query.getSort();
        if (explicit != null && explicit.getField() != null && !explicit.getField().isBlank()) {
            String order = explicit.getOrder() == null ? SortSpec.DESC : explicit.getOrder();
            sort.add(Map.of(explicit.getField(), Map.of("order", order)));
        }
        if (query.hasText() && (explicit == null || !"_score".equals(explicit.getField()))) {
            sort.add("_score");
        }
        if (explicit == null || !"updatedAt".equals(explicit.getField())) {
            sort.add(Map.of("updatedAt", Map.of("order", SortSpec.DESC)));
        }
        return sort;
    }

    static Map<String, Object> highlight() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", Map.of());
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("fragment_size", 150);
        content.put("number_of_fragments", 3);
        fields.put("content", content);
        fields.put("metadata.*", Map.of());

        Map<String, Object> highlight = new LinkedHashMap<>();
        highlight.put("fields", fields);
        highlight.put("pre_tags", List.of(HIGHLIGHT_PRE_TAG));
        highlight.put("post_tags", List.of(HIGHLIGHT_POST_TAG));
        return highlight;
    }

    static Map<String, Object> aggregation(FacetDefinition facet) {
        String field = facet.resolveEngineField();
        return switch (facet.getType()) {
            case TERMS -> {
                Map<String, Object> terms = new LinkedHashMap<>();
                terms.put("field", field);
                terms.put("size", facet.getSize());
                yield Map.of("terms", terms);
            }
            case RANGE -> {
                List<Object> ranges = new ArrayList<>();
                for (FacetDefinition.RangeSpec spec : facet.getRanges()) {
                    Map<String, Object> range = new LinkedHashMap<>();
                    if (spec.getKey() != null) {
                        range.put("key", spec.getKey());
                    }
                    if (spec.getFrom() != null) {
                        range.put("from", spec.getFrom());
                    }
                    if (spec.getTo() != null) {
                        range.put("to", spec.getTo());
                    }
                    ranges.add(range);
                }
                Map<String, Object> range = new LinkedHashMap<>();
                range.put("field", field);
                range.put("ranges", ranges);
                yield Map.of("range", range);
            }
            case DATE_HISTOGRAM -> {
                Map<String, Object> histogram = new LinkedHashMap<>();
                histogram.put("field", field);
                histogram.put("calendar_interval", facet.getInterval() == null ? "month" : facet.getInterval());
                histogram.put("min_doc_count", 1);
                yield Map.of("date_histogram", histogram);
            }
            case NESTED -> {
                Map<String, Object> subAggs = new LinkedHashMap<>();
                for (FacetDefinition sub : facet.getSubFacets()) {
                    subAggs.put(sub.getField(), aggregation(sub));
                }
                Map<String, Object> nested = new LinkedHashMap<>();
                nested.put("nested", Map.of("path", facet.getPath() == null ? field : facet.getPath()));
                nested.put("aggs", subAggs);
                yield nested;
            }
        };
    }
}
