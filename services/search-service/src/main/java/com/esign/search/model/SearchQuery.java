package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search request input. A missing {@code query} is browse mode.
 */
public class SearchQuery {
    private String query;
    private List<EntityType> entityTypes;
    private Map<String, SearchFilter> filters = new LinkedHashMap<>();
    private List<String> facets;
    private SortSpec sort;
    private Pagination pagination;
    private boolean highlight;
    private boolean suggestions = true;
    private boolean personalize = true;

    @JsonIgnore
    private String matchText;

    public SearchQuery copy() {
        SearchQuery copy = new SearchQuery();
        copy.query = query;
        copy.entityTypes = entityTypes == null ? null : new ArrayList<>(entityTypes);
        copy.filters = filters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(filters);
        copy.facets = facets == null ? null : new ArrayList<>(facets);
        copy.sort = sort == null ? null : new SortSpec(sort.getField(), sort.getOrder());
        copy.pagination = pagination == null ? null : new Pagination(pagination.getPage(), pagination.getLimit());
        copy.highlight = highlight;
        copy.suggestions = suggestions;
        copy.personalize = personalize;
        copy.matchText = matchText;
        return copy;
    }

    /**
     * Text before synonym expansion, when expansion rewrote {@link #getQuery()}.
     */
    public String getMatchText() {
        return matchText;
    }

    public void setMatchText(String matchText) {
        this.matchText = matchText;
    }

    public boolean hasText() {
        return query != null && !query.isBlank();
    }

    public boolean hasEntityTypes() {
        return entityTypes != null && !entityTypes.isEmpty();
    }

    public boolean hasFacets() {
        return facets != null && !facets.isEmpty();
    }

    public Pagination effectivePagination() {
        return pagination == null ? new Pagination() : pagination;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<EntityType> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<EntityType> entityTypes) {
        this.entityTypes = entityTypes;
    }

    public Map<String, SearchFilter> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, SearchFilter> filters) {
        this.filters = filters == null ? new LinkedHashMap<>() : filters;
    }

    public List<String> getFacets() {
        return facets;
    }

    public void setFacets(List<String> facets) {
        this.facets = facets;
    }

    public SortSpec getSort() {
        return sort;
    }

    public void setSort(SortSpec sort) {
        this.sort = sort;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public boolean isHighlight() {
        return highlight;
    }

    public void setHighlight(boolean highlight) {
        this.highlight = highlight;
    }

    public boolean isSuggestions() {
        return suggestions;
    }

    public void setSuggestions(boolean suggestions) {
        this.suggestions = suggestions;
    }

    public boolean isPersonalize() {
        return personalize;
    }

    public void setPersonalize(boolean personalize) {
        this.personalize = personalize;
    }
}
