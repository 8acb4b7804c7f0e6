package com.esign.search.facet;

import com.esign.search.model.EntityType;
import com.esign.search.model.FacetDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.facets")
public class FacetProperties {
    private boolean dynamicFacets = true;
    private int maxFacetValues = 50;
    private int facetMinCount = 1;
    private int maxFacetFields = 10;
    private List<String> defaultFields = new ArrayList<>(List.of("type", "tags", "createdAt"));
    private List<String> commonFields = new ArrayList<>(List.of("type", "tags", "createdAt", "userId"));
    private List<String> hierarchicalFields = new ArrayList<>(List.of("categories", "tags"));
    private Map<String, RangeFacet> rangeFacets = defaultRangeFacets();
    private Map<EntityType, List<String>> entityFacets = defaultEntityFacets();
    private Map<String, FacetDefinition> definitions = new LinkedHashMap<>();

    private static Map<String, RangeFacet> defaultRangeFacets() {
        Map<String, RangeFacet> ranges = new LinkedHashMap<>();
        ranges.put("metadata.fileSize", new RangeFacet(0, 100_000_000L, 1_000_000L));
        ranges.put("metadata.pageCount", new RangeFacet(1, 1000, 10));
        return ranges;
    }

    private static Map<EntityType, List<String>> defaultEntityFacets() {
        Map<EntityType, List<String>> facets = new LinkedHashMap<>();
        facets.put(EntityType.DOCUMENT, List.of(
            "metadata.fileType", "metadata.fileSize", "metadata.pageCount", "metadata.language", "status"));
        facets.put(EntityType.TEMPLATE, List.of(
            "metadata.category", "metadata.industry", "metadata.complexity", "isPublic", "usage_count"));
        facets.put(EntityType.USER, List.of(
            "metadata.role", "metadata.department", "metadata.location", "isActive"));
        facets.put(EntityType.ORGANIZATION, List.of(
            "metadata.industry", "metadata.size", "metadata.plan", "metadata.region"));
        facets.put(EntityType.SIGNATURE_REQUEST, List.of(
            "status", "metadata.priority", "metadata.deadline", "recipientCount"));
        facets.put(EntityType.FOLDER, List.of(
            "metadata.access_level", "metadata.project", "documentCount"));
        facets.put(EntityType.AUDIT_LOG, List.of(
            "metadata.action", "metadata.severity", "metadata.source"));
        return facets;
    }

    public boolean isDynamicFacets() {
        return dynamicFacets;
    }

    public void setDynamicFacets(boolean dynamicFacets) {
        this.dynamicFacets = dynamicFacets;
    }

    public int getMaxFacetValues() {
        return maxFacetValues;
    }

    public void setMaxFacetValues(int maxFacetValues) {
        this.maxFacetValues = maxFacetValues;
    }

    public int getFacetMinCount() {
        return facetMinCount;
    }

    public void setFacetMinCount(int facetMinCount) {
        this.facetMinCount = facetMinCount;
    }

    public int getMaxFacetFields() {
        return maxFacetFields;
    }

    public void setMaxFacetFields(int maxFacetFields) {
        this.maxFacetFields = maxFacetFields;
    }

    public List<String> getDefaultFields() {
        return defaultFields;
    }

    public void setDefaultFields(List<String> defaultFields) {
        this.defaultFields = defaultFields;
    }

    public List<String> getCommonFields() {
        return commonFields;
    }

    public void setCommonFields(List<String> commonFields) {
        this.commonFields = commonFields;
    }

    public List<String> getHierarchicalFields() {
        return hierarchicalFields;
    }

    public void setHierarchicalFields(List<String> hierarchicalFields) {
        this.hierarchicalFields = hierarchicalFields;
    }

    public Map<String, RangeFacet> getRangeFacets() {
        return rangeFacets;
    }

    public void setRangeFacets(Map<String, RangeFacet> rangeFacets) {
        this.rangeFacets = rangeFacets;
    }

    public Map<EntityType, List<String>> getEntityFacets() {
        return entityFacets;
    }

    public void setEntityFacets(Map<EntityType, List<String>> entityFacets) {
        this.entityFacets = entityFacets;
    }

    public Map<String, FacetDefinition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(Map<String, FacetDefinition> definitions) {
        this.definitions = definitions;
    }

    public static class RangeFacet {
        private long min;
        private long max;
        private long step;

        public RangeFacet() {
        }

        public RangeFacet(long min, long max, long step) {
            this.min = min;
            this.max = max;
            this.step = step;
        }

        public long getMin() {
            return min;
        }

        public void setMin(long min) {
            this.min = min;
        }

        public long getMax() {
            return max;
        }

        public void setMax(long max) {
            this.max = max;
        }

        public long getStep() {
            return step;
        }

        public void setStep(long step) {
            this.step = step;
        }
    }
}
