package com.esign.search.model;

import java.util.ArrayList;
import java.util.List;

/**
 * How a facet field is aggregated by the engine. {@code engineField} defaults to {@code field}.
 */
public class FacetDefinition {
    private String field;
    private FacetType type = FacetType.TERMS;
    private String engineField;
    private int size = 10;
    private List<RangeSpec> ranges = new ArrayList<>();
    private String interval = "month";
    private String path;
    private List<FacetDefinition> subFacets = new ArrayList<>();

    public FacetDefinition() {
    }

    public FacetDefinition(String field, FacetType type) {
        this.field = field;
        this.type = type;
    }

    public static FacetDefinition terms(String field) {
        return new FacetDefinition(field, FacetType.TERMS);
    }

    public String resolveEngineField() {
        return engineField == null || engineField.isBlank() ? field : engineField;
    }

    public FacetDefinition copy() {
        FacetDefinition copy = new FacetDefinition(field, type);
        copy.engineField = engineField;
        copy.size = size;
        copy.ranges = new ArrayList<>(ranges);
        copy.interval = interval;
        copy.path = path;
        copy.subFacets = subFacets.stream().map(FacetDefinition::copy).toList();
        return copy;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public FacetType getType() {
        return type;
    }

    public void setType(FacetType type) {
        this.type = type == null ? FacetType.TERMS : type;
    }

    public String getEngineField() {
        return engineField;
    }

    public void setEngineField(String engineField) {
        this.engineField = engineField;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public List<RangeSpec> getRanges() {
        return ranges;
    }

    public void setRanges(List<RangeSpec> ranges) {
        this.ranges = ranges == null ? new ArrayList<>() : ranges;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<FacetDefinition> getSubFacets() {
        return subFacets;
    }

    public void setSubFacets(List<FacetDefinition> subFacets) {
        this.subFacets = subFacets == null ? new ArrayList<>() : subFacets;
    }

    public static class RangeSpec {
        private Double from;
        private Double to;
        private String key;

        public RangeSpec() {
        }

        public RangeSpec(Double from, Double to, String key) {
            this.from = from;
            this.to = to;
            this.key = key;
        }

        public Double getFrom() {
            return from;
        }

        public void setFrom(Double from) {
            this.from = from;
        }

        public Double getTo() {
            return to;
        }

        public void setTo(Double to) {
            this.to = to;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }
}
