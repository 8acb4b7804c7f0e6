package com.esign.search.model;

import java.util.ArrayList;
import java.util.List;

public class FacetResult {
    private String field;
    private FacetType type = FacetType.TERMS;
    private List<FacetBucket> buckets = new ArrayList<>();

    public FacetResult() {
    }

    public FacetResult(String field, FacetType type, List<FacetBucket> buckets) {
        this.field = field;
        this.type = type;
        this.buckets = buckets == null ? new ArrayList<>() : buckets;
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
        this.type = type;
    }

    public List<FacetBucket> getBuckets() {
        return buckets;
    }

    public void setBuckets(List<FacetBucket> buckets) {
        this.buckets = buckets == null ? new ArrayList<>() : buckets;
    }
}
