package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FacetBucket {
    private String key;
    private long count;
    private Boolean selected;
    private Double from;
    private Double to;
    private String fullPath;
    private List<FacetBucket> children;

    public FacetBucket() {
    }

    public FacetBucket(String key, long count) {
        this.key = key;
        this.count = count;
    }

    public void addChild(FacetBucket child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
    }

    @JsonIgnore
    public boolean isSelected() {
        return Boolean.TRUE.equals(selected);
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public Boolean getSelected() {
        return selected;
    }

    public void setSelected(Boolean selected) {
        this.selected = selected;
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

    public String getFullPath() {
        return fullPath;
    }

    public void setFullPath(String fullPath) {
        this.fullPath = fullPath;
    }

    public List<FacetBucket> getChildren() {
        return children;
    }

    public void setChildren(List<FacetBucket> children) {
        this.children = children;
    }
}
