package com.esign.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ClickRequest {
    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("document_id")
    private String documentId;

    private int position;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }
}
