package com.esign.search.model;

public record ClickedResult(String documentId, int position) {
}
