package com.esign.search.model;

import java.time.Instant;

public record ClickEvent(
    String id,
    String queryId,
    String documentId,
    int position,
    String userId,
    String organizationId,
    Instant timestamp
) {
}
