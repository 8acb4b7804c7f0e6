package com.esign.search.model;

import java.util.List;

public record BulkIndexResult(int total, int succeeded, List<ItemFailure> failures) {

    public boolean hasFailures() {
        return failures != null && !failures.isEmpty();
    }

    public record ItemFailure(String id, String reason) {
    }
}
