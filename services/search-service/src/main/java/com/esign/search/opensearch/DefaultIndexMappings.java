package com.esign.search.opensearch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping applied to an index whose definition declares none.
 */
final class DefaultIndexMappings {
    private DefaultIndexMappings() {
    }

    static Map<String, Object> mappings() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", keyword());
        properties.put("type", keyword());
        properties.put("title", textWithKeyword());
        properties.put("content", Map.of("type", "text"));
        properties.put("organizationId", keyword());
        properties.put("userId", keyword());
        properties.put("tags", keyword());
        properties.put("permissions", keyword());
        properties.put("createdAt", Map.of("type", "date"));
        properties.put("updatedAt", Map.of("type", "date"));
        properties.put("indexed_at", Map.of("type", "date"));
        properties.put("metadata", Map.of("type", "object", "dynamic", true));

        Map<String, Object> suggest = new LinkedHashMap<>();
        suggest.put("type", "completion");
        suggest.put("contexts", List.of(Map.of("name", "organizationId", "type", "category", "path", "organizationId")));
        properties.put("suggest", suggest);

        Map<String, Object> mappings = new LinkedHashMap<>();
        mappings.put("properties", properties);
        return mappings;
    }

    private static Map<String, Object> keyword() {
        return Map.of("type", "keyword");
    }

    private static Map<String, Object> textWithKeyword() {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("type", "text");
        field.put("fields", Map.of("keyword", Map.of("type", "keyword", "ignore_above", 256)));
        return field;
    }
}
