package com.esign.search.opensearch;

import com.esign.search.model.EntityType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "opensearch")
public class OpenSearchProperties {
    private String baseUrl = "http://localhost:9200";
    private String username;
    private String password;
    private int connectTimeoutMs = 1000;
    private int readTimeoutMs = 5000;
    private String indexPrefix = "search-";
    private String completionField = "suggest";
    private int completionSize = 10;
    private int termSuggestSize = 5;
    private Map<EntityType, IndexDefinition> indices = new LinkedHashMap<>();

    public IndexDefinition indexFor(EntityType type) {
        IndexDefinition configured = indices.get(type);
        IndexDefinition resolved = new IndexDefinition();
        if (configured != null) {
            resolved.setName(configured.getName());
            resolved.setAliases(configured.getAliases());
            resolved.setMappings(configured.getMappings());
            resolved.setSettings(configured.getSettings());
        }
        if (resolved.getName() == null) {
            resolved.setName(indexPrefix + type.getValue());
        }
        return resolved;
    }

    public String indexName(EntityType type) {
        return indexFor(type).getName();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public String getIndexPrefix() {
        return indexPrefix;
    }

    public void setIndexPrefix(String indexPrefix) {
        this.indexPrefix = indexPrefix;
    }

    public String getCompletionField() {
        return completionField;
    }

    public void setCompletionField(String completionField) {
        this.completionField = completionField;
    }

    public int getCompletionSize() {
        return completionSize;
    }

    public void setCompletionSize(int completionSize) {
        this.completionSize = completionSize;
    }

    public int getTermSuggestSize() {
        return termSuggestSize;
    }

    public void setTermSuggestSize(int termSuggestSize) {
        this.termSuggestSize = termSuggestSize;
    }

    public Map<EntityType, IndexDefinition> getIndices() {
        return indices;
    }

    public void setIndices(Map<EntityType, IndexDefinition> indices) {
        this.indices = indices;
    }

    public static class IndexDefinition {
        private String name;
        private List<String> aliases = new ArrayList<>();
        private Map<String, Object> mappings = new LinkedHashMap<>();
        private Map<String, Object> settings = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases == null ? new ArrayList<>() : aliases;
        }

        public Map<String, Object> getMappings() {
            return mappings;
        }

        public void setMappings(Map<String, Object> mappings) {
            this.mappings = mappings == null ? new LinkedHashMap<>() : mappings;
        }

        public Map<String, Object> getSettings() {
            return settings;
        }

        public void setSettings(Map<String, Object> settings) {
            this.settings = settings == null ? new LinkedHashMap<>() : settings;
        }
    }
}
