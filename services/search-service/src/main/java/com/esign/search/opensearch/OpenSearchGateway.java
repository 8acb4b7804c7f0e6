package com.esign.search.opensearch;

import com.esign.search.model.BulkIndexResult;
import com.esign.search.model.ComponentHealth;
import com.esign.search.model.EntityType;
import com.esign.search.model.FacetBucket;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.HealthStatus;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SearchScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class OpenSearchGateway {
    private static final Logger log = LoggerFactory.getLogger(OpenSearchGateway.class);
    private static final MediaType NDJSON = new MediaType("application", "x-ndjson", StandardCharsets.UTF_8);
    private static final Pattern INVALID_INDEX_NAME = Pattern.compile("[\\s\\\\/*?\"<>|,#:A-Z]|^[-_+]");
    private static final TypeReference<Map<String, Object>> SOURCE_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void ensureIndices() {
        for (EntityType type : EntityType.values()) {
            ensureIndex(properties.indexFor(type));
        }
    }

    public void ensureIndex(OpenSearchProperties.IndexDefinition definition) {
        String name = definition.getName();
        if (name == null || name.isBlank() || INVALID_INDEX_NAME.matcher(name).find()) {
            throw new IndexConfigurationException("Invalid index name: " + name);
        }
        Map<String, Object> mappings = definition.getMappings().isEmpty()
            ? DefaultIndexMappings.mappings()
            : definition.getMappings();
        try {
            if (getJson("/" + name) == null) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("mappings", mappings);
                if (!definition.getSettings().isEmpty()) {
                    body.put("settings", definition.getSettings());
                }
                sendJson(HttpMethod.PUT, "/" + name, body);
                log.info("opensearch index created index={}", name);
            } else {
                sendJson(HttpMethod.PUT, "/" + name + "/_mapping", mappings);
                log.info("opensearch index mappings updated index={}", name);
            }
            for (String alias : definition.getAliases()) {
                sendJson(HttpMethod.PUT, "/" + name + "/_alias/" + alias, Map.of());
            }
        } catch (OpenSearchRequestException e) {
            throw new IndexConfigurationException("Failed to apply index definition: " + name, e);
        }
    }

    public void indexDocument(SearchDocument document) {
        requireIndexable(document);
        URI uri = documentUri(properties.indexName(document.getEntityType()), document.getId());
        send(HttpMethod.PUT, uri, writeJson(toSource(document, Instant.now())), MediaType.APPLICATION_JSON, false);
        log.debug("document indexed id={} type={}", document.getId(), document.getEntityType().getValue());
    }

    public BulkIndexResult bulkIndex(List<SearchDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return new BulkIndexResult(0, 0, List.of());
        }
        Instant now = Instant.now();
        StringBuilder payload = new StringBuilder();
        for (SearchDocument document : documents) {
            requireIndexable(document);
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("_index", properties.indexName(document.getEntityType()));
            action.put("_id", document.getId());
            payload.append(writeJson(Map.of("index", action))).append('\n');
            payload.append(writeJson(toSource(document, now))).append('\n');
        }

        JsonNode response = send(HttpMethod.POST, "/_bulk", payload.toString(), NDJSON, false);
        List<BulkIndexResult.ItemFailure> failures = new ArrayList<>();
        if (response.path("errors").asBoolean(false)) {
            for (JsonNode item : response.path("items")) {
                JsonNode result = item.path("index");
                JsonNode error = result.path("error");
                if (!error.isMissingNode() && !error.isNull()) {
                    String reason = error.path("reason").asText(error.path("type").asText("unknown"));
                    failures.add(new BulkIndexResult.ItemFailure(result.path("_id").asText(null), reason));
                }
            }
            log.warn("bulk index partial failure total={} failed={}", documents.size(), failures.size());
        }
        return new BulkIndexResult(documents.size(), documents.size() - failures.size(), failures);
    }

    /**
     * Returns {@code false} when the document was already absent.
     */
    public boolean deleteDocument(String documentId, EntityType type) {
        JsonNode response = send(HttpMethod.DELETE, documentUri(properties.indexName(type), documentId), null, null, true);
        if (response == null || "not_found".equals(response.path("result").asText())) {
            log.debug("document already absent id={} type={}", documentId, type.getValue());
            return false;
        }
        return true;
    }

    public EngineSearchResponse execute(
        SearchQuery query,
        String organizationId,
        String userId,
        List<FacetDefinition> facets
    ) {
        Map<String, Object> body = SearchRequestBuilder.build(query, organizationId, userId, facets);
        JsonNode response = postJson("/" + indexList(query.getEntityTypes()) + "/_search", body);

        List<SearchDocument> documents = new ArrayList<>();
        int dropped = 0;
        for (JsonNode hit : response.path("hits").path("hits")) {
            SearchDocument document = toDocument(hit);
            if (document == null) {
                continue;
            }
            if (!document.isVisibleTo(organizationId, userId)) {
                dropped++;
                continue;
            }
            documents.add(document);
        }
        if (dropped > 0) {
            log.warn("dropped hits outside caller scope org={} dropped={}", organizationId, dropped);
        }

        JsonNode totalNode = response.path("hits").path("total");
        long total = totalNode.isObject() ? totalNode.path("value").asLong() : totalNode.asLong(documents.size());
        return new EngineSearchResponse(
            documents,
            Math.max(0, total - dropped),
            parseAggregations(response.path("aggregations")),
            response.path("took").asLong(0)
        );
    }

    public List<String> suggestCompletions(String prefix, String organizationId) {
        if (prefix == null || prefix.isBlank()) {
            return List.of();
        }
        Map<String, Object> completion = new LinkedHashMap<>();
        completion.put("field", properties.getCompletionField());
        completion.put("size", properties.getCompletionSize());
        completion.put("skip_duplicates", true);
        completion.put("contexts", Map.of("organizationId", List.of(organizationId)));

        Map<String, Object> completions = new LinkedHashMap<>();
        completions.put("prefix", prefix);
        completions.put("completion", completion);

        Map<String, Object> terms = new LinkedHashMap<>();
        terms.put("text", prefix);
        terms.put("term", Map.of("field", "title", "size", properties.getTermSuggestSize()));

        Map<String, Object> suggest = new LinkedHashMap<>();
        suggest.put("completions", completions);
        suggest.put("terms", terms);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", 0);
        body.put("suggest", suggest);

        try {
            JsonNode response = postJson("/" + indexList(null) + "/_search", body);
            Set<String> texts = new LinkedHashSet<>();
            collectOptions(response.path("suggest").path("completions"), texts);
            collectOptions(response.path("suggest").path("terms"), texts);
            return new ArrayList<>(texts);
        } catch (RuntimeException e) {
            log.warn("engine completions unavailable prefix={}", prefix, e);
            return List.of();
        }
    }

    public SearchMetrics.IndexHealth indexHealth() {
        SearchMetrics.IndexHealth health = new SearchMetrics.IndexHealth();
        String indices = indexList(null);
        try {
            JsonNode stats = getJson("/" + indices + "/_stats");
            if (stats != null) {
                JsonNode all = stats.path("_all").path("total");
                health.setDocumentCount(all.path("docs").path("count").asLong(0));
                health.setIndexSize(all.path("store").path("size_in_bytes").asLong(0));
            }
            JsonNode cluster = getJson("/_cluster/health");
            health.setShardHealth(cluster == null ? "unknown" : cluster.path("status").asText("unknown"));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("size", 0);
            body.put("aggs", Map.of("last_indexed", Map.of("max", Map.of("field", "indexed_at"))));
            JsonNode last = postJson("/" + indices + "/_search", body).path("aggregations").path("last_indexed");
            String lastIndexed = last.path("value_as_string").asText(null);
            if (lastIndexed != null && !lastIndexed.isBlank()) {
                health.setLastIndexed(Instant.parse(lastIndexed));
            }
        } catch (RuntimeException e) {
            log.warn("index metrics unavailable", e);
            health.setShardHealth("unavailable");
        }
        return health;
    }

    public ComponentHealth healthCheck() {
        try {
            JsonNode cluster = getJson("/_cluster/health");
            if (cluster == null) {
                return ComponentHealth.of(HealthStatus.UNHEALTHY);
            }
            String status = cluster.path("status").asText("unknown");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cluster_status", status);
            details.put("nodes", cluster.path("number_of_nodes").asInt(0));
            HealthStatus mapped = "green".equals(status) ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
            return new ComponentHealth(mapped, details);
        } catch (RuntimeException e) {
            log.warn("opensearch health check failed", e);
            return new ComponentHealth(HealthStatus.UNHEALTHY, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    public long reindexOrganization(String organizationId) {
        Map<String, Object> script = new LinkedHashMap<>();
        script.put("source", "ctx._source.indexed_at = params.now");
        script.put("lang", "painless");
        script.put("params", Map.of("now", Instant.now().toString()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", Map.of("term", Map.of("organizationId", organizationId)));
        body.put("script", script);

        JsonNode response = postJson("/" + indexList(null) + "/_update_by_query?conflicts=proceed", body);
        long updated = response.path("updated").asLong(0);
        log.info("organization reindexed org={} updated={}", organizationId, updated);
        return updated;
    }

    Map<String, Object> toSource(SearchDocument document, Instant indexedAt) {
        Map<String, Object> source = objectMapper.convertValue(document, SOURCE_TYPE);
        source.remove("score");
        source.remove("highlight");
        source.put("indexed_at", indexedAt.toString());

        List<String> inputs = new ArrayList<>();
        if (document.getTitle() != null && !document.getTitle().isBlank()) {
            inputs.add(document.getTitle());
        }
        if (document.getTags() != null) {
            inputs.addAll(document.getTags());
        }
        if (!inputs.isEmpty()) {
            Map<String, Object> suggest = new LinkedHashMap<>();
            suggest.put("input", inputs);
            suggest.put("contexts", Map.of("organizationId", List.of(document.getOrganizationId())));
            source.put(properties.getCompletionField(), suggest);
        }
        return source;
    }

    private SearchDocument toDocument(JsonNode hit) {
        JsonNode source = hit.path("_source");
        if (!source.isObject()) {
            return null;
        }
        SearchDocument document;
        try {
            document = objectMapper.treeToValue(source, SearchDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("skipping unreadable hit id={}", hit.path("_id").asText(), e);
            return null;
        }
        if (document.getId() == null) {
            document.setId(hit.path("_id").asText(null));
        }
        document.setScore(SearchScore.fromRelevance(hit.path("_score").asDouble(0.0)));

        JsonNode highlight = hit.path("highlight");
        if (highlight.isObject()) {
            Map<String, List<String>> fragments = new LinkedHashMap<>();
            highlight.fields().forEachRemaining(entry -> {
                List<String> values = new ArrayList<>();
                entry.getValue().forEach(node -> values.add(node.asText()));
                fragments.put(entry.getKey(), values);
            });
            document.setHighlight(fragments);
        }
        return document;
    }

    private Map<String, List<FacetBucket>> parseAggregations(JsonNode aggregations) {
        Map<String, List<FacetBucket>> result = new LinkedHashMap<>();
        if (!aggregations.isObject()) {
            return result;
        }
        aggregations.fields().forEachRemaining(entry -> {
            JsonNode agg = entry.getValue();
            if (!agg.has("buckets")) {
                // nested aggregations carry their buckets one level down
                agg = firstBucketed(agg);
            }
            if (agg != null) {
                result.put(entry.getKey(), parseBuckets(agg.path("buckets")));
            }
        });
        return result;
    }

    private JsonNode firstBucketed(JsonNode agg) {
        for (JsonNode child : agg) {
            if (child.isObject() && child.has("buckets")) {
                return child;
            }
        }
        return null;
    }

    private List<FacetBucket> parseBuckets(JsonNode buckets) {
        List<FacetBucket> parsed = new ArrayList<>();
        if (buckets.isArray()) {
            for (JsonNode bucket : buckets) {
                parsed.add(parseBucket(null, bucket));
            }
        } else if (buckets.isObject()) {
            buckets.fields().forEachRemaining(entry -> parsed.add(parseBucket(entry.getKey(), entry.getValue())));
        }
        return parsed;
    }

    private FacetBucket parseBucket(String keyedName, JsonNode bucket) {
        String key = keyedName;
        if (key == null) {
            key = bucket.has("key_as_string")
                ? bucket.path("key_as_string").asText()
                : bucket.path("key").asText();
        }
        FacetBucket parsed = new FacetBucket(key, bucket.path("doc_count").asLong(0));
        if (bucket.has("from")) {
            parsed.setFrom(bucket.path("from").asDouble());
        }
        if (bucket.has("to")) {
            parsed.setTo(bucket.path("to").asDouble());
        }
        return parsed;
    }

    private void collectOptions(JsonNode entries, Set<String> texts) {
        for (JsonNode entry : entries) {
            for (JsonNode option : entry.path("options")) {
                String text = option.path("text").asText(null);
                if (text != null && !text.isBlank()) {
                    texts.add(text);
                }
            }
        }
    }

    private String indexList(List<EntityType> types) {
        List<EntityType> targets = types == null || types.isEmpty() ? Arrays.asList(EntityType.values()) : types;
        return String.join(",", targets.stream().distinct().map(properties::indexName).toList());
    }

    private void requireIndexable(SearchDocument document) {
        if (document == null || document.getId() == null || document.getId().isBlank()) {
            throw new IllegalArgumentException("document id is required");
        }
        if (document.getEntityType() == null) {
            throw new IllegalArgumentException("document type is required: " + document.getId());
        }
        if (document.getOrganizationId() == null || document.getOrganizationId().isBlank()) {
            throw new IllegalArgumentException("document organizationId is required: " + document.getId());
        }
    }

    private JsonNode postJson(String path, Object body) {
        return sendJson(HttpMethod.POST, path, body);
    }

    private JsonNode sendJson(HttpMethod method, String path, Object body) {
        return send(method, path, writeJson(body), MediaType.APPLICATION_JSON, false);
    }

    private JsonNode getJson(String path) {
        return send(HttpMethod.GET, path, null, null, true);
    }

    private JsonNode send(HttpMethod method, String path, String payload, MediaType contentType, boolean notFoundAsNull) {
        return send(method, URI.create(baseUrl() + path), payload, contentType, notFoundAsNull);
    }

    private JsonNode send(HttpMethod method, URI uri, String payload, MediaType contentType, boolean notFoundAsNull) {
        HttpHeaders headers = new HttpHeaders();
        if (contentType != null) {
            headers.setContentType(contentType);
        }
        try {
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(responseBody);
        } catch (ResourceAccessException e) {
            throw new OpenSearchUnavailableException("OpenSearch unreachable: " + uri, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404 && notFoundAsNull) {
                return null;
            }
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private String writeJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to serialize OpenSearch request", e);
        }
    }

    /**
     * Ids come from upstream services and may contain reserved characters; each one is encoded
     * as a single path segment.
     */
    private URI documentUri(String index, String documentId) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/{index}/_doc/{id}")
            .encode()
            .buildAndExpand(index, documentId)
            .toUri();
    }

    private String baseUrl() {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
