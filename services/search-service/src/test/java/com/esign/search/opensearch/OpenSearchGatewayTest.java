package com.esign.search.opensearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.esign.search.model.BulkIndexResult;
import com.esign.search.model.ComponentHealth;
import com.esign.search.model.EntityType;
import com.esign.search.model.FacetBucket;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.HealthStatus;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SearchScore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class OpenSearchGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void executeScopesQueryToOrganizationAndCallerPermissions() throws Exception {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        SearchQuery query = new SearchQuery();
        query.setQuery("contract");
        query.setEntityTypes(List.of(EntityType.DOCUMENT));
        query.setHighlight(true);
        query.setFilters(Map.of("metadata.fileType", SearchFilter.term("pdf")));

        server.expect(requestTo("http://localhost:9200/search-document/_search"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                JsonNode bool = root.path("query").path("bool");

                assertThat(bool.path("must").get(0).path("term").path("organizationId").asText()).isEqualTo("acme");
                assertThat(root.path("track_total_hits").asBoolean()).isTrue();

                String filter = bool.path("filter").toString();
                assertThat(filter).contains("\"terms\":{\"type\":[\"document\"]}");
                assertThat(filter).contains("\"metadata.fileType\":\"pdf\"");
                assertThat(filter).contains("user:u1").contains("org:acme").contains("public");
                assertThat(bool.path("should").toString()).doesNotContain("permissions");

                assertThat(root.path("highlight").path("pre_tags").get(0).asText()).isEqualTo("<mark>");
                assertThat(root.path("aggs").path("tags").path("terms").path("field").asText()).isEqualTo("tags");
                assertThat(root.path("sort").get(0).asText()).isEqualTo("_score");
            })
            .andRespond(withSuccess("""
                {
                  "took": 7,
                  "hits": {
                    "total": {"value": 3},
                    "hits": [
                      {"_id": "d1", "_score": 2.5,
                       "_source": {"id": "d1", "type": "document", "title": "Master contract",
                                   "organizationId": "acme", "permissions": ["public"]},
                       "highlight": {"title": ["Master <mark>contract</mark>"]}},
                      {"_id": "d2", "_score": 1.5,
                       "_source": {"id": "d2", "type": "document", "title": "Draft",
                                   "organizationId": "acme", "userId": "u1"}},
                      {"_id": "d3", "_score": 1.0,
                       "_source": {"id": "d3", "type": "document", "title": "Leaked",
                                   "organizationId": "other", "permissions": ["public"]}}
                    ]
                  },
                  "aggregations": {
                    "tags": {"buckets": [{"key": "nda", "doc_count": 2}]}
                  }
                }
                """, MediaType.APPLICATION_JSON));

        EngineSearchResponse response = gateway.execute(query, "acme", "u1", List.of(FacetDefinition.terms("tags")));

        server.verify();
        assertThat(response.documents()).extracting(SearchDocument::getId).containsExactly("d1", "d2");
        assertThat(response.total()).isEqualTo(2);
        assertThat(response.tookMs()).isEqualTo(7);
        assertThat(response.documents().get(0).getScore().getTotal()).isEqualTo(2.5);
        assertThat(response.documents().get(0).getHighlight().get("title")).containsExactly("Master <mark>contract</mark>");
        assertThat(response.aggregations().get("tags")).extracting(FacetBucket::getKey).containsExactly("nda");
    }

    @Test
    void executeParsesRangeAndNestedAggregations() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/search-template/_search"))
            .andExpect(method(POST))
            .andRespond(withSuccess("""
                {
                  "hits": {"total": {"value": 0}, "hits": []},
                  "aggregations": {
                    "metadata.fileSize": {"buckets": [
                      {"key": "0-1000000", "from": 0.0, "to": 1000000.0, "doc_count": 4}
                    ]},
                    "signers": {"doc_count": 5, "signers.status": {"buckets": [
                      {"key": "signed", "doc_count": 3}
                    ]}}
                  }
                }
                """, MediaType.APPLICATION_JSON));

        SearchQuery query = new SearchQuery();
        query.setEntityTypes(List.of(EntityType.TEMPLATE));
        EngineSearchResponse response = gateway.execute(query, "acme", null, List.of());

        FacetBucket range = response.aggregations().get("metadata.fileSize").get(0);
        assertThat(range.getFrom()).isEqualTo(0.0);
        assertThat(range.getTo()).isEqualTo(1_000_000.0);
        assertThat(range.getCount()).isEqualTo(4);
        assertThat(response.aggregations().get("signers")).extracting(FacetBucket::getKey).containsExactly("signed");
    }

    @Test
    void executeRaisesUnavailableOnGatewayTimeout() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/search-document/_search"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        SearchQuery query = new SearchQuery();
        query.setEntityTypes(List.of(EntityType.DOCUMENT));

        assertThatThrownBy(() -> gateway.execute(query, "acme", null, List.of()))
            .isInstanceOf(OpenSearchUnavailableException.class);
    }

    @Test
    void bulkIndexReportsPerItemFailures() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/_bulk"))
            .andExpect(method(POST))
            .andExpect(request -> {
                assertThat(String.valueOf(request.getHeaders().getContentType())).startsWith("application/x-ndjson");
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                assertThat(body.split("\n")).hasSize(4);
                assertThat(body).contains("\"_index\":\"search-document\"").contains("\"indexed_at\"");
            })
            .andRespond(withSuccess("""
                {
                  "errors": true,
                  "items": [
                    {"index": {"_id": "d1", "status": 201}},
                    {"index": {"_id": "d2", "status": 400,
                               "error": {"type": "mapper_parsing_exception", "reason": "failed to parse field"}}}
                  ]
                }
                """, MediaType.APPLICATION_JSON));

        BulkIndexResult result = gateway.bulkIndex(List.of(document("d1", "acme"), document("d2", "acme")));

        server.verify();
        assertThat(result.total()).isEqualTo(2);
        assertThat(result.succeeded()).isEqualTo(1);
        assertThat(result.failures()).containsExactly(new BulkIndexResult.ItemFailure("d2", "failed to parse field"));
    }

    @Test
    void deleteOfMissingDocumentIsNotAnError() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/search-document/_doc/missing"))
            .andExpect(method(DELETE))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://localhost:9200/search-document/_doc/d1"))
            .andExpect(method(DELETE))
            .andRespond(withSuccess("{\"result\":\"deleted\"}", MediaType.APPLICATION_JSON));

        assertThat(gateway.deleteDocument("missing", EntityType.DOCUMENT)).isFalse();
        assertThat(gateway.deleteDocument("d1", EntityType.DOCUMENT)).isTrue();
        server.verify();
    }

    @Test
    void healthCheckClassifiesClusterStatus() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/_cluster/health"))
            .andExpect(method(GET))
            .andRespond(withSuccess("{\"status\":\"green\",\"number_of_nodes\":3}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://localhost:9200/_cluster/health"))
            .andRespond(withSuccess("{\"status\":\"yellow\",\"number_of_nodes\":1}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://localhost:9200/_cluster/health"))
            .andRespond(request -> {
                throw new IOException("connection refused");
            });

        ComponentHealth green = gateway.healthCheck();
        ComponentHealth yellow = gateway.healthCheck();
        ComponentHealth down = gateway.healthCheck();

        assertThat(green.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(green.details()).containsEntry("nodes", 3);
        assertThat(yellow.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(down.status()).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void ensureIndexCreatesMissingIndexWithDefaultMappings() throws Exception {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        OpenSearchProperties.IndexDefinition definition = new OpenSearchProperties.IndexDefinition();
        definition.setName("search-document");
        definition.setAliases(List.of("documents"));

        server.expect(requestTo("http://localhost:9200/search-document"))
            .andExpect(method(GET))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://localhost:9200/search-document"))
            .andExpect(method(PUT))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode properties = objectMapper.readTree(body).path("mappings").path("properties");
                assertThat(properties.path("organizationId").path("type").asText()).isEqualTo("keyword");
                assertThat(properties.path("suggest").path("type").asText()).isEqualTo("completion");
            })
            .andRespond(withSuccess("{\"acknowledged\":true}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://localhost:9200/search-document/_alias/documents"))
            .andExpect(method(PUT))
            .andRespond(withSuccess("{\"acknowledged\":true}", MediaType.APPLICATION_JSON));

        gateway.ensureIndex(definition);
        server.verify();
    }

    @Test
    void ensureIndexRejectsInvalidName() {
        OpenSearchGateway gateway = new OpenSearchGateway(new RestTemplate(), objectMapper, properties());
        OpenSearchProperties.IndexDefinition definition = new OpenSearchProperties.IndexDefinition();
        definition.setName("Bad Index");

        assertThatThrownBy(() -> gateway.ensureIndex(definition))
            .isInstanceOf(IndexConfigurationException.class)
            .hasMessageContaining("Bad Index");
    }

    @Test
    void sourceCarriesIndexedAtAndOrganizationScopedSuggestInput() {
        OpenSearchGateway gateway = new OpenSearchGateway(new RestTemplate(), objectMapper, properties());
        SearchDocument document = document("d1", "acme");
        document.setTags(new LinkedHashSet<>(Set.of("nda")));
        document.setScore(SearchScore.fromRelevance(3.0));

        Map<String, Object> source = gateway.toSource(document, Instant.parse("2024-05-01T10:00:00Z"));

        assertThat(source).doesNotContainKey("score");
        assertThat(source).containsEntry("indexed_at", "2024-05-01T10:00:00Z");
        assertThat(source.get("type")).isEqualTo("document");
        @SuppressWarnings("unchecked")
        Map<String, Object> suggest = (Map<String, Object>) source.get("suggest");
        assertThat(suggest.get("input")).isEqualTo(List.of("Title d1", "nda"));
        assertThat(suggest.get("contexts")).isEqualTo(Map.of("organizationId", List.of("acme")));
    }

    @Test
    void reindexingTheSameIdUpsertsTheLatestBody() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        for (String title : List.of("Draft NDA", "Signed NDA")) {
            server.expect(requestTo("http://localhost:9200/search-document/_doc/d1"))
                .andExpect(method(PUT))
                .andExpect(request -> {
                    String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                    JsonNode root = objectMapper.readTree(body);
                    assertThat(root.path("id").asText()).isEqualTo("d1");
                    assertThat(root.path("title").asText()).isEqualTo(title);
                    assertThat(root.path("indexed_at").asText()).isNotBlank();
                })
                .andRespond(withSuccess("{\"result\":\"updated\"}", MediaType.APPLICATION_JSON));
        }

        SearchDocument document = document("d1", "acme");
        document.setTitle("Draft NDA");
        gateway.indexDocument(document);
        document.setTitle("Signed NDA");
        gateway.indexDocument(document);

        server.verify();
    }

    @Test
    void documentIdsAreEncodedAsOnePathSegment() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo("http://localhost:9200/search-document/_doc/contract-%7Bv2%7D"))
            .andExpect(method(PUT))
            .andRespond(withSuccess("{\"result\":\"created\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://localhost:9200/search-folder/_doc/folder%2F42%3Fv%3D1%23a"))
            .andExpect(method(DELETE))
            .andRespond(withSuccess("{\"result\":\"deleted\"}", MediaType.APPLICATION_JSON));

        gateway.indexDocument(document("contract-{v2}", "acme"));
        assertThat(gateway.deleteDocument("folder/42?v=1#a", EntityType.FOLDER)).isTrue();

        server.verify();
    }

    @Test
    void reindexOrganizationRunsUpdateByQueryAcrossAllIndices() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        OpenSearchGateway gateway = new OpenSearchGateway(restTemplate, objectMapper, properties());

        server.expect(requestTo(allOf(
                containsString("search-document"),
                containsString("search-audit_log"),
                containsString("/_update_by_query?conflicts=proceed"))))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("query").path("term").path("organizationId").asText()).isEqualTo("acme");
                assertThat(root.path("script").path("lang").asText()).isEqualTo("painless");
            })
            .andRespond(withSuccess("{\"updated\":3}", MediaType.APPLICATION_JSON));

        assertThat(gateway.reindexOrganization("acme")).isEqualTo(3L);
        server.verify();
    }

    private SearchDocument document(String id, String organizationId) {
        SearchDocument document = new SearchDocument();
        document.setId(id);
        document.setEntityType(EntityType.DOCUMENT);
        document.setTitle("Title " + id);
        document.setOrganizationId(organizationId);
        return document;
    }

    private OpenSearchProperties properties() {
        OpenSearchProperties properties = new OpenSearchProperties();
        properties.setBaseUrl("http://localhost:9200");
        return properties;
    }
}
