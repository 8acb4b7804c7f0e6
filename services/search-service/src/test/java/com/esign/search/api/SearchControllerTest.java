package com.esign.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.esign.search.model.ComponentHealth;
import com.esign.search.model.EntityType;
import com.esign.search.model.HealthReport;
import com.esign.search.model.HealthStatus;
import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.SearchResult;
import com.esign.search.model.TimeRange;
import com.esign.search.opensearch.OpenSearchUnavailableException;
import com.esign.search.service.InvalidSearchRequestException;
import com.esign.search.service.SearchOrchestrator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
@Import(SearchControllerTest.FixedClockConfig.class)
class SearchControllerTest {
    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchOrchestrator orchestrator;

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Test
    void searchPassesCallerHeadersToOrchestrator() throws Exception {
        SearchDocument document = new SearchDocument();
        document.setId("d1");
        document.setEntityType(EntityType.DOCUMENT);
        document.setTitle("Mutual NDA");
        SearchResult result = new SearchResult();
        result.setDocuments(List.of(document));
        result.setTotal(1);
        result.setPage(1);
        result.setLimit(20);
        result.setAnalytics(new SearchResult.Analytics("q-1"));
        when(orchestrator.search(any(), eq("org1"), eq("u1"), isNull())).thenReturn(result);

        mockMvc.perform(post("/search")
                .header("x-organization-id", "org1")
                .header("x-user-id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"nda\",\"filters\":{\"status\":[\"signed\",\"sent\"]},\"pagination\":{\"page\":1,\"limit\":20}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documents[0].id").value("d1"))
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.analytics.queryId").value("q-1"));
    }

    @Test
    void searchWithoutOrganizationIsBadRequest() throws Exception {
        when(orchestrator.search(any(), isNull(), isNull(), isNull()))
            .thenThrow(new InvalidSearchRequestException("organization id is required"));

        mockMvc.perform(post("/search")
                .header("x-trace-id", "trace-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"nda\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("organization id is required"))
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.request_id").isNotEmpty());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/search")
                .header("x-organization-id", "org1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("Invalid request body"));
    }

    @Test
    void engineOutageIsServiceUnavailable() throws Exception {
        when(orchestrator.search(any(), eq("org1"), isNull(), isNull()))
            .thenThrow(new OpenSearchUnavailableException("down", null));

        mockMvc.perform(post("/search")
                .header("x-organization-id", "org1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"nda\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.code").value("opensearch_unavailable"));
    }

    @Test
    void unhealthyReportReturnsServiceUnavailable() throws Exception {
        when(orchestrator.healthCheck()).thenReturn(new HealthReport(
            HealthStatus.UNHEALTHY,
            Map.of("opensearch", new ComponentHealth(HealthStatus.UNHEALTHY, Map.of("error", "down")))
        ));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("unhealthy"))
            .andExpect(jsonPath("$.components.opensearch.status").value("unhealthy"));
    }

    @Test
    void clickIsAccepted() throws Exception {
        mockMvc.perform(post("/clicks")
                .header("x-organization-id", "org1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query_id\":\"q-1\",\"document_id\":\"d1\",\"position\":2}"))
            .andExpect(status().isAccepted());

        verify(orchestrator).trackClick("q-1", "d1", 2, null, "org1");
    }

    @Test
    void metricsDefaultToTheLastSevenDays() throws Exception {
        TimeRange expected = new TimeRange(NOW.minus(Duration.ofDays(7)), NOW);
        when(orchestrator.getSearchMetrics("org1", expected)).thenReturn(new SearchMetrics());

        mockMvc.perform(get("/metrics").header("x-organization-id", "org1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.usage.totalQueries").value(0));
    }

    @Test
    void invalidMetricsWindowIsBadRequest() throws Exception {
        mockMvc.perform(get("/metrics")
                .header("x-organization-id", "org1")
                .param("from", "yesterday"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void deleteReportsWhetherDocumentExisted() throws Exception {
        when(orchestrator.deleteDocument("d1", EntityType.TEMPLATE)).thenReturn(false);

        mockMvc.perform(delete("/documents/template/d1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("d1"))
            .andExpect(jsonPath("$.deleted").value(false));
    }

    @Test
    void profileUpdatePassesOnlyProvidedSections() throws Exception {
        when(orchestrator.updatePersonalizationProfile(eq("u1"), eq("org1"), any(), isNull()))
            .thenReturn(PersonalizationProfile.empty("u1", "org1"));

        mockMvc.perform(put("/profiles/u1")
                .header("x-organization-id", "org1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"preferences\":{\"sortPreference\":\"date\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value("u1"));
    }
}
