package com.esign.search.api;

import com.esign.search.api.dto.ClickRequest;
import com.esign.search.api.dto.ProfileUpdateRequest;
import com.esign.search.api.dto.SuggestionsResponse;
import com.esign.search.model.BulkIndexResult;
import com.esign.search.model.EntityType;
import com.esign.search.model.FacetSuggestion;
import com.esign.search.model.HealthReport;
import com.esign.search.model.HealthStatus;
import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchInsight;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SearchResult;
import com.esign.search.model.TimeRange;
import com.esign.search.service.InvalidSearchRequestException;
import com.esign.search.service.SearchOrchestrator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Duration DEFAULT_REPORT_WINDOW = Duration.ofDays(7);

    private final SearchOrchestrator orchestrator;
    private final Clock clock;

    public SearchController(SearchOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = orchestrator.healthCheck();
        HttpStatus status = report.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @PostMapping("/search")
    public SearchResult search(
        @RequestBody(required = false) SearchQuery query,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId,
        @RequestHeader(value = RequestHeaders.USER_ID, required = false) String userId,
        @RequestHeader(value = RequestHeaders.SESSION_ID, required = false) String sessionId
    ) {
        if (query == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        return orchestrator.search(
            query,
            RequestHeaders.identity(organizationId),
            RequestHeaders.identity(userId),
            RequestHeaders.identity(sessionId)
        );
    }

    @GetMapping("/suggestions")
    public SuggestionsResponse suggestions(
        @RequestParam(value = "q", required = false) String text,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId,
        @RequestHeader(value = RequestHeaders.USER_ID, required = false) String userId
    ) {
        return new SuggestionsResponse(
            text,
            orchestrator.getSuggestions(text, RequestHeaders.identity(organizationId), RequestHeaders.identity(userId))
        );
    }

    @PostMapping("/documents")
    public ResponseEntity<Map<String, String>> indexDocument(@RequestBody(required = false) SearchDocument document) {
        orchestrator.indexDocument(document);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "indexed", "id", document.getId()));
    }

    @PostMapping("/documents/_bulk")
    public BulkIndexResult bulkIndex(@RequestBody(required = false) List<SearchDocument> documents) {
        return orchestrator.bulkIndexDocuments(documents);
    }

    @DeleteMapping("/documents/{entityType}/{id}")
    public Map<String, Object> deleteDocument(
        @PathVariable("entityType") String entityType,
        @PathVariable("id") String id
    ) {
        boolean deleted = orchestrator.deleteDocument(id, EntityType.fromValue(entityType));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("deleted", deleted);
        return body;
    }

    @PostMapping("/clicks")
    public ResponseEntity<Void> trackClick(
        @RequestBody(required = false) ClickRequest click,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId,
        @RequestHeader(value = RequestHeaders.USER_ID, required = false) String userId
    ) {
        if (click == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        orchestrator.trackClick(
            click.getQueryId(),
            click.getDocumentId(),
            click.getPosition(),
            RequestHeaders.identity(userId),
            RequestHeaders.identity(organizationId)
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @GetMapping("/metrics")
    public SearchMetrics metrics(
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId
    ) {
        return orchestrator.getSearchMetrics(RequestHeaders.identity(organizationId), timeRange(from, to));
    }

    @GetMapping("/insights")
    public List<SearchInsight> insights(
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId
    ) {
        return orchestrator.getSearchInsights(RequestHeaders.identity(organizationId), timeRange(from, to));
    }

    @PostMapping("/organizations/{organizationId}/reindex")
    public Map<String, Object> reindex(@PathVariable("organizationId") String organizationId) {
        long updated = orchestrator.reindexOrganization(organizationId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("organization_id", organizationId);
        body.put("updated", updated);
        return body;
    }

    @PostMapping("/facets/suggestions")
    public List<FacetSuggestion> facetSuggestions(@RequestBody(required = false) SearchQuery query) {
        return orchestrator.getFacetSuggestions(query);
    }

    @PutMapping("/profiles/{userId}")
    public PersonalizationProfile updateProfile(
        @PathVariable("userId") String userId,
        @RequestBody(required = false) ProfileUpdateRequest updates,
        @RequestHeader(value = RequestHeaders.ORGANIZATION_ID, required = false) String organizationId
    ) {
        if (updates == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        return orchestrator.updatePersonalizationProfile(
            userId,
            RequestHeaders.identity(organizationId),
            updates.getPreferences(),
            updates.getContextual()
        );
    }

    private TimeRange timeRange(String from, String to) {
        Instant end = to == null || to.isBlank() ? clock.instant() : Instant.parse(to.trim());
        Instant start = from == null || from.isBlank() ? end.minus(DEFAULT_REPORT_WINDOW) : Instant.parse(from.trim());
        return new TimeRange(start, end);
    }
}
