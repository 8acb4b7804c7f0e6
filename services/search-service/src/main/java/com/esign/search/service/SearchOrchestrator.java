package com.esign.search.service;

import com.esign.search.analytics.SearchAnalyticsService;
import com.esign.search.facet.FacetEngine;
import com.esign.search.model.BulkIndexResult;
import com.esign.search.model.ComponentHealth;
import com.esign.search.model.EntityType;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.FacetResult;
import com.esign.search.model.FacetSuggestion;
import com.esign.search.model.HealthReport;
import com.esign.search.model.HealthStatus;
import com.esign.search.model.Pagination;
import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchInsight;
import com.esign.search.model.SearchMetrics;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SearchResult;
import com.esign.search.model.SearchSuggestion;
import com.esign.search.model.TimeRange;
import com.esign.search.opensearch.EngineSearchResponse;
import com.esign.search.opensearch.OpenSearchGateway;
import com.esign.search.opensearch.OpenSearchUnavailableException;
import com.esign.search.query.EnhancedQuery;
import com.esign.search.query.QueryEnhancementPipeline;
import com.esign.search.query.SpellCorrection;
import com.esign.search.query.SpellCorrector;
import com.esign.search.ranking.ResultRanker;
import com.esign.search.ranking.SuggestionEngine;
import com.esign.search.text.TextToolkit;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one search request through enhancement, execution, facet shaping, ranking, suggestions and
 * tracking. Only execution may fail the request; the other stages fall back to their empty output.
 */
@Service
public class SearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);
    private static final String HEALTH_PROBE_TEXT = "search health probe";

    private final OpenSearchGateway gateway;
    private final QueryEnhancementPipeline enhancementPipeline;
    private final FacetEngine facetEngine;
    private final ResultRanker resultRanker;
    private final SuggestionEngine suggestionEngine;
    private final SpellCorrector spellCorrector;
    private final SearchAnalyticsService analyticsService;
    private final TextToolkit textToolkit;
    private final SearchFeatureProperties features;
    private final MeterRegistry meterRegistry;

    public SearchOrchestrator(
        OpenSearchGateway gateway,
        QueryEnhancementPipeline enhancementPipeline,
        FacetEngine facetEngine,
        ResultRanker resultRanker,
        SuggestionEngine suggestionEngine,
        SpellCorrector spellCorrector,
        SearchAnalyticsService analyticsService,
        TextToolkit textToolkit,
        SearchFeatureProperties features,
        MeterRegistry meterRegistry
    ) {
        this.gateway = gateway;
        this.enhancementPipeline = enhancementPipeline;
        this.facetEngine = facetEngine;
        this.resultRanker = resultRanker;
        this.suggestionEngine = suggestionEngine;
        this.spellCorrector = spellCorrector;
        this.analyticsService = analyticsService;
        this.textToolkit = textToolkit;
        this.features = features;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Creates missing indices and starts the analytics flush timer. An invalid index definition
     * is fatal; an unreachable engine is logged and reported by {@link #healthCheck()}.
     */
    public void initialize() {
        try {
            gateway.ensureIndices();
        } catch (OpenSearchUnavailableException e) {
            log.warn("opensearch unreachable during initialize, indices not verified", e);
        }
        if (features.isAnalytics()) {
            analyticsService.start();
        }
        log.info("search orchestrator initialized analytics={}", features.isAnalytics());
    }

    public void shutdown() {
        analyticsService.stop();
        log.info("search orchestrator shut down");
    }

    public SearchResult search(SearchQuery query, String organizationId, String userId, String sessionId) {
        if (query == null) {
            throw new InvalidSearchRequestException("search query is required");
        }
        requireOrganization(organizationId);
        if (query.effectivePagination().exceedsResultWindow()) {
            throw new InvalidSearchRequestException(
                "page is beyond the first " + Pagination.MAX_RESULT_WINDOW + " results");
        }
        meterRegistry.counter("search_requests_total").increment();

        long started = System.nanoTime();
        String queryId = UUID.randomUUID().toString();
        Pagination pagination = query.effectivePagination();

        PersonalizationProfile profile = null;
        if (userId != null) {
            profile = guarded(SearchStage.ENHANCING_QUERY, () -> analyticsService.loadProfile(userId, organizationId), null);
        }
        PersonalizationProfile activeProfile = profile;
        EnhancedQuery enhanced = guarded(
            SearchStage.ENHANCING_QUERY,
            () -> enhancementPipeline.enhance(query, activeProfile, features),
            EnhancedQuery.unmodified(query.copy())
        );
        SearchQuery effective = enhanced.query();

        List<FacetDefinition> facetDefinitions = features.isFacets()
            ? guarded(SearchStage.SHAPING_FACETS, () -> facetEngine.chooseFacets(effective), List.of())
            : List.of();

        EngineSearchResponse response;
        try {
            response = gateway.execute(effective, organizationId, userId, facetDefinitions);
        } catch (RuntimeException e) {
            meterRegistry.counter("search_errors_total", "stage", SearchStage.EXECUTING.tag()).increment();
            log.error("search execution failed queryId={} org={}", queryId, organizationId, e);
            if (features.isAnalytics()) {
                guarded(SearchStage.TRACKING, () -> analyticsService.track(
                    queryId, query, 0, elapsedMs(started), userId, organizationId, sessionId, true), null);
            }
            throw e;
        }

        List<FacetResult> facets = List.of();
        if (features.isFacets() && !facetDefinitions.isEmpty()) {
            facets = guarded(
                SearchStage.SHAPING_FACETS,
                () -> facetEngine.postProcess(response.aggregations(), effective, facetDefinitions),
                List.of()
            );
        }

        List<SearchDocument> documents = rank(response.documents(), query, enhanced, activeProfile);
        int limit = pagination.effectiveLimit();
        if (documents.size() > limit) {
            documents = new ArrayList<>(documents.subList(0, limit));
        }

        List<SearchSuggestion> suggestions = List.of();
        if (features.isSuggestions() && query.isSuggestions() && query.hasText()) {
            List<SearchDocument> ranked = documents;
            suggestions = guarded(
                SearchStage.SUGGESTING,
                () -> suggestionEngine.generate(
                    enhanced.originalText(), enhanced.correction(), ranked, activeProfile, features.isAutoComplete()),
                List.of()
            );
        }

        SearchResult result = new SearchResult();
        result.setDocuments(documents);
        result.setFacets(facets);
        result.setSuggestions(suggestions);
        result.setTotal(response.total());
        result.setPage(pagination.effectivePage());
        result.setLimit(limit);
        result.setSearchTime(elapsedMs(started));
        result.setAnalytics(new SearchResult.Analytics(queryId));

        if (features.isAnalytics()) {
            guarded(SearchStage.TRACKING, () -> analyticsService.track(
                queryId, query, response.total(), result.getSearchTime(), userId, organizationId, sessionId, false), null);
        }
        log.debug("search returned queryId={} org={} total={} tookMs={}",
            queryId, organizationId, result.getTotal(), result.getSearchTime());
        return result;
    }

    public List<SearchSuggestion> getSuggestions(String text, String organizationId, String userId) {
        requireOrganization(organizationId);
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<SearchSuggestion> suggestions = new ArrayList<>();
        if (features.isAutoComplete()) {
            suggestions.addAll(guarded(
                SearchStage.SUGGESTING,
                () -> gateway.suggestCompletions(text, organizationId).stream()
                    .map(suggestionEngine::engineCompletion)
                    .toList(),
                List.of()
            ));
        }
        SpellCorrection correction = features.isSpellCorrection()
            ? guarded(SearchStage.SUGGESTING, () -> spellCorrector.correct(text), SpellCorrection.unchanged(text))
            : SpellCorrection.unchanged(text);
        PersonalizationProfile profile = userId == null
            ? null
            : guarded(SearchStage.SUGGESTING, () -> analyticsService.loadProfile(userId, organizationId), null);
        suggestions.addAll(guarded(
            SearchStage.SUGGESTING,
            () -> suggestionEngine.generate(text, correction, List.of(), profile, features.isAutoComplete()),
            List.of()
        ));
        return suggestionEngine.finish(suggestions);
    }

    public void indexDocument(SearchDocument document) {
        validateDocument(document);
        gateway.indexDocument(document);
    }

    public BulkIndexResult bulkIndexDocuments(List<SearchDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return new BulkIndexResult(0, 0, List.of());
        }
        documents.forEach(this::validateDocument);
        return gateway.bulkIndex(documents);
    }

    /**
     * Returns false when the document was already absent.
     */
    public boolean deleteDocument(String documentId, EntityType entityType) {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidSearchRequestException("document id is required");
        }
        if (entityType == null) {
            throw new InvalidSearchRequestException("entity type is required");
        }
        return gateway.deleteDocument(documentId, entityType);
    }

    public void trackClick(String queryId, String documentId, int position, String userId, String organizationId) {
        requireOrganization(organizationId);
        if (queryId == null || queryId.isBlank() || documentId == null || documentId.isBlank()) {
            throw new InvalidSearchRequestException("queryId and documentId are required");
        }
        if (position < 1) {
            throw new InvalidSearchRequestException("position must be 1 or greater");
        }
        if (!features.isAnalytics()) {
            return;
        }
        guarded(SearchStage.TRACKING, () -> {
            analyticsService.trackClick(queryId, documentId, position, userId, organizationId);
            return null;
        }, null);
    }

    public SearchMetrics getSearchMetrics(String organizationId, TimeRange range) {
        requireOrganization(organizationId);
        SearchMetrics metrics = analyticsService.computeMetrics(organizationId, requireRange(range));
        metrics.setIndexHealth(gateway.indexHealth());
        return metrics;
    }

    public List<SearchInsight> getSearchInsights(String organizationId, TimeRange range) {
        requireOrganization(organizationId);
        return analyticsService.computeInsights(organizationId, requireRange(range));
    }

    public long reindexOrganization(String organizationId) {
        requireOrganization(organizationId);
        return gateway.reindexOrganization(organizationId);
    }

    public List<FacetSuggestion> getFacetSuggestions(SearchQuery query) {
        return facetEngine.suggestFacets(query == null ? new SearchQuery() : query);
    }

    public PersonalizationProfile updatePersonalizationProfile(
        String userId,
        String organizationId,
        PersonalizationProfile.Preferences preferences,
        PersonalizationProfile.Contextual contextual
    ) {
        requireOrganization(organizationId);
        if (userId == null || userId.isBlank()) {
            throw new InvalidSearchRequestException("user id is required");
        }
        if (preferences == null && contextual == null) {
            throw new InvalidSearchRequestException("preferences or contextual is required");
        }
        return analyticsService.updateProfile(userId, organizationId, preferences, contextual);
    }

    public HealthReport healthCheck() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("opensearch", gateway.healthCheck());
        components.put("analytics", analyticsHealth());
        components.put("ai", textToolkitHealth());
        components.put("facets", new ComponentHealth(
            HealthStatus.HEALTHY, Map.of("enabled", features.isFacets())));
        return new HealthReport(overall(components), components);
    }

    private List<SearchDocument> rank(
        List<SearchDocument> documents,
        SearchQuery query,
        EnhancedQuery enhanced,
        PersonalizationProfile profile
    ) {
        List<SearchDocument> ranked = new ArrayList<>(documents);
        if (features.isPersonalizedRanking() && query.isPersonalize() && profile != null) {
            List<SearchDocument> current = ranked;
            ranked = guarded(SearchStage.RANKING, () -> resultRanker.personalize(current, profile), current);
        }
        if (features.isSemanticSearch() && query.hasText()) {
            List<SearchDocument> current = ranked;
            ranked = guarded(
                SearchStage.RANKING,
                () -> resultRanker.applySemanticSimilarity(current, enhanced.originalText()),
                current
            );
        }
        return ranked;
    }

    private ComponentHealth analyticsHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("enabled", features.isAnalytics());
        details.put("running", analyticsService.isRunning());
        details.put("pending_events", analyticsService.pendingEvents());
        boolean healthy = !features.isAnalytics() || analyticsService.isRunning();
        return new ComponentHealth(healthy ? HealthStatus.HEALTHY : HealthStatus.DEGRADED, details);
    }

    private ComponentHealth textToolkitHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", textToolkit.getClass().getSimpleName());
        try {
            List<String> tokens = textToolkit.tokenize(HEALTH_PROBE_TEXT);
            return new ComponentHealth(tokens.isEmpty() ? HealthStatus.DEGRADED : HealthStatus.HEALTHY, details);
        } catch (RuntimeException e) {
            log.warn("text toolkit health probe failed", e);
            details.put("error", String.valueOf(e.getMessage()));
            return new ComponentHealth(HealthStatus.DEGRADED, details);
        }
    }

    private static HealthStatus overall(Map<String, ComponentHealth> components) {
        boolean degraded = false;
        for (ComponentHealth component : components.values()) {
            if (component.status() == HealthStatus.UNHEALTHY) {
                return HealthStatus.UNHEALTHY;
            }
            if (component.status() != HealthStatus.HEALTHY) {
                degraded = true;
            }
        }
        return degraded ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private <T> T guarded(SearchStage stage, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            meterRegistry.counter("search_stage_degraded_total", "stage", stage.tag()).increment();
            log.warn("search stage degraded stage={}", stage.tag(), e);
            return fallback;
        }
    }

    private void validateDocument(SearchDocument document) {
        if (document == null) {
            throw new InvalidSearchRequestException("document is required");
        }
        if (document.getId() == null || document.getId().isBlank()) {
            throw new InvalidSearchRequestException("document id is required");
        }
        if (document.getEntityType() == null) {
            throw new InvalidSearchRequestException("document entityType is required");
        }
        if (document.getOrganizationId() == null || document.getOrganizationId().isBlank()) {
            throw new InvalidSearchRequestException("document organizationId is required");
        }
    }

    private static void requireOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new InvalidSearchRequestException("organization id is required");
        }
    }

    private static TimeRange requireRange(TimeRange range) {
        if (range == null) {
            throw new InvalidSearchRequestException("time range is required");
        }
        return range;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
