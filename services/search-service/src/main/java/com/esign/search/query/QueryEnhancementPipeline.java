package com.esign.search.query;

import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchIntent;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SortSpec;
import com.esign.search.service.SearchFeatureProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs intent recognition, spell correction, synonym expansion and the personalization rewrite
 * in that order. A failing stage leaves the query as the previous stage produced it.
 */
@Component
public class QueryEnhancementPipeline {
    private static final Logger log = LoggerFactory.getLogger(QueryEnhancementPipeline.class);

    private final IntentRecognizer intentRecognizer;
    private final SpellCorrector spellCorrector;
    private final QueryExpander queryExpander;
    private final MeterRegistry meterRegistry;

    public QueryEnhancementPipeline(
        IntentRecognizer intentRecognizer,
        SpellCorrector spellCorrector,
        QueryExpander queryExpander,
        MeterRegistry meterRegistry
    ) {
        this.intentRecognizer = intentRecognizer;
        this.spellCorrector = spellCorrector;
        this.queryExpander = queryExpander;
        this.meterRegistry = meterRegistry;
    }

    public EnhancedQuery enhance(SearchQuery query, PersonalizationProfile profile, SearchFeatureProperties features) {
        String originalText = query.getQuery();
        SearchQuery enhanced = query.copy();
        SearchIntent intent = SearchIntent.unknown();
        SpellCorrection correction = SpellCorrection.unchanged(originalText);

        if (features.isIntentRecognition() && enhanced.hasText()) {
            try {
                intent = intentRecognizer.recognize(enhanced.getQuery());
                enhanced = intentRecognizer.apply(enhanced, intent);
            } catch (RuntimeException e) {
                degraded("intent_recognition", e);
                intent = SearchIntent.unknown();
            }
        }

        if (features.isSpellCorrection() && enhanced.hasText()) {
            try {
                correction = spellCorrector.correct(enhanced.getQuery());
                if (correction.changed()) {
                    log.debug("query spelling corrected original={} corrected={}", originalText, correction.corrected());
                    enhanced.setQuery(correction.corrected());
                }
            } catch (RuntimeException e) {
                degraded("spell_correction", e);
                correction = SpellCorrection.unchanged(originalText);
            }
        }

        if (features.isQueryExpansion() && enhanced.hasText()) {
            try {
                String base = enhanced.getQuery();
                String expanded = queryExpander.expand(base);
                if (expanded != null && !expanded.isBlank() && !expanded.equals(base)) {
                    enhanced.setMatchText(base);
                    enhanced.setQuery(expanded);
                }
            } catch (RuntimeException e) {
                degraded("query_expansion", e);
            }
        }

        if (features.isPersonalizedRanking() && query.isPersonalize() && profile != null) {
            try {
                applyPreferences(enhanced, profile.getPreferences());
            } catch (RuntimeException e) {
                degraded("personalization_rewrite", e);
            }
        }
        return new EnhancedQuery(enhanced, originalText, intent, correction);
    }

    void applyPreferences(SearchQuery query, PersonalizationProfile.Preferences preferences) {
        if (preferences == null) {
            return;
        }
        if (!query.hasEntityTypes() && !preferences.getEntityTypes().isEmpty()) {
            query.setEntityTypes(new ArrayList<>(preferences.getEntityTypes()));
        }
        if (query.getSort() == null && preferences.getSortPreference() != null) {
            boolean byDate = PersonalizationProfile.Preferences.SORT_DATE.equals(preferences.getSortPreference());
            query.setSort(new SortSpec(byDate ? "createdAt" : "_score", SortSpec.DESC));
        }
        if (!query.hasFacets() && !preferences.getFacetPreferences().isEmpty()) {
            query.setFacets(new ArrayList<>(preferences.getFacetPreferences()));
        }
    }

    private void degraded(String stage, RuntimeException e) {
        log.warn("query stage degraded stage={}", stage, e);
        meterRegistry.counter("search_stage_degraded_total", "stage", stage).increment();
    }
}
