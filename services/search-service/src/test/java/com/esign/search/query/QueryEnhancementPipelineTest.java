package com.esign.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.esign.search.model.EntityType;
import com.esign.search.model.IntentType;
import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchQuery;
import com.esign.search.service.SearchFeatureProperties;
import com.esign.search.text.BasicTextToolkit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryEnhancementPipelineTest {

    @Mock
    private IntentRecognizer failingRecognizer;

    private final QueryProperties properties = new QueryProperties();
    private final BasicTextToolkit toolkit = new BasicTextToolkit();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void correctsThenExpandsWhileKeepingOriginalText() {
        QueryEnhancementPipeline pipeline = pipeline(new IntentRecognizer(
            properties, toolkit, Clock.fixed(Instant.parse("2024-05-15T12:00:00Z"), ZoneOffset.UTC)));

        EnhancedQuery enhanced = pipeline.enhance(query("nda templat"), null, new SearchFeatureProperties());

        assertThat(enhanced.originalText()).isEqualTo("nda templat");
        assertThat(enhanced.correction().corrected()).isEqualTo("nda template");
        assertThat(enhanced.intent().type()).isEqualTo(IntentType.UNKNOWN);
        assertThat(enhanced.query().getMatchText()).isEqualTo("nda template");
        assertThat(enhanced.query().getQuery()).isEqualTo("nda template form format pattern");
    }

    @Test
    void disabledStagesLeaveQueryAsSubmitted() {
        QueryEnhancementPipeline pipeline = pipeline(failingRecognizer);
        SearchQuery query = query("nda templat");

        EnhancedQuery enhanced = pipeline.enhance(query, null, SearchFeatureProperties.allDisabled());

        assertThat(enhanced.query().getQuery()).isEqualTo("nda templat");
        assertThat(enhanced.query()).isNotSameAs(query);
        assertThat(enhanced.correction().changed()).isFalse();
    }

    @Test
    void failingIntentStageIsSkippedAndCounted() {
        when(failingRecognizer.recognize(anyString())).thenThrow(new IllegalStateException("boom"));
        QueryEnhancementPipeline pipeline = pipeline(failingRecognizer);

        EnhancedQuery enhanced = pipeline.enhance(query("invoce"), null, new SearchFeatureProperties());

        assertThat(enhanced.intent().type()).isEqualTo(IntentType.UNKNOWN);
        assertThat(enhanced.correction().corrected()).isEqualTo("invoice");
        assertThat(meterRegistry.counter("search_stage_degraded_total", "stage", "intent_recognition").count())
            .isEqualTo(1.0);
    }

    @Test
    void preferencesFillOnlyWhatTheCallerLeftOpen() {
        QueryEnhancementPipeline pipeline = pipeline(failingRecognizer);
        PersonalizationProfile.Preferences preferences = new PersonalizationProfile.Preferences();
        preferences.setEntityTypes(List.of(EntityType.TEMPLATE));
        preferences.setSortPreference(PersonalizationProfile.Preferences.SORT_DATE);
        preferences.setFacetPreferences(List.of("status"));

        SearchQuery open = new SearchQuery();
        pipeline.applyPreferences(open, preferences);
        assertThat(open.getEntityTypes()).containsExactly(EntityType.TEMPLATE);
        assertThat(open.getSort().getField()).isEqualTo("createdAt");
        assertThat(open.getFacets()).containsExactly("status");

        SearchQuery explicit = new SearchQuery();
        explicit.setEntityTypes(List.of(EntityType.DOCUMENT));
        pipeline.applyPreferences(explicit, preferences);
        assertThat(explicit.getEntityTypes()).containsExactly(EntityType.DOCUMENT);
    }

    private QueryEnhancementPipeline pipeline(IntentRecognizer recognizer) {
        return new QueryEnhancementPipeline(
            recognizer,
            new SpellCorrector(properties, toolkit),
            new QueryExpander(properties, toolkit),
            meterRegistry
        );
    }

    private SearchQuery query(String text) {
        SearchQuery query = new SearchQuery();
        query.setQuery(text);
        return query;
    }
}
