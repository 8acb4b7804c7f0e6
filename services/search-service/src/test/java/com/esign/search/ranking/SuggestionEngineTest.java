package com.esign.search.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchSuggestion;
import com.esign.search.model.SuggestionType;
import com.esign.search.query.SpellCorrection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SuggestionEngineTest {

    private final SuggestionEngine engine = new SuggestionEngine(new SuggestionProperties());

    @Test
    void mergesCorrectionCompletionsTagsAndHistoryByScore() {
        PersonalizationProfile profile = PersonalizationProfile.empty("u1", "org1");
        profile.getBehavior().getSearchHistory().add(
            new PersonalizationProfile.SearchHistoryEntry("nda", Instant.parse("2024-05-01T00:00:00Z"), 3));
        profile.getBehavior().getSearchHistory().add(
            new PersonalizationProfile.SearchHistoryEntry("templat", Instant.parse("2024-05-01T00:00:00Z"), 0));
        List<SearchDocument> results = List.of(tagged("legal"), tagged("legal"), tagged("hr"));

        List<SearchSuggestion> suggestions = engine.generate(
            "templat", new SpellCorrection("templat", "template"), results, profile, true);

        assertThat(suggestions).extracting(SearchSuggestion::getText).containsExactly(
            "template", "template library", "templates shared with me", "templat legal", "templat hr", "nda");
        assertThat(suggestions.get(0).getType()).isEqualTo(SuggestionType.CORRECTION);
        assertThat(suggestions.get(0).getHighlight()).isEqualTo("Did you mean: <mark>template</mark>?");
        assertThat(suggestions.get(1).getHighlight()).isEqualTo("<mark>templat</mark>e library");
        assertThat(suggestions.get(5).getType()).isEqualTo(SuggestionType.PHRASE);
    }

    @Test
    void completionsNeedMinimumLengthAndCanBeDisabled() {
        assertThat(engine.completions("t")).isEmpty();
        assertThat(engine.generate("templat", SpellCorrection.unchanged("templat"), List.of(), null, false)).isEmpty();
    }

    @Test
    void finishDeduplicatesKeepingBestScoreAndCaps() {
        List<SearchSuggestion> raw = new ArrayList<>();
        raw.add(new SearchSuggestion("Lease", SuggestionType.PHRASE, 0.5));
        raw.add(new SearchSuggestion("lease", SuggestionType.COMPLETION, 0.8));
        raw.add(new SearchSuggestion("weak", SuggestionType.PHRASE, 0.3));
        IntStream.range(0, 12).forEach(i -> raw.add(new SearchSuggestion("s" + i, SuggestionType.PHRASE, 0.4)));

        List<SearchSuggestion> finished = engine.finish(raw);

        assertThat(finished).hasSize(10);
        assertThat(finished.get(0).getText()).isEqualTo("lease");
        assertThat(finished.get(0).getScore()).isEqualTo(0.8);
        assertThat(finished).extracting(SearchSuggestion::getText).doesNotContain("weak", "Lease");
    }

    @Test
    void tagsAlreadyInTheQueryDoNotUseUpRelatedTagSlots() {
        SuggestionProperties properties = new SuggestionProperties();
        properties.setMaxRelatedTags(2);
        SuggestionEngine limited = new SuggestionEngine(properties);
        List<SearchDocument> results = List.of(
            tagged("nda"), tagged("nda"), tagged("nda"), tagged("legal"), tagged("legal"), tagged("hr"));

        List<SearchSuggestion> suggestions = limited.generate(
            "nda lease", SpellCorrection.unchanged("nda lease"), results, null, false);

        assertThat(suggestions).extracting(SearchSuggestion::getText)
            .containsExactly("nda lease legal", "nda lease hr");
    }

    private SearchDocument tagged(String tag) {
        SearchDocument document = new SearchDocument();
        document.setTags(Set.of(tag));
        return document;
    }
}
