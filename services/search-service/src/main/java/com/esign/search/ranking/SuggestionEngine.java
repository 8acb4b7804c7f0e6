package com.esign.search.ranking;

import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchSuggestion;
import com.esign.search.model.SuggestionType;
import com.esign.search.query.SpellCorrection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Merges completion, correction and related-query suggestions for the caller's original text.
 */
@Component
public class SuggestionEngine {
    private final SuggestionProperties properties;

    public SuggestionEngine(SuggestionProperties properties) {
        this.properties = properties;
    }

    public List<SearchSuggestion> generate(
        String originalText,
        SpellCorrection correction,
        List<SearchDocument> results,
        PersonalizationProfile profile,
        boolean completionsEnabled
    ) {
        List<SearchSuggestion> suggestions = new ArrayList<>();
        if (completionsEnabled) {
            suggestions.addAll(completions(originalText));
        }
        if (correction != null && correction.changed()) {
            suggestions.add(correctionSuggestion(correction.corrected()));
        }
        suggestions.addAll(relatedFromTags(originalText, results));
        suggestions.addAll(relatedFromHistory(originalText, profile));
        return finish(suggestions);
    }

    public List<SearchSuggestion> completions(String text) {
        if (text == null || text.trim().length() < properties.getMinQueryLength()) {
            return List.of();
        }
        String prefix = text.toLowerCase(Locale.ROOT);
        List<SearchSuggestion> completions = new ArrayList<>();
        for (String candidate : properties.getCompletions()) {
            if (candidate.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                String highlight = "<mark>" + candidate.substring(0, text.length()) + "</mark>"
                    + candidate.substring(text.length());
                completions.add(new SearchSuggestion(candidate, SuggestionType.COMPLETION, properties.getCompletionScore(), highlight));
            }
        }
        return completions;
    }

    public SearchSuggestion engineCompletion(String text) {
        return new SearchSuggestion(text, SuggestionType.COMPLETION, properties.getEngineCompletionScore());
    }

    private SearchSuggestion correctionSuggestion(String corrected) {
        return new SearchSuggestion(
            corrected,
            SuggestionType.CORRECTION,
            properties.getCorrectionScore(),
            "Did you mean: <mark>" + corrected + "</mark>?"
        );
    }

    private List<SearchSuggestion> relatedFromTags(String text, List<SearchDocument> results) {
        if (text == null || text.isBlank() || results == null || results.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (SearchDocument document : results) {
            if (document.getTags() == null) {
                continue;
            }
            for (String tag : document.getTags()) {
                if (tag != null && !tag.isBlank()) {
                    frequency.merge(tag, 1, Integer::sum);
                }
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return frequency.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .map(Map.Entry::getKey)
            .filter(tag -> !lower.contains(tag.toLowerCase(Locale.ROOT)))
            .limit(properties.getMaxRelatedTags())
            .map(tag -> new SearchSuggestion(text + " " + tag, SuggestionType.PHRASE, properties.getTagScore()))
            .toList();
    }

    private List<SearchSuggestion> relatedFromHistory(String text, PersonalizationProfile profile) {
        if (profile == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (PersonalizationProfile.SearchHistoryEntry entry : profile.getBehavior().getSearchHistory()) {
            if (seen.size() >= properties.getMaxHistoryEntries()) {
                break;
            }
            String query = entry.query();
            if (query == null || query.isBlank() || query.equalsIgnoreCase(text)) {
                continue;
            }
            seen.add(query);
        }
        return seen.stream()
            .map(query -> new SearchSuggestion(query, SuggestionType.PHRASE, properties.getHistoryScore()))
            .toList();
    }

    /**
     * Drops low scores and duplicate texts, then keeps the best-scored suggestions.
     */
    public List<SearchSuggestion> finish(List<SearchSuggestion> suggestions) {
        Map<String, SearchSuggestion> byText = new LinkedHashMap<>();
        for (SearchSuggestion suggestion : suggestions) {
            if (suggestion.getScore() <= properties.getMinScore()) {
                continue;
            }
            String key = suggestion.getText().toLowerCase(Locale.ROOT);
            SearchSuggestion existing = byText.get(key);
            if (existing == null || existing.getScore() < suggestion.getScore()) {
                byText.put(key, suggestion);
            }
        }
        List<SearchSuggestion> ranked = new ArrayList<>(byText.values());
        ranked.sort(Comparator.comparingDouble(SearchSuggestion::getScore).reversed());
        return ranked.stream().limit(properties.getMaxSuggestions()).toList();
    }
}
