package com.esign.search.api.dto;

import com.esign.search.model.SearchSuggestion;
import java.util.List;

public record SuggestionsResponse(String query, List<SearchSuggestion> suggestions) {
}
