package com.esign.search.ranking;

import com.esign.search.model.PersonalizationProfile;
import com.esign.search.model.SearchDocument;
import com.esign.search.model.SearchScore;
import com.esign.search.text.TextToolkit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Blends personalization and text similarity into {@link SearchScore#getTotal()}. Sorting is
 * stable, so equal totals keep the engine's order.
 */
@Component
public class ResultRanker {
    private static final int MAX_CONTENT_CHARS = 2000;
    private static final Comparator<SearchDocument> BY_TOTAL_DESC =
        Comparator.comparingDouble((SearchDocument document) -> document.getScore().getTotal()).reversed();

    private final RankingProperties properties;
    private final TextToolkit textToolkit;

    public ResultRanker(RankingProperties properties, TextToolkit textToolkit) {
        this.properties = properties;
        this.textToolkit = textToolkit;
    }

    public List<SearchDocument> personalize(List<SearchDocument> documents, PersonalizationProfile profile) {
        List<SearchDocument> ranked = withScores(documents);
        if (profile == null) {
            return ranked;
        }
        Map<String, Integer> clicks = profile.getBehavior().getClickPatterns();
        PersonalizationProfile.Contextual contextual = profile.getContextual();
        for (SearchDocument document : ranked) {
            double personalization = 0.0;
            Integer clickCount = clicks.get(document.getId());
            if (clickCount != null && clickCount > 0) {
                personalization += clickCount * properties.getClickWeight();
            }
            if (document.getUserId() != null && contextual.getCollaborators().contains(document.getUserId())) {
                personalization += properties.getCollaboratorBonus();
            }
            if (contextual.getRecentDocuments().contains(document.getId())) {
                personalization += properties.getRecentDocumentBonus();
            }
            if (document.getEntityType() != null
                && profile.getPreferences().getEntityTypes().contains(document.getEntityType())) {
                personalization += properties.getPreferredTypeBonus();
            }
            SearchScore score = document.getScore();
            score.setPersonalization(personalization);
            score.setTotal(score.getTotal() + personalization * properties.getUserWeightFactor());
        }
        ranked.sort(BY_TOTAL_DESC);
        return ranked;
    }

    public List<SearchDocument> applySemanticSimilarity(List<SearchDocument> documents, String queryText) {
        List<SearchDocument> ranked = withScores(documents);
        if (queryText == null || queryText.isBlank()) {
            return ranked;
        }
        for (SearchDocument document : ranked) {
            double similarity = textToolkit.similarity(queryText, searchableText(document));
            if (similarity >= properties.getSemanticMinSimilarity()) {
                SearchScore score = document.getScore();
                score.setSemantic(similarity);
                score.setTotal(score.getTotal() + similarity * properties.getSemanticWeight());
            }
        }
        ranked.sort(BY_TOTAL_DESC);
        return ranked;
    }

    private List<SearchDocument> withScores(List<SearchDocument> documents) {
        List<SearchDocument> copy = new ArrayList<>(documents);
        for (SearchDocument document : copy) {
            if (document.getScore() == null) {
                document.setScore(SearchScore.fromRelevance(0.0));
            }
        }
        return copy;
    }

    private String searchableText(SearchDocument document) {
        StringBuilder text = new StringBuilder();
        if (document.getTitle() != null) {
            text.append(document.getTitle()).append(' ');
        }
        if (document.getContent() != null) {
            String content = document.getContent();
            text.append(content.length() > MAX_CONTENT_CHARS ? content.substring(0, MAX_CONTENT_CHARS) : content).append(' ');
        }
        if (document.getTags() != null) {
            text.append(String.join(" ", document.getTags()));
        }
        return text.toString();
    }
}
