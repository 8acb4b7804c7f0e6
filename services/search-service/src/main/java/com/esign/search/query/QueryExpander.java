package com.esign.search.query;

import com.esign.search.text.TextToolkit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Appends dictionary synonyms and stems to each token. Every input token is kept.
 */
@Component
public class QueryExpander {
    private final QueryProperties properties;
    private final TextToolkit textToolkit;

    public QueryExpander(QueryProperties properties, TextToolkit textToolkit) {
        this.properties = properties;
        this.textToolkit = textToolkit;
    }

    public String expand(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        Set<String> terms = new LinkedHashSet<>();
        for (String token : textToolkit.tokenize(text)) {
            terms.add(token);
            List<String> synonyms = properties.getSynonyms().get(token);
            if (synonyms != null) {
                synonyms.stream().limit(Math.max(0, properties.getMaxExpansions())).forEach(terms::add);
            }
            String stemmed = textToolkit.stem(token);
            if (stemmed != null && !stemmed.isEmpty() && !stemmed.equals(token)) {
                terms.add(stemmed);
            }
        }
        return String.join(" ", terms);
    }
}
