package com.esign.search.query;

import com.esign.search.text.TextToolkit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Per-token correction against a closed vocabulary. The allowed edit distance grows with token
 * length (0 up to 2 chars, 1 up to 5, then the configured maximum).
 */
@Component
public class SpellCorrector {
    private final QueryProperties properties;
    private final TextToolkit textToolkit;
    private final List<String> vocabulary;

    public SpellCorrector(QueryProperties properties, TextToolkit textToolkit) {
        this.properties = properties;
        this.textToolkit = textToolkit;
        TreeSet<String> words = new TreeSet<>();
        properties.getSynonyms().forEach((key, values) -> {
            words.add(key);
            words.addAll(values);
        });
        words.addAll(properties.getDocumentTypes());
        words.addAll(properties.getFileTypes());
        words.addAll(properties.getDictionary());
        this.vocabulary = List.copyOf(words);
    }

    public SpellCorrection correct(String text) {
        if (text == null || text.isBlank()) {
            return SpellCorrection.unchanged(text);
        }
        List<String> tokens = textToolkit.tokenize(text);
        List<String> corrected = new ArrayList<>(tokens.size());
        boolean changed = false;
        for (String token : tokens) {
            Optional<String> suggestion = suggest(token);
            if (suggestion.isPresent()) {
                corrected.add(suggestion.get());
                changed = true;
            } else {
                corrected.add(token);
            }
        }
        return changed ? new SpellCorrection(text, String.join(" ", corrected)) : SpellCorrection.unchanged(text);
    }

    public Optional<String> suggest(String token) {
        if (token.length() < 3 || isKnown(token) || token.chars().anyMatch(Character::isDigit)) {
            return Optional.empty();
        }
        int allowed = Math.min(properties.getSpellingMaxDistance(), token.length() <= 5 ? 1 : 2);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String word : vocabulary) {
            if (Math.abs(word.length() - token.length()) > allowed) {
                continue;
            }
            int distance = textToolkit.editDistance(token, word);
            if (distance <= allowed && distance < bestDistance) {
                best = word;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private boolean isKnown(String token) {
        if (vocabulary.contains(token)) {
            return true;
        }
        // plural forms of known words
        return token.endsWith("s")
            && (vocabulary.contains(token.substring(0, token.length() - 1))
                || token.endsWith("es") && vocabulary.contains(token.substring(0, token.length() - 2)));
    }

    List<String> vocabulary() {
        return vocabulary;
    }
}
