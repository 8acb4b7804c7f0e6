package com.esign.search.text;

import java.util.List;

/**
 * Tokenizing, stemming and approximate string matching used by query enhancement, suggestions
 * and the semantic ranking stage.
 */
public interface TextToolkit {

    /**
     * Lower-cased word tokens in input order.
     */
    List<String> tokenize(String text);

    String stem(String token);

    int editDistance(String left, String right);

    /**
     * Token-level similarity of {@code query} against {@code text}, in [0,1].
     */
    default double similarity(String query, String text) {
        List<String> queryTokens = tokenize(query);
        List<String> textTokens = tokenize(text);
        if (queryTokens.isEmpty() || textTokens.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (String queryToken : queryTokens) {
            double best = 0.0;
            for (String textToken : textTokens) {
                best = Math.max(best, tokenSimilarity(queryToken, textToken));
                if (best == 1.0) {
                    break;
                }
            }
            sum += best;
        }
        return sum / queryTokens.size();
    }

    default double tokenSimilarity(String left, String right) {
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) editDistance(left, right) / longest;
    }
}
