package com.esign.search.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Dependency-free toolkit with deterministic suffix stripping.
 */
public class BasicTextToolkit implements TextToolkit {
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final List<String> SUFFIXES = List.of("ations", "ation", "ings", "ing", "edly", "ed", "ies", "es", "ly", "s");

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    @Override
    public String stem(String token) {
        if (token == null) {
            return null;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        for (String suffix : SUFFIXES) {
            if (lower.length() - suffix.length() >= 3 && lower.endsWith(suffix)) {
                String base = lower.substring(0, lower.length() - suffix.length());
                return "ies".equals(suffix) ? base + "y" : base;
            }
        }
        return lower;
    }

    @Override
    public int editDistance(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
