package com.esign.search.text;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.KeywordTokenizer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.search.spell.LevenshteinDistance;

public class LuceneTextToolkit implements TextToolkit {
    private final LevenshteinDistance levenshtein = new LevenshteinDistance();

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Tokenizer tokenizer = new StandardTokenizer();
        tokenizer.setReader(new StringReader(text));
        return drain(new LowerCaseFilter(tokenizer));
    }

    @Override
    public String stem(String token) {
        if (token == null || token.isBlank()) {
            return token;
        }
        Tokenizer tokenizer = new KeywordTokenizer();
        tokenizer.setReader(new StringReader(token));
        List<String> stemmed = drain(new PorterStemFilter(new LowerCaseFilter(tokenizer)));
        return stemmed.isEmpty() ? token : stemmed.get(0);
    }

    @Override
    public int editDistance(String left, String right) {
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 0;
        }
        // getDistance is 1 - d / longest
        float similarity = levenshtein.getDistance(left, right);
        return Math.round((1.0f - similarity) * longest);
    }

    private List<String> drain(TokenStream stream) {
        List<String> tokens = new ArrayList<>();
        try (TokenStream tokenStream = stream) {
            CharTermAttribute term = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(term.toString());
            }
            tokenStream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to analyze text", e);
        }
        return tokens;
    }
}
