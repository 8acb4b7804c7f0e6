package com.esign.search.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.query")
public class QueryProperties {
    private double intentConfidenceThreshold = 0.6;
    private int maxExpansions = 5;
    private int spellingMaxDistance = 2;
    private Map<String, List<String>> synonyms = defaultSynonyms();
    private List<String> documentTypes = new ArrayList<>(List.of(
        "pdf", "doc", "docx", "contract", "invoice", "template", "form"));
    private List<String> fileTypes = new ArrayList<>(List.of("pdf", "doc", "docx", "txt", "xlsx"));
    private List<String> dictionary = new ArrayList<>(List.of(
        "nda", "employment", "service", "signature", "signed", "sign", "request", "folder",
        "organization", "audit", "log", "report", "policy", "proposal", "purchase", "order",
        "lease", "offer", "letter", "draft", "final", "review", "approval", "payment"));

    private static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("contract", List.of("agreement", "deal", "pact"));
        synonyms.put("document", List.of("file", "paper", "record"));
        synonyms.put("template", List.of("form", "format", "pattern"));
        synonyms.put("invoice", List.of("bill", "receipt", "statement"));
        synonyms.put("user", List.of("person", "individual", "member"));
        synonyms.put("create", List.of("make", "generate", "build"));
        synonyms.put("find", List.of("search", "locate", "discover"));
        synonyms.put("recent", List.of("latest", "new", "current"));
        synonyms.put("old", List.of("previous", "past", "former"));
        return synonyms;
    }

    public double getIntentConfidenceThreshold() {
        return intentConfidenceThreshold;
    }

    public void setIntentConfidenceThreshold(double intentConfidenceThreshold) {
        this.intentConfidenceThreshold = intentConfidenceThreshold;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    public void setMaxExpansions(int maxExpansions) {
        this.maxExpansions = maxExpansions;
    }

    public int getSpellingMaxDistance() {
        return spellingMaxDistance;
    }

    public void setSpellingMaxDistance(int spellingMaxDistance) {
        this.spellingMaxDistance = spellingMaxDistance;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms;
    }

    public List<String> getDocumentTypes() {
        return documentTypes;
    }

    public void setDocumentTypes(List<String> documentTypes) {
        this.documentTypes = documentTypes;
    }

    public List<String> getFileTypes() {
        return fileTypes;
    }

    public void setFileTypes(List<String> fileTypes) {
        this.fileTypes = fileTypes;
    }

    public List<String> getDictionary() {
        return dictionary;
    }

    public void setDictionary(List<String> dictionary) {
        this.dictionary = dictionary;
    }
}
