package com.esign.search.query;

public record SpellCorrection(String original, String corrected) {

    public static SpellCorrection unchanged(String text) {
        return new SpellCorrection(text, text);
    }

    public boolean changed() {
        return corrected != null && !corrected.equals(original);
    }
}
