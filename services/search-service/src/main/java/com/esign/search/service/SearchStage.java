package com.esign.search.service;

import java.util.Locale;

/**
 * Steps of one search request, in order. Every step except {@link #EXECUTING} may be skipped or
 * degrade to its empty output.
 */
public enum SearchStage {
    IDLE,
    ENHANCING_QUERY,
    EXECUTING,
    SHAPING_FACETS,
    RANKING,
    SUGGESTING,
    TRACKING,
    RETURNED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
