package com.esign.search.model;

public class Pagination {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;
    /**
     * The engine's default {@code index.max_result_window}; {@code from + size} may not pass it.
     */
    public static final int MAX_RESULT_WINDOW = 10_000;

    private Integer page;
    private Integer limit;

    public Pagination() {
    }

    public Pagination(Integer page, Integer limit) {
        this.page = page;
        this.limit = limit;
    }

    public int effectivePage() {
        if (page == null || page < 1) {
            return DEFAULT_PAGE;
        }
        return page;
    }

    public int effectiveLimit() {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.min(Math.max(limit, MIN_LIMIT), MAX_LIMIT);
    }

    /**
     * Start of the requested page, capped at {@link #MAX_RESULT_WINDOW}.
     */
    public int offset() {
        return (int) Math.min(requestedOffset(), MAX_RESULT_WINDOW);
    }

    public boolean exceedsResultWindow() {
        return requestedOffset() + effectiveLimit() > MAX_RESULT_WINDOW;
    }

    private long requestedOffset() {
        return (effectivePage() - 1L) * effectiveLimit();
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
