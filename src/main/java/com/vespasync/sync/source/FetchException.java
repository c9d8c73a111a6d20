package com.vespasync.sync.source;

/**
 * A page could not be fetched within the retry budget.
 */
public class FetchException extends Exception {
    private final String category;
    private final int page;
    private final int attempts;

    public FetchException(String message, String category, int page, int attempts, Throwable cause) {
        super(message, cause);
        this.category = category == null || category.isBlank() ? "other" : category;
        this.page = page;
        this.attempts = attempts;
    }

    /**
     * One of timeout, rate_limit, http_status, parse, interrupted, other.
     */
    public String category() {
        return category;
    }

    public int page() {
        return page;
    }

    public int attempts() {
        return attempts;
    }
}
