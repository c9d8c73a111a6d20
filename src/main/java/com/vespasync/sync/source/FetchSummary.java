package com.vespasync.sync.source;

public final class FetchSummary {
    public final String collection;
    public final int pagesOk;
    public final int pagesFailed;
    public final long records;
    public final int lastPage;
    public final boolean firstPageFailed;
    public final boolean cancelled;
    public final boolean exhausted;
    public final String firstPageError;

    FetchSummary(
            String collection,
            int pagesOk,
            int pagesFailed,
            long records,
            int lastPage,
            boolean firstPageFailed,
            boolean cancelled,
            boolean exhausted,
            String firstPageError
    ) {
        this.collection = collection;
        this.pagesOk = pagesOk;
        this.pagesFailed = pagesFailed;
        this.records = records;
        this.lastPage = lastPage;
        this.firstPageFailed = firstPageFailed;
        this.cancelled = cancelled;
        this.exhausted = exhausted;
        this.firstPageError = firstPageError == null ? "" : firstPageError;
    }

    /**
     * Every page up to the end of the collection was consumed or abandoned.
     */
    public boolean completed() {
        return exhausted && !cancelled && !firstPageFailed;
    }
}
