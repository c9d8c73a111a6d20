package com.vespasync.sync.source;

import com.vespasync.core.SyncReporter;
import com.vespasync.sync.checkpoint.CancellationToken;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Walks a collection page by page. The first page is fetched on the calling thread to learn
 * the page count; later pages are fetched in windows on a bounded pool and handed to the
 * {@link PageHandler} strictly in page order on the calling thread.
 * <p>
 * Fetching stops after a page shorter than the page size, at the reported page count, or when
 * the cancellation token is set between pages. A page that fails after its retries is counted
 * and skipped.
 */
public final class PagedFetcher {
    private final PageSource source;
    private final int concurrency;
    private final SyncReporter reporter;
    private final CancellationToken token;

    public PagedFetcher(PageSource source, int concurrency, SyncReporter reporter, CancellationToken token) {
        this.source = source;
        this.concurrency = Math.max(1, concurrency);
        this.reporter = reporter;
        this.token = token == null ? new CancellationToken() : token;
    }

    public FetchSummary fetch(String collection, SourceFilter filter, int startPage, PageHandler handler) {
        int pageSize = Math.max(1, source.defaultPageSize());
        int page = Math.max(1, startPage);
        Progress progress = new Progress();

        SourcePage first;
        try {
            first = source.fetchPage(collection, filter, page, pageSize);
        } catch (FetchException e) {
            reporter.recordPage(collection, 0, true);
            reporter.warn("fetch_failed", describe(collection, e));
            return new FetchSummary(collection, 0, 1, 0L, page - 1, true, false, false, e.getMessage());
        }
        progress.consumed(first, handler, reporter);
        if (first.size() < pageSize || first.totalPages <= page) {
            return progress.summary(collection, false, true);
        }
        if (token.isCancelled()) {
            return progress.summary(collection, true, false);
        }

        int totalPages = first.totalPages;
        int next = page + 1;
        boolean cancelled = false;
        boolean stop = false;
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, totalPages - page));
        try {
            while (next <= totalPages && !stop) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                int windowEnd = Math.min(totalPages, next + concurrency - 1);
                List<Future<SourcePage>> window = new ArrayList<>(windowEnd - next + 1);
                for (int p = next; p <= windowEnd; p++) {
                    final int pageNo = p;
                    window.add(pool.submit(() -> source.fetchPage(collection, filter, pageNo, pageSize)));
                }
                for (int i = 0; i < window.size(); i++) {
                    Future<SourcePage> future = window.get(i);
                    if (stop) {
                        future.cancel(true);
                        continue;
                    }
                    int pageNo = next + i;
                    try {
                        SourcePage fetched = future.get();
                        progress.consumed(fetched, handler, reporter);
                        if (fetched.size() < pageSize) {
                            stop = true;
                        }
                    } catch (ExecutionException ee) {
                        Throwable cause = ee.getCause();
                        progress.failed(pageNo);
                        reporter.recordPage(collection, 0, true);
                        if (cause instanceof FetchException) {
                            reporter.warn("fetch_failed", describe(collection, (FetchException) cause));
                        } else {
                            reporter.warn("fetch_failed", collection + " page=" + pageNo + " err=" + cause);
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        token.cancel("interrupted");
                    }
                    if (token.isCancelled() && !stop) {
                        cancelled = true;
                        stop = true;
                    }
                }
                next = windowEnd + 1;
            }
        } finally {
            pool.shutdownNow();
        }
        boolean exhausted = !cancelled;
        return progress.summary(collection, cancelled, exhausted);
    }

    /**
     * Collects every record of a collection; pages that fail are skipped.
     */
    public List<JSONObject> fetchAll(String collection, SourceFilter filter) {
        List<JSONObject> out = new ArrayList<>();
        fetch(collection, filter, 1, page -> out.addAll(page.records));
        return out;
    }

    private String describe(String collection, FetchException e) {
        return String.format(Locale.US, "%s page=%d attempts=%d category=%s err=%s",
                collection, e.page(), e.attempts(), e.category(), e.getMessage());
    }

    private static final class Progress {
        private int pagesOk;
        private int pagesFailed;
        private long records;
        private int lastPage;

        void consumed(SourcePage page, PageHandler handler, SyncReporter reporter) {
            handler.onPage(page);
            reporter.recordPage(page.collection, page.size(), false);
            pagesOk++;
            records += page.size();
            lastPage = page.page;
        }

        void failed(int pageNo) {
            pagesFailed++;
            lastPage = pageNo;
        }

        FetchSummary summary(String collection, boolean cancelled, boolean exhausted) {
            return new FetchSummary(collection, pagesOk, pagesFailed, records, lastPage, false, cancelled, exhausted, "");
        }
    }
}
