package com.vespasync.sync.source;

import com.vespasync.core.SyncReporter;
import com.vespasync.sync.checkpoint.CancellationToken;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PagedFetcherTest {
    private final SyncReporter reporter = new SyncReporter("FULL", Instant.parse("2025-03-01T00:00:00Z"));

    @Test
    void fetch_shouldDeliverPagesInOrder() {
        FakePageSource source = new FakePageSource(2).with("persons", records(7));
        List<Integer> seen = new ArrayList<>();
        List<String> ids = new ArrayList<>();

        FetchSummary summary = new PagedFetcher(source, 3, reporter, new CancellationToken())
                .fetch("persons", SourceFilter.none(), 1, page -> {
                    seen.add(page.page);
                    page.records.forEach(r -> ids.add(r.getString("id")));
                });

        assertEquals(List.of(1, 2, 3, 4), seen);
        assertEquals(List.of("r1", "r2", "r3", "r4", "r5", "r6", "r7"), ids);
        assertEquals(4, summary.pagesOk);
        assertEquals(7, summary.records);
        assertEquals(4, summary.lastPage);
        assertTrue(summary.completed());
    }

    @Test
    void fetch_shouldStartAtResumePage() {
        FakePageSource source = new FakePageSource(2).with("persons", records(6));
        List<Integer> seen = new ArrayList<>();

        FetchSummary summary = new PagedFetcher(source, 2, reporter, new CancellationToken())
                .fetch("persons", SourceFilter.none(), 2, page -> seen.add(page.page));

        assertEquals(List.of(2, 3), seen);
        assertFalse(source.requestedPages().contains("persons#1"));
        assertEquals(4, summary.records);
    }

    @Test
    void fetch_shouldSkipFailedMiddlePageAndContinue() {
        FakePageSource source = new FakePageSource(2).with("persons", records(6)).failPage("persons", 2);
        List<Integer> seen = new ArrayList<>();

        FetchSummary summary = new PagedFetcher(source, 1, reporter, new CancellationToken())
                .fetch("persons", SourceFilter.none(), 1, page -> seen.add(page.page));

        assertEquals(List.of(1, 3), seen);
        assertEquals(1, summary.pagesFailed);
        assertFalse(summary.firstPageFailed);
        assertEquals(1, reporter.warningCount("fetch_failed"));
        assertEquals(1, reporter.totalErrors());
    }

    @Test
    void fetch_shouldReportFirstPageFailure() {
        FakePageSource source = new FakePageSource(2).with("persons", records(6)).failPage("persons", 1);

        FetchSummary summary = new PagedFetcher(source, 2, reporter, new CancellationToken())
                .fetch("persons", SourceFilter.none(), 1, page -> {
                });

        assertTrue(summary.firstPageFailed);
        assertFalse(summary.completed());
        assertEquals("simulated http 503", summary.firstPageError);
        assertEquals(List.of("persons#1"), source.requestedPages());
    }

    @Test
    void fetch_shouldStopBetweenPagesWhenCancelled() {
        FakePageSource source = new FakePageSource(2).with("persons", records(8));
        CancellationToken token = new CancellationToken();
        List<Integer> seen = new ArrayList<>();

        FetchSummary summary = new PagedFetcher(source, 1, reporter, token)
                .fetch("persons", SourceFilter.none(), 1, page -> {
                    seen.add(page.page);
                    if (page.page == 2) {
                        token.cancel("test");
                    }
                });

        assertEquals(List.of(1, 2), seen);
        assertTrue(summary.cancelled);
        assertFalse(summary.completed());
        assertEquals(2, summary.lastPage);
    }

    @Test
    void fetch_shouldHandleEmptyCollection() {
        FakePageSource source = new FakePageSource(2);
        List<Integer> seen = new ArrayList<>();

        FetchSummary summary = new PagedFetcher(source, 2, reporter, new CancellationToken())
                .fetch("persons", SourceFilter.none(), 1, page -> seen.add(page.size()));

        assertEquals(List.of(0), seen);
        assertTrue(summary.completed());
        assertEquals(0, summary.records);
    }

    @Test
    void fetchAll_shouldCollectEveryRecord() {
        FakePageSource source = new FakePageSource(3).with("institutions", records(5));

        List<JSONObject> all = new PagedFetcher(source, 2, reporter, null).fetchAll("institutions", SourceFilter.none());

        assertEquals(5, all.size());
    }

    private static List<JSONObject> records(int n) {
        List<JSONObject> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            out.add(new JSONObject().put("id", "r" + i));
        }
        return out;
    }
}
