package com.vespasync.sync.source;

import com.vespasync.sync.config.Config;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Page reader for the Knack object records API.
 * <p>
 * Every request carries a bounded timeout; 429, 5xx and transport failures are retried with
 * exponential backoff up to {@code knack.retry_count} times, other statuses fail at once.
 */
public class KnackClient implements PageSource {
    private final String baseUrl;
    private final String appId;
    private final String apiKey;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final long requestPauseMs;
    private final int rowsPerPage;
    private final Config config;
    private final HttpClient httpClient;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    public KnackClient(Config config, String appId, String apiKey) {
        if (appId == null || appId.isBlank() || apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("knack application id and api key are required");
        }
        this.config = config;
        this.baseUrl = trimTrailingSlash(config.getString("knack.base_url", "https://api.knack.com/v1"));
        this.appId = appId.trim();
        this.apiKey = apiKey.trim();
        this.timeoutSec = Math.max(1, config.getInt("knack.request_timeout_sec", 30));
        this.retryCount = Math.max(0, config.getInt("knack.retry_count", 3));
        this.retrySleepMs = Math.max(0L, config.getLong("knack.retry_sleep_ms", 2000L));
        this.requestPauseMs = Math.max(0L, config.getLong("knack.request_pause_ms", 0L));
        this.rowsPerPage = Math.max(1, Math.min(1000, config.getInt("knack.rows_per_page", 500)));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public int defaultPageSize() {
        return rowsPerPage;
    }

    @Override
    public SourcePage fetchPage(String collection, SourceFilter filter, int page, int pageSize) throws FetchException {
        String objectKey = config.getString("source.object." + collection, "");
        if (objectKey.isEmpty()) {
            throw new FetchException("no source object configured for collection " + collection,
                    "other", page, 0, null);
        }
        URI uri = buildUri(objectKey, filter, page, pageSize);

        String lastError = "";
        String lastCategory = "other";
        Exception lastCause = null;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                throttleRequest(requestPauseMs);
                RawResponse response = execute(uri);
                if (response.status() / 100 != 2) {
                    throw new HttpStatusException(response.status(), "knack http status=" + response.status()
                            + " object=" + objectKey + " page=" + page);
                }
                return parsePage(collection, page, response.body());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException("knack_fetch_interrupted", "interrupted", page, attempt + 1, ie);
            } catch (Exception e) {
                lastCause = e;
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastCategory = e instanceof HttpTimeoutException ? "timeout" : classifyFailureMessage(lastError);
                if (attempt >= retryCount || !isRetryable(e, lastCategory)) {
                    throw new FetchException(lastError, lastCategory, page, attempt + 1, e);
                }
                long backoff = retrySleepMs * (1L << Math.min(attempt, 10));
                System.err.println(String.format(Locale.US,
                        "WARN: knack fetch retry collection=%s page=%d attempt=%d category=%s backoff_ms=%d err=%s",
                        collection, page, attempt + 1, lastCategory, backoff, lastError));
                try {
                    sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchException("knack_fetch_interrupted", "interrupted", page, attempt + 1, ie);
                }
            }
        }
        throw new FetchException(lastError.isEmpty() ? "knack_fetch_failed" : lastError,
                lastCategory, page, retryCount + 1, lastCause);
    }

    /**
     * Issues one GET; overridden in tests.
     */
    protected RawResponse execute(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("X-Knack-Application-Id", appId)
                .header("X-Knack-REST-API-Key", apiKey)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(timeoutSec))
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        return new RawResponse(response.statusCode(), response.body());
    }

    protected void sleep(long millis) throws InterruptedException {
        if (millis > 0L) {
            Thread.sleep(millis);
        }
    }

    URI buildUri(String objectKey, SourceFilter filter, int page, int pageSize) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/objects/").append(objectKey).append("/records")
                .append("?page=").append(Math.max(1, page))
                .append("&rows_per_page=").append(Math.max(1, pageSize));
        if (filter != null && !filter.isEmpty()) {
            url.append("&filters=").append(URLEncoder.encode(filter.toJson().toString(), StandardCharsets.UTF_8));
        }
        return URI.create(url.toString());
    }

    private SourcePage parsePage(String collection, int page, String body) {
        JSONObject root;
        try {
            root = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            String text = body == null ? "" : body;
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_knack_payload:" + sample, e);
        }
        JSONArray arr = root.optJSONArray("records");
        List<JSONObject> records = new ArrayList<>(arr == null ? 0 : arr.length());
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject item = arr.optJSONObject(i);
                if (item != null) {
                    records.add(item);
                }
            }
        }
        int totalPages = root.optInt("total_pages", records.isEmpty() ? 0 : page);
        return new SourcePage(collection, page, totalPages, records);
    }

    public static String classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        if (msg.contains("http status=429") || msg.contains("rate limit")) {
            return "rate_limit";
        }
        if (msg.contains("http status=")) {
            return "http_status";
        }
        if (msg.contains("unexpected_knack_payload")) {
            return "parse";
        }
        return "other";
    }

    private boolean isRetryable(Exception e, String category) {
        if ("timeout".equals(category) || "rate_limit".equals(category)) {
            return true;
        }
        if (e instanceof IOException) {
            return true;
        }
        return e instanceof HttpStatusException && ((HttpStatusException) e).status / 100 == 5;
    }

    /**
     * Non-2xx answer from the source API.
     */
    static final class HttpStatusException extends IllegalStateException {
        private static final long serialVersionUID = 1L;

        final int status;

        HttpStatusException(int status, String message) {
            super(message);
            this.status = status;
        }
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (prev != 0L && now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public record RawResponse(int status, String body) {
    }
}
