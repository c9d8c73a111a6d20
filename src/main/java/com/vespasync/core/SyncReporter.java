package com.vespasync.core;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single sync run's per-table counters, stage outcomes and warnings, and renders
 * them as a plain-text summary and a JSON document.
 */
public final class SyncReporter {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SAMPLES_PER_CATEGORY = 5;

    private long runId;
    private final String runMode;
    private final Instant startedAt;
    private Instant finishedAt;
    private String status = "RUNNING";

    private final Map<String, TableCounters> tables = new LinkedHashMap<>();
    private final Map<String, FetchStat> fetches = new LinkedHashMap<>();
    private final Map<String, StageStat> stages = new LinkedHashMap<>();
    private final Map<String, WarningStat> warnings = new LinkedHashMap<>();

    public SyncReporter(String runMode, Instant startedAt) {
        this.runMode = runMode == null || runMode.isBlank() ? "FULL" : runMode.trim();
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized long runId() {
        return runId;
    }

    public synchronized void setRunId(long runId) {
        if (runId > 0L) {
            this.runId = runId;
        }
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized String status() {
        return status;
    }

    public synchronized TableCounters table(String name) {
        return tables.computeIfAbsent(sanitize(name), TableCounters::new);
    }

    public synchronized List<TableCounters> tables() {
        return new ArrayList<>(tables.values());
    }

    public synchronized void startStage(String name) {
        StageStat stat = stages.computeIfAbsent(sanitize(name), StageStat::new);
        stat.startedAt = Instant.now();
    }

    public synchronized void endStage(StageResult result) {
        StageStat stat = stages.computeIfAbsent(sanitize(result.stage()), StageStat::new);
        Instant end = Instant.now();
        stat.finishedAt = end;
        stat.elapsedMs = stat.startedAt == null ? 0L : Math.max(0L, Duration.between(stat.startedAt, end).toMillis());
        stat.result = result;
    }

    public synchronized List<StageResult> stageResults() {
        List<StageResult> out = new ArrayList<>();
        for (StageStat stat : stages.values()) {
            if (stat.result != null) {
                out.add(stat.result);
            }
        }
        return out;
    }

    public synchronized void recordPage(String collection, int records, boolean failed) {
        FetchStat stat = fetches.computeIfAbsent(sanitize(collection), FetchStat::new);
        if (failed) {
            stat.pagesFailed++;
        } else {
            stat.pagesOk++;
            stat.records += Math.max(0, records);
        }
    }

    /**
     * Counts a warning under {@code category}; the first few messages per category are kept as samples.
     */
    public synchronized void warn(String category, String message) {
        String key = category == null || category.isBlank() ? "other" : category.trim().toLowerCase(Locale.ROOT);
        WarningStat stat = warnings.computeIfAbsent(key, WarningStat::new);
        stat.count++;
        if (stat.samples.size() < MAX_SAMPLES_PER_CATEGORY && message != null && !message.isBlank()) {
            stat.samples.add(message.trim());
            System.err.println("WARN: [" + key + "] " + message.trim());
        }
    }

    public synchronized long warningCount(String category) {
        WarningStat stat = warnings.get(category);
        return stat == null ? 0L : stat.count;
    }

    public synchronized long totalWarnings() {
        long total = 0L;
        for (WarningStat stat : warnings.values()) {
            total += stat.count;
        }
        return total;
    }

    public synchronized long totalErrors() {
        long total = 0L;
        for (TableCounters counters : tables.values()) {
            total += counters.errors;
        }
        for (FetchStat stat : fetches.values()) {
            total += stat.pagesFailed;
        }
        return total;
    }

    public synchronized void finish(String finalStatus) {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
        if (finalStatus != null && !finalStatus.isBlank()) {
            status = finalStatus.trim();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("status=").append(status).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(totalErrors()).append('\n');
        sb.append("warnings_total=").append(totalWarnings()).append('\n');

        sb.append("stages:\n");
        for (StageStat stat : stages.values()) {
            sb.append(String.format(Locale.US, "  %s elapsed_ms=%d status=%s",
                    stat.name,
                    stat.elapsedMs,
                    stat.result == null ? "RUNNING" : stat.result.status().name()));
            if (stat.result != null && !stat.result.reason().isBlank()) {
                sb.append(" reason=").append(stat.result.reason());
            }
            sb.append('\n');
        }

        sb.append("fetch:\n");
        for (FetchStat stat : fetches.values()) {
            sb.append(String.format(Locale.US, "  %s pages_ok=%d pages_failed=%d records=%d%n",
                    stat.name, stat.pagesOk, stat.pagesFailed, stat.records));
        }

        sb.append("tables:\n");
        for (TableCounters t : tables.values()) {
            sb.append(String.format(Locale.US,
                    "  %s before=%d after=%d new=%d updated=%d unchanged=%d protected=%d rejected=%d pending=%d skipped=%d error=%d%n",
                    t.name, t.before, t.after, t.created, t.updated, t.unchanged,
                    t.protectedCount, t.rejected, t.pending, t.skipped, t.errors));
        }

        sb.append("warnings:\n");
        for (WarningStat stat : warnings.values()) {
            sb.append("  ").append(stat.category).append(" count=").append(stat.count).append('\n');
            for (String sample : stat.samples) {
                sb.append("    - ").append(sample).append('\n');
            }
        }
        return sb.toString().trim();
    }

    public synchronized JSONObject toJson() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        JSONObject root = new JSONObject();
        root.put("run_id", runId);
        root.put("run_mode", runMode);
        root.put("status", status);
        root.put("started_at", ISO.format(startedAt));
        root.put("finished_at", ISO.format(end));
        root.put("total_elapsed_ms", Math.max(0L, Duration.between(startedAt, end).toMillis()));
        root.put("errors_total", totalErrors());
        root.put("warnings_total", totalWarnings());

        JSONArray stageArr = new JSONArray();
        for (StageStat stat : stages.values()) {
            JSONObject item = new JSONObject();
            item.put("name", stat.name);
            item.put("elapsed_ms", stat.elapsedMs);
            item.put("status", stat.result == null ? "RUNNING" : stat.result.status().name());
            item.put("reason", stat.result == null ? "" : stat.result.reason());
            if (stat.result != null && !stat.result.evidence().isEmpty()) {
                item.put("evidence", new JSONObject(stat.result.evidence()));
            }
            stageArr.put(item);
        }
        root.put("stages", stageArr);

        JSONObject fetchObj = new JSONObject();
        for (FetchStat stat : fetches.values()) {
            JSONObject item = new JSONObject();
            item.put("pages_ok", stat.pagesOk);
            item.put("pages_failed", stat.pagesFailed);
            item.put("records", stat.records);
            fetchObj.put(stat.name, item);
        }
        root.put("fetch", fetchObj);

        JSONObject tableObj = new JSONObject();
        for (TableCounters t : tables.values()) {
            JSONObject item = new JSONObject();
            item.put("before", t.before);
            item.put("after", t.after);
            item.put("new", t.created);
            item.put("updated", t.updated);
            item.put("unchanged", t.unchanged);
            item.put("protected", t.protectedCount);
            item.put("rejected", t.rejected);
            item.put("pending", t.pending);
            item.put("skipped", t.skipped);
            item.put("error", t.errors);
            tableObj.put(t.name, item);
        }
        root.put("tables", tableObj);

        JSONObject warnObj = new JSONObject();
        for (WarningStat stat : warnings.values()) {
            JSONObject item = new JSONObject();
            item.put("count", stat.count);
            item.put("samples", new JSONArray(stat.samples));
            warnObj.put(stat.category, item);
        }
        root.put("warnings", warnObj);
        return root;
    }

    /**
     * Writes {@code sync_report_<stamp>.txt} and {@code .json} under {@code dir}.
     */
    public Artifacts writeArtifacts(Path dir, ZoneId zone) throws IOException {
        Files.createDirectories(dir);
        String stamp = FILE_STAMP.withZone(zone == null ? ZoneId.systemDefault() : zone).format(startedAt());
        Path text = dir.resolve("sync_report_" + stamp + ".txt");
        Path json = dir.resolve("sync_report_" + stamp + ".json");
        Files.writeString(text, getSummary() + System.lineSeparator(), StandardCharsets.UTF_8);
        Files.writeString(json, toJson().toString(2), StandardCharsets.UTF_8);
        return new Artifacts(text, json);
    }

    private String sanitize(String name) {
        String value = name == null ? "" : name.trim();
        return value.isEmpty() ? "unknown" : value.toLowerCase(Locale.ROOT);
    }

    public record Artifacts(Path textReport, Path jsonReport) {
    }

    /**
     * Running write counters for one target table.
     */
    public static final class TableCounters {
        private final String name;
        private long before;
        private long after;
        private long created;
        private long updated;
        private long unchanged;
        private long protectedCount;
        private long rejected;
        private long pending;
        private long skipped;
        private long errors;

        private TableCounters(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        public synchronized void setBefore(long value) {
            before = Math.max(0L, value);
        }

        public synchronized void setAfter(long value) {
            after = Math.max(0L, value);
        }

        public synchronized void addNew(long n) {
            created += Math.max(0L, n);
        }

        public synchronized void addUpdated(long n) {
            updated += Math.max(0L, n);
        }

        public synchronized void addUnchanged(long n) {
            unchanged += Math.max(0L, n);
        }

        public synchronized void addProtected(long n) {
            protectedCount += Math.max(0L, n);
        }

        public synchronized void addRejected(long n) {
            rejected += Math.max(0L, n);
        }

        public synchronized void addPending(long n) {
            pending += Math.max(0L, n);
        }

        public synchronized void addSkipped(long n) {
            skipped += Math.max(0L, n);
        }

        public synchronized void addErrors(long n) {
            errors += Math.max(0L, n);
        }

        public synchronized long before() {
            return before;
        }

        public synchronized long after() {
            return after;
        }

        public synchronized long created() {
            return created;
        }

        public synchronized long updated() {
            return updated;
        }

        public synchronized long unchanged() {
            return unchanged;
        }

        public synchronized long protectedCount() {
            return protectedCount;
        }

        public synchronized long rejected() {
            return rejected;
        }

        public synchronized long pending() {
            return pending;
        }

        public synchronized long skipped() {
            return skipped;
        }

        public synchronized long errors() {
            return errors;
        }
    }

    private static final class FetchStat {
        private final String name;
        private long pagesOk;
        private long pagesFailed;
        private long records;

        private FetchStat(String name) {
            this.name = name;
        }
    }

    private static final class StageStat {
        private final String name;
        private Instant startedAt;
        private Instant finishedAt;
        private long elapsedMs;
        private StageResult result;

        private StageStat(String name) {
            this.name = name;
        }
    }

    private static final class WarningStat {
        private final String category;
        private long count;
        private final List<String> samples = new ArrayList<>();

        private WarningStat(String category) {
            this.category = category;
        }
    }
}
