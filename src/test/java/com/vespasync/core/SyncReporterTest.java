package com.vespasync.core;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncReporterTest {
    private static final Instant STARTED = Instant.parse("2025-03-10T09:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void getSummary_shouldListTablesStagesAndWarnings() {
        SyncReporter reporter = populated();

        String summary = reporter.getSummary();

        assertTrue(summary.contains("run_id=42"), summary);
        assertTrue(summary.contains("status=PARTIAL"), summary);
        assertTrue(summary.contains("persons before=10 after=12 new=2 updated=1 unchanged=7 protected=1 rejected=0 pending=3 skipped=0 error=0"), summary);
        assertTrue(summary.contains("responses elapsed_ms="), summary);
        assertTrue(summary.contains("status=PARTIAL reason=pages_failed"), summary);
        assertTrue(summary.contains("pending_institution count=2"), summary);
        assertTrue(summary.contains("persons pages_ok=2 pages_failed=1 records=300"), summary);
    }

    @Test
    void toJson_shouldMirrorSummaryCounters() {
        JSONObject json = populated().toJson();

        assertEquals(42, json.getLong("run_id"));
        assertEquals("PARTIAL", json.getString("status"));
        assertEquals(3, json.getJSONObject("tables").getJSONObject("persons").getLong("pending"));
        assertEquals(1, json.getJSONObject("tables").getJSONObject("persons").getLong("protected"));
        assertEquals(1, json.getLong("errors_total"));
        assertEquals(2, json.getLong("warnings_total"));
        assertEquals(2, json.getJSONObject("warnings").getJSONObject("pending_institution").getJSONArray("samples").length());
        assertEquals("pages_failed", json.getJSONArray("stages").getJSONObject(0).getString("reason"));
        assertEquals(2, json.getJSONArray("stages").getJSONObject(0).getJSONObject("evidence").getInt("pages_ok"));
    }

    @Test
    void warn_shouldCountEveryWarningButKeepFewSamples() {
        SyncReporter reporter = new SyncReporter("FULL", STARTED);
        for (int i = 0; i < 8; i++) {
            reporter.warn("Score_Out_Of_Range", "sample " + i);
        }

        assertEquals(8, reporter.warningCount("score_out_of_range"));
        assertEquals(5, reporter.toJson().getJSONObject("warnings")
                .getJSONObject("score_out_of_range").getJSONArray("samples").length());
    }

    @Test
    void writeArtifacts_shouldWriteTextAndJsonReports() throws Exception {
        SyncReporter reporter = populated();

        SyncReporter.Artifacts artifacts = reporter.writeArtifacts(tempDir.resolve("reports"), ZoneOffset.UTC);

        assertEquals("sync_report_20250310_090000.txt", artifacts.textReport().getFileName().toString());
        assertTrue(Files.readString(artifacts.textReport(), StandardCharsets.UTF_8).contains("run_id=42"));
        JSONObject json = new JSONObject(Files.readString(artifacts.jsonReport(), StandardCharsets.UTF_8));
        assertEquals("FULL", json.getString("run_mode"));
    }

    @Test
    void table_shouldNormalizeNamesAndIgnoreNegativeCounts() {
        SyncReporter reporter = new SyncReporter(" ", STARTED);
        reporter.table("Persons").addNew(-4);
        reporter.table(" persons ").addNew(2);

        assertEquals(2, reporter.table("persons").created());
        assertEquals(1, reporter.tables().size());
        assertEquals("FULL", reporter.runMode());
    }

    private static SyncReporter populated() {
        SyncReporter reporter = new SyncReporter("FULL", STARTED);
        reporter.setRunId(42L);
        SyncReporter.TableCounters persons = reporter.table("persons");
        persons.setBefore(10);
        persons.setAfter(12);
        persons.addNew(2);
        persons.addUpdated(1);
        persons.addUnchanged(7);
        persons.addProtected(1);
        persons.addPending(3);
        reporter.recordPage("persons", 200, false);
        reporter.recordPage("persons", 100, false);
        reporter.recordPage("persons", 0, true);
        reporter.startStage("responses");
        reporter.endStage(StageResult.partial("responses", "pages_failed", Map.of("pages_ok", 2)));
        reporter.warn("pending_institution", "person p4 references unknown institution i9");
        reporter.warn("pending_institution", "person p5 references unknown institution i9");
        reporter.finish("PARTIAL");
        return reporter;
    }
}
