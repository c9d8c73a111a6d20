package com.vespasync.sync.runner;

import com.vespasync.core.SyncReporter;

import java.nio.file.Path;

/**
 * Result of one {@link SyncRunner#run(String)} call.
 */
public final class SyncOutcome {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_CANCELLED = 130;

    public final long runId;
    public final String status;
    public final int exitCode;
    public final SyncReporter reporter;
    public final Path textReport;
    public final Path jsonReport;
    public final boolean checkpointCleared;

    public SyncOutcome(
            long runId,
            String status,
            int exitCode,
            SyncReporter reporter,
            Path textReport,
            Path jsonReport,
            boolean checkpointCleared
    ) {
        this.runId = runId;
        this.status = status;
        this.exitCode = exitCode;
        this.reporter = reporter;
        this.textReport = textReport;
        this.jsonReport = jsonReport;
        this.checkpointCleared = checkpointCleared;
    }

    public boolean succeeded() {
        return exitCode == EXIT_OK;
    }
}
