package com.vespasync.core;

import java.util.LinkedHashMap;
import java.util.Map;

public record StageResult(
        String stage,
        StageStatus status,
        String reason,
        Map<String, Object> evidence
) {
    public StageResult {
        stage = stage == null ? "" : stage;
        status = status == null ? StageStatus.FAILED : status;
        reason = reason == null ? "" : reason;
        Map<String, Object> copy = evidence == null ? Map.of() : new LinkedHashMap<>(evidence);
        evidence = Map.copyOf(copy);
    }

    public static StageResult ok(String stage, Map<String, Object> evidence) {
        return new StageResult(stage, StageStatus.OK, "", evidence);
    }

    public static StageResult partial(String stage, String reason, Map<String, Object> evidence) {
        return new StageResult(stage, StageStatus.PARTIAL, reason, evidence);
    }

    public static StageResult skipped(String stage, String reason) {
        return new StageResult(stage, StageStatus.SKIPPED, reason, Map.of());
    }

    public static StageResult cancelled(String stage, Map<String, Object> evidence) {
        return new StageResult(stage, StageStatus.CANCELLED, "shutdown_requested", evidence);
    }

    public static StageResult failed(String stage, String reason) {
        return new StageResult(stage, StageStatus.FAILED, reason, Map.of());
    }
}
