package com.vespasync.core;

public enum StageStatus {
    OK,
    PARTIAL,
    SKIPPED,
    CANCELLED,
    FAILED
}
