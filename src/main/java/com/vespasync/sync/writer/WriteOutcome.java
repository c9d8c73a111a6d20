package com.vespasync.sync.writer;

/**
 * Per-row decision taken by {@link BatchUpsertWriter} before a flush.
 */
public enum WriteOutcome {
    NEW,
    UPDATED,
    UNCHANGED,
    PROTECTED,
    REJECTED,
    SKIPPED,
    ERROR
}
