package com.vespasync.core;

/**
 * Aborts the whole run: the target store is unreachable or the institution bootstrap failed.
 * The checkpoint is left untouched so the next run resumes from the last saved cursor.
 */
public class FatalSyncException extends RuntimeException {
    public FatalSyncException(String message) {
        super(message);
    }

    public FatalSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
