package com.vespasync.sync.checkpoint;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop request. Set by the shutdown hook, polled by the pipeline between pages
 * and batches only.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>(null);

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        String value = reason.get();
        return value == null ? "" : value;
    }
}
