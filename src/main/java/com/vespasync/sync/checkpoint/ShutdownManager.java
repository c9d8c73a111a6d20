package com.vespasync.sync.checkpoint;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns a JVM termination request (SIGINT/SIGTERM) into a cancellation of the running sync.
 * <p>
 * The hook sets the token and then blocks up to the grace period so the driver can finish its
 * current batch, flush and persist the checkpoint before the JVM exits.
 */
public final class ShutdownManager {
    private final CancellationToken token;
    private final long graceMillis;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private Thread hook;

    public ShutdownManager(CancellationToken token, long graceSeconds) {
        this.token = token;
        this.graceMillis = Math.max(0L, graceSeconds) * 1000L;
    }

    public CancellationToken token() {
        return token;
    }

    public void install() {
        if (!installed.compareAndSet(false, true)) {
            return;
        }
        hook = new Thread(this::onShutdown, "vespa-sync-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    /**
     * Called by the driver once it has stopped; releases a waiting hook.
     */
    public void markFinished() {
        finished.countDown();
        if (hook != null && installed.compareAndSet(true, false)) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignored) {
                // JVM already shutting down; the hook is running
            }
        }
    }

    void onShutdown() {
        if (finished.getCount() == 0L) {
            return;
        }
        token.cancel("signal");
        System.err.println("WARN: shutdown requested, waiting up to " + (graceMillis / 1000L)
                + "s for the current batch to finish");
        try {
            if (!finished.await(graceMillis, TimeUnit.MILLISECONDS)) {
                System.err.println("ERROR: sync did not stop within the grace period; exiting with work in flight");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }
}
