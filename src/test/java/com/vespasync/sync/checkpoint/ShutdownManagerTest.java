package com.vespasync.sync.checkpoint;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownManagerTest {

    @Test
    void onShutdown_shouldCancelTokenAndWaitForDriver() throws Exception {
        CancellationToken token = new CancellationToken();
        ShutdownManager manager = new ShutdownManager(token, 5);

        Thread hook = new Thread(manager::onShutdown);
        hook.start();
        long deadline = System.currentTimeMillis() + 2000L;
        while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
        assertTrue(token.isCancelled());
        assertEquals("signal", token.reason());
        assertTrue(hook.isAlive());

        manager.markFinished();
        hook.join(2000L);
        assertFalse(hook.isAlive());
        assertTrue(manager.awaitFinished(0, TimeUnit.MILLISECONDS));
    }

    @Test
    void onShutdown_shouldDoNothingAfterDriverFinished() {
        CancellationToken token = new CancellationToken();
        ShutdownManager manager = new ShutdownManager(token, 5);
        manager.markFinished();

        manager.onShutdown();

        assertFalse(token.isCancelled());
    }

    @Test
    void install_shouldRegisterAndMarkFinishedShouldRemoveHook() {
        ShutdownManager manager = new ShutdownManager(new CancellationToken(), 1);
        manager.install();
        manager.install();

        manager.markFinished();

        assertFalse(manager.token().isCancelled());
    }

    @Test
    void cancel_shouldKeepFirstReason() {
        CancellationToken token = new CancellationToken();
        token.cancel("signal");
        token.cancel("interrupted");

        assertEquals("signal", token.reason());
        assertEquals("cancelled", cancelledWithBlankReason().reason());
    }

    private static CancellationToken cancelledWithBlankReason() {
        CancellationToken token = new CancellationToken();
        token.cancel(" ");
        return token;
    }
}
