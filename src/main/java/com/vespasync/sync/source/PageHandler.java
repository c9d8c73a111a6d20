package com.vespasync.sync.source;

/**
 * Receives fetched pages in page order on the driver thread.
 */
@FunctionalInterface
public interface PageHandler {
    void onPage(SourcePage page);
}
