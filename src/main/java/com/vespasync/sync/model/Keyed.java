package com.vespasync.sync.model;

/**
 * A row with a business key used for dedup and upsert conflict resolution.
 */
public interface Keyed {
    String naturalKey();
}
