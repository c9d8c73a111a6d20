package com.vespasync.sync.store;

import com.vespasync.sync.model.Keyed;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Keyed read/upsert access to one target table.
 */
public interface RowStore<R extends Keyed> {
    String tableName();

    /**
     * Stored rows for the given natural keys, keyed by {@link Keyed#naturalKey()}; missing keys are absent.
     */
    Map<String, R> findByKeys(Collection<String> naturalKeys) throws SQLException;

    /**
     * Inserts or updates the rows by natural key in one transaction.
     */
    void upsert(List<R> rows) throws SQLException;

    long count() throws SQLException;
}
