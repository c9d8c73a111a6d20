package com.vespasync.sync.writer;

import com.vespasync.sync.model.Keyed;
import com.vespasync.sync.store.RowStore;

import java.util.function.BinaryOperator;
import java.util.function.Predicate;

/**
 * Write policy for one target table: batch size, null-overwrite guard, in-batch dedup and
 * carry-over of columns the source never supplies.
 */
public final class SyncTable<R extends Keyed> {
    private final RowStore<R> store;
    private final int batchSize;
    private final Predicate<R> guardedFieldsEmpty;
    private final BinaryOperator<R> dedup;
    private final BinaryOperator<R> carryOver;

    private SyncTable(
            RowStore<R> store,
            int batchSize,
            Predicate<R> guardedFieldsEmpty,
            BinaryOperator<R> dedup,
            BinaryOperator<R> carryOver
    ) {
        this.store = store;
        this.batchSize = Math.max(1, batchSize);
        this.guardedFieldsEmpty = guardedFieldsEmpty;
        this.dedup = dedup;
        this.carryOver = carryOver;
    }

    /**
     * Unguarded table with last-writer-wins dedup.
     */
    public static <R extends Keyed> SyncTable<R> of(RowStore<R> store, int batchSize) {
        return new SyncTable<>(store, batchSize, null, (older, newer) -> newer, (stored, incoming) -> incoming);
    }

    /**
     * Rows for which {@code guardedFieldsEmpty} holds never replace a stored row for which it does not.
     */
    public SyncTable<R> withGuard(Predicate<R> guardedFieldsEmpty) {
        return new SyncTable<>(store, batchSize, guardedFieldsEmpty, dedup, carryOver);
    }

    public SyncTable<R> withDedup(BinaryOperator<R> dedup) {
        return new SyncTable<>(store, batchSize, guardedFieldsEmpty, dedup, carryOver);
    }

    /**
     * Merges stored-only columns into the incoming row before it is compared and written.
     */
    public SyncTable<R> withCarryOver(BinaryOperator<R> carryOver) {
        return new SyncTable<>(store, batchSize, guardedFieldsEmpty, dedup, carryOver);
    }

    public String name() {
        return store.tableName();
    }

    public RowStore<R> store() {
        return store;
    }

    public int batchSize() {
        return batchSize;
    }

    boolean guarded() {
        return guardedFieldsEmpty != null;
    }

    boolean guardedFieldsEmpty(R row) {
        return guardedFieldsEmpty != null && guardedFieldsEmpty.test(row);
    }

    R dedup(R older, R newer) {
        return dedup.apply(older, newer);
    }

    R carryOver(R stored, R incoming) {
        return carryOver.apply(stored, incoming);
    }
}
