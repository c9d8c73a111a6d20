package com.vespasync.sync.writer;

import com.vespasync.core.FatalSyncException;
import com.vespasync.core.SyncReporter;
import com.vespasync.sync.model.Keyed;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers rows per table and flushes them as keyed upserts.
 * <p>
 * Before each flush the buffer is deduplicated by natural key and compared with the stored
 * rows: unchanged rows are not written, rows whose guarded fields are all empty never
 * replace a stored row that has a value there, and are not inserted at all when nothing is stored.
 * Filling one table's buffer flushes the tables registered before it first, so parent rows
 * exist before their children reference them.
 * <p>
 * Single-threaded by contract: the read of stored rows and the following write must not
 * interleave with another writer on the same table.
 */
public final class BatchUpsertWriter {
    private final SyncReporter reporter;
    private final Map<String, Buffer<?>> buffers = new LinkedHashMap<>();

    public BatchUpsertWriter(SyncReporter reporter) {
        this.reporter = reporter;
    }

    public <R extends Keyed> void register(SyncTable<R> table) {
        if (buffers.containsKey(table.name())) {
            throw new IllegalStateException("table already registered: " + table.name());
        }
        buffers.put(table.name(), new Buffer<>(table));
    }

    /**
     * Adds a row to its table buffer, flushing when the buffer reaches its batch size.
     */
    public <R extends Keyed> void stage(SyncTable<R> table, R row) {
        if (row == null) {
            return;
        }
        Buffer<R> buffer = buffer(table);
        if (buffer.add(row)) {
            reporter.table(table.name()).addSkipped(1);
        }
        if (buffer.size() >= table.batchSize()) {
            flushParentsOf(table.name());
            flush(table);
        }
    }

    public void flushAll() {
        for (Buffer<?> buffer : buffers.values()) {
            buffer.flush();
        }
    }

    public <R extends Keyed> Map<WriteOutcome, Integer> flush(SyncTable<R> table) {
        return buffer(table).flush();
    }

    public int pending(String tableName) {
        Buffer<?> buffer = buffers.get(tableName);
        return buffer == null ? 0 : buffer.size();
    }

    private void flushParentsOf(String tableName) {
        for (Map.Entry<String, Buffer<?>> entry : buffers.entrySet()) {
            if (entry.getKey().equals(tableName)) {
                return;
            }
            entry.getValue().flush();
        }
    }

    @SuppressWarnings("unchecked")
    private <R extends Keyed> Buffer<R> buffer(SyncTable<R> table) {
        Buffer<?> buffer = buffers.get(table.name());
        if (buffer == null) {
            throw new IllegalStateException("table not registered: " + table.name());
        }
        return (Buffer<R>) buffer;
    }

    static boolean isConstraintViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    static boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private final class Buffer<R extends Keyed> {
        private final SyncTable<R> table;
        private final LinkedHashMap<String, R> rows = new LinkedHashMap<>();

        private Buffer(SyncTable<R> table) {
            this.table = table;
        }

        /**
         * @return true when the row collapsed onto an already buffered key
         */
        boolean add(R row) {
            String key = row.naturalKey();
            R previous = rows.get(key);
            if (previous == null) {
                rows.put(key, row);
                return false;
            }
            rows.put(key, table.dedup(previous, row));
            return true;
        }

        int size() {
            return rows.size();
        }

        Map<WriteOutcome, Integer> flush() {
            Map<WriteOutcome, Integer> result = new EnumMap<>(WriteOutcome.class);
            if (rows.isEmpty()) {
                return result;
            }
            List<R> batch = new ArrayList<>(rows.values());
            rows.clear();
            SyncReporter.TableCounters counters = reporter.table(table.name());

            Map<String, R> stored;
            try {
                stored = table.store().findByKeys(keysOf(batch));
            } catch (SQLException e) {
                failWhole(batch, counters, result, "lookup", e);
                return result;
            }

            List<R> toWrite = new ArrayList<>(batch.size());
            List<WriteOutcome> planned = new ArrayList<>(batch.size());
            for (R incoming : batch) {
                R existing = stored.get(incoming.naturalKey());
                if (existing == null) {
                    if (table.guardedFieldsEmpty(incoming)) {
                        bump(result, WriteOutcome.SKIPPED);
                        counters.addSkipped(1);
                        continue;
                    }
                    toWrite.add(incoming);
                    planned.add(WriteOutcome.NEW);
                    continue;
                }
                R merged = table.carryOver(existing, incoming);
                if (table.guarded()
                        && table.guardedFieldsEmpty(merged)
                        && !table.guardedFieldsEmpty(existing)) {
                    bump(result, WriteOutcome.PROTECTED);
                    counters.addProtected(1);
                    continue;
                }
                if (merged.equals(existing)) {
                    bump(result, WriteOutcome.UNCHANGED);
                    counters.addUnchanged(1);
                    continue;
                }
                toWrite.add(merged);
                planned.add(WriteOutcome.UPDATED);
            }
            if (toWrite.isEmpty()) {
                return result;
            }

            try {
                table.store().upsert(toWrite);
                for (WriteOutcome outcome : planned) {
                    record(counters, result, outcome);
                }
            } catch (SQLException e) {
                if (isConnectionFailure(e)) {
                    throw new FatalSyncException("target store unreachable while writing " + table.name(), e);
                }
                System.err.println("WARN: batch upsert failed table=" + table.name()
                        + " rows=" + toWrite.size() + " err=" + e.getMessage() + "; retrying row by row");
                writeRowByRow(toWrite, planned, counters, result);
            }
            return result;
        }

        private void writeRowByRow(
                List<R> toWrite,
                List<WriteOutcome> planned,
                SyncReporter.TableCounters counters,
                Map<WriteOutcome, Integer> result
        ) {
            for (int i = 0; i < toWrite.size(); i++) {
                R row = toWrite.get(i);
                try {
                    table.store().upsert(List.of(row));
                    record(counters, result, planned.get(i));
                } catch (SQLException e) {
                    if (isConnectionFailure(e)) {
                        throw new FatalSyncException("target store unreachable while writing " + table.name(), e);
                    }
                    if (isConstraintViolation(e)) {
                        record(counters, result, WriteOutcome.REJECTED);
                        reporter.warn("constraint_violation",
                                table.name() + " key=" + row.naturalKey() + " err=" + e.getMessage());
                    } else {
                        record(counters, result, WriteOutcome.ERROR);
                        reporter.warn("write_failed",
                                table.name() + " key=" + row.naturalKey() + " err=" + e.getMessage());
                    }
                }
            }
        }

        private void failWhole(
                List<R> batch,
                SyncReporter.TableCounters counters,
                Map<WriteOutcome, Integer> result,
                String step,
                SQLException e
        ) {
            if (isConnectionFailure(e)) {
                throw new FatalSyncException("target store unreachable while reading " + table.name(), e);
            }
            counters.addErrors(batch.size());
            result.merge(WriteOutcome.ERROR, batch.size(), Integer::sum);
            reporter.warn("write_failed", table.name() + " " + step + " failed rows=" + batch.size() + " err=" + e.getMessage());
        }

        private List<String> keysOf(List<R> batch) {
            List<String> keys = new ArrayList<>(batch.size());
            for (R row : batch) {
                keys.add(row.naturalKey());
            }
            return keys;
        }
    }

    private static void record(SyncReporter.TableCounters counters, Map<WriteOutcome, Integer> result, WriteOutcome outcome) {
        bump(result, outcome);
        switch (outcome) {
            case NEW:
                counters.addNew(1);
                break;
            case UPDATED:
                counters.addUpdated(1);
                break;
            case UNCHANGED:
                counters.addUnchanged(1);
                break;
            case PROTECTED:
                counters.addProtected(1);
                break;
            case REJECTED:
                counters.addRejected(1);
                break;
            case SKIPPED:
                counters.addSkipped(1);
                break;
            default:
                counters.addErrors(1);
                break;
        }
    }

    private static void bump(Map<WriteOutcome, Integer> result, WriteOutcome outcome) {
        result.merge(outcome, 1, Integer::sum);
    }
}
