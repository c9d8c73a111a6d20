package com.vespasync.sync.checkpoint;

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resumable sync progress: per collection the last fully consumed page, whether the collection
 * finished, and the source ids already written from a partly consumed collection.
 */
public final class SyncCheckpoint {
    public static final int SCHEMA_VERSION = 1;

    private final int schemaVersion;
    private final Instant runStartedAt;
    private Instant updatedAt;
    private final Map<String, Cursor> collections = new LinkedHashMap<>();

    public SyncCheckpoint(Instant runStartedAt) {
        this(SCHEMA_VERSION, runStartedAt, runStartedAt);
    }

    private SyncCheckpoint(int schemaVersion, Instant runStartedAt, Instant updatedAt) {
        this.schemaVersion = schemaVersion;
        this.runStartedAt = runStartedAt;
        this.updatedAt = updatedAt;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public Instant runStartedAt() {
        return runStartedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isCompleted(String collection) {
        Cursor cursor = collections.get(collection);
        return cursor != null && cursor.completed;
    }

    public int lastPage(String collection) {
        Cursor cursor = collections.get(collection);
        return cursor == null ? 0 : cursor.lastPage;
    }

    /**
     * First page a resumed run should request for the collection.
     */
    public int resumePage(String collection) {
        return lastPage(collection) + 1;
    }

    public boolean isProcessed(String collection, String sourceId) {
        Cursor cursor = collections.get(collection);
        return cursor != null && cursor.processed.contains(sourceId);
    }

    public Set<String> processed(String collection) {
        Cursor cursor = collections.get(collection);
        return cursor == null ? Set.of() : Collections.unmodifiableSet(cursor.processed);
    }

    public Set<String> collections() {
        return Collections.unmodifiableSet(collections.keySet());
    }

    public void markPage(String collection, int page, Iterable<String> sourceIds, Instant now) {
        Cursor cursor = collections.computeIfAbsent(collection, k -> new Cursor());
        cursor.lastPage = Math.max(cursor.lastPage, page);
        if (sourceIds != null) {
            for (String id : sourceIds) {
                if (id != null && !id.isEmpty()) {
                    cursor.processed.add(id);
                }
            }
        }
        updatedAt = now;
    }

    /**
     * Sends the next run back to page one; ids already written stay skipped.
     */
    public void reopen(String collection, Instant now) {
        Cursor cursor = collections.computeIfAbsent(collection, k -> new Cursor());
        cursor.lastPage = 0;
        cursor.completed = false;
        updatedAt = now;
    }

    public void markCompleted(String collection, Instant now) {
        Cursor cursor = collections.computeIfAbsent(collection, k -> new Cursor());
        cursor.completed = true;
        cursor.processed.clear();
        updatedAt = now;
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("schema_version", schemaVersion);
        root.put("run_started_at", runStartedAt.toString());
        root.put("updated_at", updatedAt.toString());
        JSONObject cols = new JSONObject();
        for (Map.Entry<String, Cursor> entry : collections.entrySet()) {
            Cursor cursor = entry.getValue();
            JSONObject item = new JSONObject();
            item.put("last_page", cursor.lastPage);
            item.put("completed", cursor.completed);
            item.put("processed", new JSONArray(cursor.processed));
            cols.put(entry.getKey(), item);
        }
        root.put("collections", cols);
        return root;
    }

    /**
     * Parses a stored checkpoint.
     *
     * @throws IllegalArgumentException when the payload is malformed or written by a newer schema
     */
    public static SyncCheckpoint fromJson(String raw) {
        JSONObject root;
        try {
            root = new JSONObject(raw == null ? "" : raw);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("checkpoint payload is not a JSON object", e);
        }
        int version = root.optInt("schema_version", root.optInt("version", -1));
        if (version != SCHEMA_VERSION) {
            throw new IllegalArgumentException("unsupported checkpoint schema_version=" + version);
        }
        Instant started = parseInstant(root.optString("run_started_at", ""));
        String updatedRaw = root.optString("updated_at", "");
        Instant updated = updatedRaw.isEmpty() ? null : parseInstant(updatedRaw);
        SyncCheckpoint checkpoint = new SyncCheckpoint(version, started, updated == null ? started : updated);

        JSONObject cols = root.optJSONObject("collections");
        if (cols != null) {
            for (String name : cols.keySet()) {
                JSONObject item = cols.optJSONObject(name);
                if (item == null) {
                    continue;
                }
                Cursor cursor = new Cursor();
                cursor.lastPage = Math.max(0, item.optInt("last_page", 0));
                cursor.completed = item.optBoolean("completed", false);
                JSONArray processed = item.optJSONArray("processed");
                if (processed != null) {
                    for (int i = 0; i < processed.length(); i++) {
                        String id = processed.optString(i, "");
                        if (!id.isEmpty()) {
                            cursor.processed.add(id);
                        }
                    }
                }
                checkpoint.collections.put(name, cursor);
            }
        }
        return checkpoint;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("checkpoint is missing run_started_at");
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid checkpoint timestamp: " + raw, e);
        }
    }

    private static final class Cursor {
        int lastPage;
        boolean completed;
        final Set<String> processed = new LinkedHashSet<>();
    }
}
