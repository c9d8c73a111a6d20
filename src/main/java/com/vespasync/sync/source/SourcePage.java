package com.vespasync.sync.source;

import org.json.JSONObject;

import java.util.List;

public final class SourcePage {
    public final String collection;
    public final int page;
    public final int totalPages;
    public final List<JSONObject> records;

    public SourcePage(String collection, int page, int totalPages, List<JSONObject> records) {
        this.collection = collection;
        this.page = page;
        this.totalPages = Math.max(0, totalPages);
        this.records = records == null ? List.of() : List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
