package com.vespasync.sync.source;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of field rules in the source API's filter syntax:
 * {@code {"match":"and","rules":[{"field":..,"operator":..,"value":..}]}}.
 */
public final class SourceFilter {
    private static final SourceFilter NONE = new SourceFilter(List.of());

    private final List<Rule> rules;

    private SourceFilter(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SourceFilter none() {
        return NONE;
    }

    public static SourceFilter of(List<Rule> rules) {
        return rules == null || rules.isEmpty() ? NONE : new SourceFilter(rules);
    }

    /**
     * Parses {@code field|operator|value} rules separated by ';'. Malformed rules are ignored.
     */
    public static SourceFilter parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        List<Rule> rules = new ArrayList<>();
        for (String part : raw.split(";")) {
            String[] tokens = part.split("\\|", 3);
            if (tokens.length < 2 || tokens[0].isBlank() || tokens[1].isBlank()) {
                continue;
            }
            String value = tokens.length == 3 ? tokens[2].trim() : "";
            rules.add(new Rule(tokens[0].trim(), tokens[1].trim(), value));
        }
        return of(rules);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public List<Rule> rules() {
        return rules;
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("match", "and");
        JSONArray arr = new JSONArray();
        for (Rule rule : rules) {
            JSONObject item = new JSONObject();
            item.put("field", rule.field());
            item.put("operator", rule.operator());
            if (!rule.value().isEmpty()) {
                item.put("value", rule.value());
            }
            arr.put(item);
        }
        root.put("rules", arr);
        return root;
    }

    @Override
    public String toString() {
        return isEmpty() ? "" : toJson().toString();
    }

    public record Rule(String field, String operator, String value) {
    }
}
