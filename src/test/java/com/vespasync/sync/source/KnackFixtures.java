package com.vespasync.sync.source;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Source records shaped like the Knack object API returns them.
 */
public final class KnackFixtures {
    public static final QuestionCatalog CATALOG = new QuestionCatalog(List.of(
            new QuestionCatalog.Question("q1", "I've worked out the next steps in my life",
                    List.of("field_794", "field_1202", "field_1242")),
            new QuestionCatalog.Question("outcome_q_support", "I have the support I need",
                    List.of("field_2826", "field_2829", "field_2832")),
            new QuestionCatalog.Question("outcome_q_equipped", "I feel equipped",
                    List.of("field_2827", "field_2830", "field_2833")),
            new QuestionCatalog.Question("outcome_q_confident", "I am confident",
                    List.of("field_2828", "field_2831", "field_2834"))
    ));

    private KnackFixtures() {
    }

    public static JSONObject institution(String id, String name) {
        return new JSONObject()
                .put("id", id)
                .put("field_44", name)
                .put("field_2209", "Active");
    }

    /**
     * Person with cycle 1 scores in vision, effort, systems, practice, attitude, overall order;
     * a null entry is sent as an empty string.
     */
    public static JSONObject person(String id, String email, String institutionId, String completionDate, Object... cycle1) {
        JSONObject record = new JSONObject()
                .put("id", id)
                .put("field_197", email)
                .put("field_133", institutionId)
                .put("field_133_raw", new JSONArray().put(new JSONObject().put("id", institutionId)))
                .put("field_187_raw", new JSONObject().put("first", "Sam").put("last", "Lee"))
                .put("field_223", "12B")
                .put("field_855", completionDate == null ? "" : completionDate);
        return withCycle(record, 1, cycle1);
    }

    public static JSONObject withCycle(JSONObject record, int cycle, Object... scores) {
        int base = 155 + 6 * (cycle - 1);
        for (int i = 0; i < scores.length; i++) {
            record.put("field_" + (base + i), scores[i] == null ? "" : scores[i]);
        }
        return record;
    }

    /**
     * Cycle 1 answers for the three outcome questions plus q1.
     */
    public static JSONObject responses(String id, String personId, int support, int equipped, int confident) {
        return new JSONObject()
                .put("id", id)
                .put("field_792_raw", new JSONArray().put(new JSONObject().put("id", personId)))
                .put("field_794", "4")
                .put("field_2826", support)
                .put("field_2827", equipped)
                .put("field_2828", confident);
    }

    public static JSONObject staffAdmin(String id, String email, String institutionName) {
        return new JSONObject()
                .put("id", id)
                .put("field_24", email)
                .put("field_23_raw", new JSONObject().put("full", "Pat Admin"))
                .put("field_205", institutionName);
    }

    public static JSONObject superUser(String id, String email) {
        return new JSONObject()
                .put("id", id)
                .put("field_234", email)
                .put("field_233", "Root User");
    }
}
