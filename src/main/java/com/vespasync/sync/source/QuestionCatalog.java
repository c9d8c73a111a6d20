package com.vespasync.sync.source;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps questionnaire questions to the per-cycle source fields that hold their answers.
 */
public final class QuestionCatalog {
    private final List<Question> questions;

    public QuestionCatalog(List<Question> questions) {
        this.questions = questions == null ? List.of() : List.copyOf(questions);
    }

    /**
     * Loads from a file when {@code location} exists on disk, otherwise from the classpath.
     */
    public static QuestionCatalog load(Path workingDir, String location) throws IOException {
        Path file = workingDir.resolve(location).normalize();
        if (Files.isRegularFile(file)) {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        }
        try (InputStream in = QuestionCatalog.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null) {
                throw new IOException("question catalog not found: " + location);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static QuestionCatalog parse(String json) {
        JSONArray arr = new JSONArray(json);
        List<Question> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String id = item.optString("questionId", "").trim();
            if (id.isEmpty()) {
                continue;
            }
            out.add(new Question(
                    id,
                    item.optString("questionText", ""),
                    List.of(
                            item.optString("fieldIdCycle1", "").trim(),
                            item.optString("fieldIdCycle2", "").trim(),
                            item.optString("fieldIdCycle3", "").trim()
                    )
            ));
        }
        return new QuestionCatalog(out);
    }

    public List<Question> questions() {
        return questions;
    }

    public Optional<Question> find(String questionId) {
        return questions.stream().filter(q -> q.id().equals(questionId)).findFirst();
    }

    public int size() {
        return questions.size();
    }

    public record Question(String id, String text, List<String> cycleFields) {
        /**
         * Source field holding the answer for {@code cycle} (1-based), or "" when the question is not asked.
         */
        public String fieldFor(int cycle) {
            if (cycle < 1 || cycle > cycleFields.size()) {
                return "";
            }
            return cycleFields.get(cycle - 1);
        }
    }
}
