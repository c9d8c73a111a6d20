package com.vespasync.sync.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuestionCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReadPackagedCatalog() throws Exception {
        QuestionCatalog catalog = QuestionCatalog.load(tempDir, "question_catalog.json");

        QuestionCatalog.Question support = catalog.find("outcome_q_support").orElseThrow();
        assertEquals("field_2826", support.fieldFor(1));
        assertEquals("field_2832", support.fieldFor(3));
        assertEquals("", support.fieldFor(4));
        assertTrue(catalog.size() >= 13);
    }

    @Test
    void load_shouldPreferFileInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("catalog.json"),
                "[{\"questionId\":\"x1\",\"questionText\":\"Custom\",\"fieldIdCycle1\":\"field_1\"},{\"questionText\":\"no id\"}]",
                StandardCharsets.UTF_8);

        QuestionCatalog catalog = QuestionCatalog.load(tempDir, "catalog.json");

        assertEquals(1, catalog.size());
        assertEquals("field_1", catalog.questions().get(0).fieldFor(1));
        assertEquals("", catalog.questions().get(0).fieldFor(2));
    }

    @Test
    void load_shouldFailWhenCatalogMissing() {
        assertThrows(IOException.class, () -> QuestionCatalog.load(tempDir, "missing_catalog.json"));
    }
}
