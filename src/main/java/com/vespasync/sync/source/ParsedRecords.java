package com.vespasync.sync.source;

import java.util.List;

/**
 * Typed views of source records, produced once at ingestion by {@link KnackRecordParser}.
 */
public final class ParsedRecords {
    private ParsedRecords() {
    }

    public record InstitutionRecord(String externalId, String name, String status, boolean usesCalendarYear) {
    }

    public record PersonRecord(
            String externalId,
            String email,
            String name,
            String institutionExternalId,
            String groupName,
            String yearGroup,
            String course,
            String faculty,
            String completionDate,
            List<CycleScores> cycles
    ) {
    }

    /**
     * Scores of one cycle in vision, effort, systems, practice, attitude, overall order.
     * Entries are null when blank or rejected; {@code rejectedFields} names the fields dropped
     * for being outside 0..10 or not numeric.
     */
    public record CycleScores(int cycle, List<Integer> scores, List<String> rejectedFields) {
    }

    public record ResponseSet(String externalId, String personExternalId, List<Answer> answers, List<String> rejectedFields) {
    }

    public record Answer(int cycle, String questionId, int value) {
    }

    public record StaffRecord(String externalId, String email, String name, String institutionName) {
    }
}
