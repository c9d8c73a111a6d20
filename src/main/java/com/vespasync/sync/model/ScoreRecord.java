package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One assessment cycle for one person in one reporting period.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRecord implements Keyed {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;
    public static final List<String> DIMENSIONS = List.of("vision", "effort", "systems", "practice", "attitude", "overall");

    private UUID personId;
    private int cycle;
    private String period;
    private Integer vision;
    private Integer effort;
    private Integer systems;
    private Integer practice;
    private Integer attitude;
    private Integer overall;
    private LocalDate completionDate;

    @Override
    public String naturalKey() {
        return personId + "|" + cycle + "|" + period;
    }

    /**
     * Scores in {@link #DIMENSIONS} order; entries may be null.
     */
    public List<Integer> scores() {
        return Arrays.asList(vision, effort, systems, practice, attitude, overall);
    }

    public boolean hasAnyScore() {
        return scores().stream().anyMatch(Objects::nonNull);
    }

    public int filledFields() {
        int filled = (int) scores().stream().filter(Objects::nonNull).count();
        return completionDate == null ? filled : filled + 1;
    }

    public static boolean inRange(Integer value) {
        return value != null && value >= MIN_SCORE && value <= MAX_SCORE;
    }
}
