package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResponseRecord implements Keyed {
    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 5;

    private UUID personId;
    private int cycle;
    private String questionId;
    private Integer value;
    // filled after the fact from the person's score record of the same cycle
    private String period;

    @Override
    public String naturalKey() {
        return personId + "|" + cycle + "|" + questionId;
    }

    public static boolean inRange(Integer value) {
        return value != null && value >= MIN_VALUE && value <= MAX_VALUE;
    }
}
