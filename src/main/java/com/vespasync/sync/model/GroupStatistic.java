package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Descriptive statistics of one dimension for one institution, cycle and period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupStatistic {
    private UUID institutionId;
    private int cycle;
    private String period;
    private String dimension;
    private double mean;
    private double stdDev;
    private double p25;
    private double p50;
    private double p75;
    private int count;
    private int[] histogram;
}
