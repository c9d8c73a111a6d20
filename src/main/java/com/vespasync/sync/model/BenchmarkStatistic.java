package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cross-institution aggregate keyed by a normalized period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkStatistic {
    private int cycle;
    private String period;
    private String dimension;
    private double mean;
    private double stdDev;
    private double p25;
    private double p50;
    private double p75;
    private int count;
    private int institutionCount;
    private int[] histogram;
}
