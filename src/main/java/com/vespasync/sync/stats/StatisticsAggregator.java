package com.vespasync.sync.stats;

import com.vespasync.sync.config.Config;
import com.vespasync.sync.model.BenchmarkStatistic;
import com.vespasync.sync.model.GroupStatistic;
import com.vespasync.sync.period.PeriodCalculator;
import com.vespasync.sync.store.SyncStore;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 模块说明：StatisticsAggregator（class）。
 * 主要职责：从原始观测值全量重算机构级与基准级描述统计（均值、标准差、四分位、计数、直方图）。
 * 使用建议：机构级直接基于原始观测；基准级先做周期归一化，再在机构均值集合上计算离散度与分位数。
 * 维护提示：就绪度指数在 (cycle, period) 观测数不足阈值时不输出任何行。
 */
public final class StatisticsAggregator {
    public static final String READINESS_DIMENSION = "readiness";

    private final PeriodCalculator periods;
    private final int minReadinessObservations;
    private final Set<String> readinessQuestions;

    public StatisticsAggregator(PeriodCalculator periods, int minReadinessObservations, List<String> readinessQuestions) {
        this.periods = periods;
        this.minReadinessObservations = Math.max(1, minReadinessObservations);
        this.readinessQuestions = new LinkedHashSet<>(readinessQuestions == null ? List.of() : readinessQuestions);
    }

    public StatisticsAggregator(Config config, PeriodCalculator periods) {
        this(periods,
                config.getInt("stats.readiness.min_observations", 11),
                config.getList("stats.readiness.questions"));
    }

    public List<String> readinessQuestions() {
        return new ArrayList<>(readinessQuestions);
    }

    public int minReadinessObservations() {
        return minReadinessObservations;
    }

/**
 * 方法说明：scoreStatistics，负责计算六个得分维度的统计结果。
 * 处理流程：按 (机构, cycle, period, 维度) 分组，逐组求统计量，再汇总为基准统计。
 */
    public Result scoreStatistics(List<ScoreObservation> observations) {
        Map<GroupKey, List<Double>> grouped = new LinkedHashMap<>();
        int skipped = 0;
        for (ScoreObservation o : observations) {
            if (o.institutionId() == null || isBlank(o.period()) || isBlank(o.dimension())) {
                skipped++;
                continue;
            }
            grouped.computeIfAbsent(new GroupKey(o.institutionId(), o.cycle(), o.period(), o.dimension()),
                    k -> new ArrayList<>()).add(o.value());
        }
        return aggregate(grouped, Histogram.SCORES, 1, skipped);
    }

/**
 * 方法说明：readinessStatistics，负责计算就绪度指数。
 * 处理流程：先对每人每 (cycle, period) 的结果类问题取平均，作为一个观测；再按得分同样的规则聚合。
 * 维护提示：只输出基准行，每个 (cycle, period) 至多一行，观测数不足阈值时整行抑制；机构汇总仅作为基准的输入。
 */
    public Result readinessStatistics(List<ReadinessAnswer> answers) {
        Map<PersonKey, double[]> perPerson = new LinkedHashMap<>();
        int skipped = 0;
        for (ReadinessAnswer a : answers) {
            if (!readinessQuestions.isEmpty() && !readinessQuestions.contains(a.questionId())) {
                continue;
            }
            if (a.institutionId() == null || a.personId() == null || isBlank(a.period())) {
                skipped++;
                continue;
            }
            double[] acc = perPerson.computeIfAbsent(
                    new PersonKey(a.institutionId(), a.personId(), a.cycle(), a.period()),
                    k -> new double[2]);
            acc[0] += a.value();
            acc[1] += 1.0;
        }

        Map<GroupKey, List<Double>> grouped = new LinkedHashMap<>();
        for (Map.Entry<PersonKey, double[]> entry : perPerson.entrySet()) {
            PersonKey key = entry.getKey();
            double[] acc = entry.getValue();
            grouped.computeIfAbsent(new GroupKey(key.institutionId(), key.cycle(), key.period(), READINESS_DIMENSION),
                    k -> new ArrayList<>()).add(acc[0] / acc[1]);
        }
        Result byInstitution = aggregate(grouped, Histogram.READINESS, minReadinessObservations, skipped);
        return new Result(List.of(), byInstitution.benchmarks(), 0,
                byInstitution.suppressedBenchmarks(), byInstitution.skippedObservations());
    }

    public Result recomputeScores(SyncStore store) throws SQLException {
        Result result = scoreStatistics(store.loadScoreObservations());
        store.replaceGroupStatistics(StatisticsScope.SCORES, result.groups());
        store.replaceBenchmarkStatistics(StatisticsScope.SCORES, result.benchmarks());
        return result;
    }

    public Result recomputeReadiness(SyncStore store) throws SQLException {
        Result result = readinessStatistics(store.loadReadinessAnswers(readinessQuestions()));
        store.replaceGroupStatistics(StatisticsScope.READINESS, result.groups());
        store.replaceBenchmarkStatistics(StatisticsScope.READINESS, result.benchmarks());
        return result;
    }

    private Result aggregate(Map<GroupKey, List<Double>> grouped, Histogram histogram, int minObservations, int skipped) {
        List<GroupStatistic> groups = new ArrayList<>();
        Map<BenchmarkKey, List<Summary>> byBenchmark = new LinkedHashMap<>();
        int suppressedGroups = 0;

        for (Map.Entry<GroupKey, List<Double>> entry : grouped.entrySet()) {
            GroupKey key = entry.getKey();
            Summary summary = summarize(toArray(entry.getValue()), histogram);
            byBenchmark.computeIfAbsent(
                    new BenchmarkKey(key.cycle(), periods.normalizeForBenchmark(key.period()), key.dimension()),
                    k -> new ArrayList<>()).add(summary);
            if (summary.count < minObservations) {
                suppressedGroups++;
                continue;
            }
            groups.add(GroupStatistic.builder()
                    .institutionId(key.institutionId())
                    .cycle(key.cycle())
                    .period(key.period())
                    .dimension(key.dimension())
                    .mean(DescriptiveStats.round2(summary.mean))
                    .stdDev(DescriptiveStats.round2(summary.stdDev))
                    .p25(DescriptiveStats.round2(summary.p25))
                    .p50(DescriptiveStats.round2(summary.p50))
                    .p75(DescriptiveStats.round2(summary.p75))
                    .count(summary.count)
                    .histogram(summary.histogram)
                    .build());
        }

        List<BenchmarkStatistic> benchmarks = new ArrayList<>();
        int suppressedBenchmarks = 0;
        for (Map.Entry<BenchmarkKey, List<Summary>> entry : byBenchmark.entrySet()) {
            BenchmarkStatistic row = benchmark(entry.getKey(), entry.getValue());
            if (row.getCount() < minObservations) {
                suppressedBenchmarks++;
                continue;
            }
            benchmarks.add(row);
        }
        return new Result(groups, benchmarks, suppressedGroups, suppressedBenchmarks, skipped);
    }

    /**
     * Combines institution summaries: count-weighted mean, spread and quartiles over the
     * institution means when two or more contribute, histogram summed bin by bin.
     */
    static BenchmarkStatistic benchmark(BenchmarkKey key, List<Summary> institutions) {
        int count = 0;
        double weighted = 0.0;
        int[] histogram = null;
        double[] means = new double[institutions.size()];
        for (int i = 0; i < institutions.size(); i++) {
            Summary s = institutions.get(i);
            count += s.count;
            weighted += s.mean * s.count;
            histogram = Histogram.sum(histogram, s.histogram);
            means[i] = s.mean;
        }
        double mean = count == 0 ? 0.0 : weighted / count;

        double stdDev;
        double p25;
        double p50;
        double p75;
        if (institutions.size() >= 2) {
            double[] q = DescriptiveStats.exclusiveQuartiles(means);
            stdDev = DescriptiveStats.sampleStdDev(means);
            p25 = q[0];
            p50 = DescriptiveStats.median(means);
            p75 = q[2];
        } else {
            Summary only = institutions.get(0);
            stdDev = 0.0;
            p25 = only.p25;
            p50 = only.p50;
            p75 = only.p75;
        }
        return BenchmarkStatistic.builder()
                .cycle(key.cycle())
                .period(key.period())
                .dimension(key.dimension())
                .mean(DescriptiveStats.round2(mean))
                .stdDev(DescriptiveStats.round2(stdDev))
                .p25(DescriptiveStats.round2(p25))
                .p50(DescriptiveStats.round2(p50))
                .p75(DescriptiveStats.round2(p75))
                .count(count)
                .institutionCount(institutions.size())
                .histogram(histogram == null ? new int[0] : histogram)
                .build();
    }

    static Summary summarize(double[] values, Histogram histogram) {
        return new Summary(
                DescriptiveStats.mean(values),
                DescriptiveStats.sampleStdDev(values),
                DescriptiveStats.percentileCont(values, 0.25),
                DescriptiveStats.percentileCont(values, 0.50),
                DescriptiveStats.percentileCont(values, 0.75),
                values.length,
                histogram.count(values)
        );
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Rows to write plus what was held back.
     *
     * @param suppressedGroups     institution rows under the observation threshold
     * @param suppressedBenchmarks benchmark rows under the observation threshold
     * @param skippedObservations  inputs without institution or period
     */
    public record Result(
            List<GroupStatistic> groups,
            List<BenchmarkStatistic> benchmarks,
            int suppressedGroups,
            int suppressedBenchmarks,
            int skippedObservations
    ) {
    }

    record GroupKey(UUID institutionId, int cycle, String period, String dimension) {
    }

    record BenchmarkKey(int cycle, String period, String dimension) {
    }

    private record PersonKey(UUID institutionId, UUID personId, int cycle, String period) {
    }

    static final class Summary {
        final double mean;
        final double stdDev;
        final double p25;
        final double p50;
        final double p75;
        final int count;
        final int[] histogram;

        Summary(double mean, double stdDev, double p25, double p50, double p75, int count, int[] histogram) {
            this.mean = mean;
            this.stdDev = stdDev;
            this.p25 = p25;
            this.p50 = p50;
            this.p75 = p75;
            this.count = count;
            this.histogram = histogram;
        }
    }
}
