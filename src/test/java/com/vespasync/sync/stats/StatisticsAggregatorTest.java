package com.vespasync.sync.stats;

import com.vespasync.sync.model.BenchmarkStatistic;
import com.vespasync.sync.model.GroupStatistic;
import com.vespasync.sync.period.PeriodCalculator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatisticsAggregatorTest {
    private static final UUID NORTH = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID SOUTH = UUID.fromString("00000000-0000-0000-0000-000000000002");
    private static final List<String> OUTCOME_QUESTIONS = List.of("outcome_q_confident", "outcome_q_equipped", "outcome_q_support");

    private final StatisticsAggregator aggregator = new StatisticsAggregator(
            new PeriodCalculator(8, Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC)),
            11,
            OUTCOME_QUESTIONS
    );

    @Test
    void scoreStatistics_shouldWeightBenchmarkMeanByObservations() {
        List<ScoreObservation> observations = new ArrayList<>();
        observations.addAll(repeat(NORTH, "2024/2025", 4.0, 10));
        observations.addAll(repeat(SOUTH, "2024/2025", 6.0, 30));

        StatisticsAggregator.Result result = aggregator.scoreStatistics(observations);

        assertEquals(2, result.groups().size());
        assertEquals(1, result.benchmarks().size());
        BenchmarkStatistic benchmark = result.benchmarks().get(0);
        assertEquals(5.5, benchmark.getMean());
        assertEquals(40, benchmark.getCount());
        assertEquals(2, benchmark.getInstitutionCount());
        assertEquals(1.41, benchmark.getStdDev());
        assertEquals(3.5, benchmark.getP25());
        assertEquals(5.0, benchmark.getP50());
        assertEquals(6.5, benchmark.getP75());
        assertEquals(10, benchmark.getHistogram()[4]);
        assertEquals(30, benchmark.getHistogram()[6]);
        assertEquals(40, sum(benchmark.getHistogram()));
    }

    @Test
    void scoreStatistics_shouldDescribeEachInstitutionFromRawObservations() {
        List<ScoreObservation> observations = List.of(
                new ScoreObservation(NORTH, 1, "2024/2025", "vision", 2),
                new ScoreObservation(NORTH, 1, "2024/2025", "vision", 4),
                new ScoreObservation(NORTH, 1, "2024/2025", "vision", 6),
                new ScoreObservation(NORTH, 1, "2024/2025", "vision", 8)
        );

        GroupStatistic group = aggregator.scoreStatistics(observations).groups().get(0);

        assertEquals(5.0, group.getMean());
        assertEquals(2.58, group.getStdDev());
        assertEquals(3.5, group.getP25());
        assertEquals(5.0, group.getP50());
        assertEquals(6.5, group.getP75());
        assertEquals(4, group.getCount());
        assertArrayEquals(new int[]{0, 0, 1, 0, 1, 0, 1, 0, 1, 0, 0}, group.getHistogram());
    }

    @Test
    void scoreStatistics_shouldFoldCalendarPeriodIntoFiscalBenchmark() {
        List<ScoreObservation> observations = new ArrayList<>();
        observations.addAll(repeat(NORTH, "2025/2025", 7.0, 2));
        observations.addAll(repeat(SOUTH, "2025/2026", 5.0, 2));

        StatisticsAggregator.Result result = aggregator.scoreStatistics(observations);

        assertEquals(2, result.groups().size());
        assertEquals(1, result.benchmarks().size());
        assertEquals("2025/2026", result.benchmarks().get(0).getPeriod());
        assertEquals(6.0, result.benchmarks().get(0).getMean());
    }

    @Test
    void scoreStatistics_shouldSkipObservationsWithoutInstitutionOrPeriod() {
        List<ScoreObservation> observations = List.of(
                new ScoreObservation(null, 1, "2024/2025", "vision", 5),
                new ScoreObservation(NORTH, 1, " ", "vision", 5),
                new ScoreObservation(NORTH, 1, "2024/2025", "vision", 5)
        );

        StatisticsAggregator.Result result = aggregator.scoreStatistics(observations);

        assertEquals(2, result.skippedObservations());
        assertEquals(1, result.groups().size());
    }

    @Test
    void readinessStatistics_shouldSuppressBelowMinimumObservations() {
        StatisticsAggregator.Result result = aggregator.readinessStatistics(readiness(NORTH, 8));

        assertTrue(result.groups().isEmpty());
        assertTrue(result.benchmarks().isEmpty());
        assertEquals(0, result.suppressedGroups());
        assertEquals(1, result.suppressedBenchmarks());
    }

    @Test
    void readinessStatistics_shouldEmitExactlyOneRowAtMinimumObservations() {
        StatisticsAggregator.Result result = aggregator.readinessStatistics(readiness(NORTH, 11));

        assertTrue(result.groups().isEmpty());
        assertEquals(1, result.benchmarks().size());
        BenchmarkStatistic row = result.benchmarks().get(0);
        assertEquals(StatisticsAggregator.READINESS_DIMENSION, row.getDimension());
        assertEquals(1, row.getCycle());
        assertEquals("2024/2025", row.getPeriod());
        assertEquals(11, row.getCount());
        assertEquals(4.0, row.getMean());
        assertEquals(5, row.getHistogram().length);
        assertEquals(11, row.getHistogram()[3]);
    }

    @Test
    void readinessStatistics_shouldCountSmallInstitutionsTowardsThePeriodRow() {
        List<ReadinessAnswer> answers = new ArrayList<>(readiness(NORTH, 8));
        answers.addAll(readiness(SOUTH, 5));

        StatisticsAggregator.Result result = aggregator.readinessStatistics(answers);

        assertTrue(result.groups().isEmpty());
        assertEquals(1, result.benchmarks().size());
        assertEquals(13, result.benchmarks().get(0).getCount());
        assertEquals(2, result.benchmarks().get(0).getInstitutionCount());
    }

    @Test
    void readinessStatistics_shouldIgnoreQuestionsOutsideTheIndex() {
        List<ReadinessAnswer> answers = new ArrayList<>(readiness(NORTH, 11));
        for (ReadinessAnswer a : readiness(NORTH, 11)) {
            answers.add(new ReadinessAnswer(a.institutionId(), a.personId(), a.cycle(), a.period(), "q1", 1));
        }

        BenchmarkStatistic row = aggregator.readinessStatistics(answers).benchmarks().get(0);

        assertEquals(4.0, row.getMean());
    }

    private static List<ScoreObservation> repeat(UUID institution, String period, double value, int times) {
        List<ScoreObservation> out = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            out.add(new ScoreObservation(institution, 1, period, "vision", value));
        }
        return out;
    }

    /**
     * {@code persons} respondents answering 4, 5 and 3 to the outcome questions.
     */
    private static List<ReadinessAnswer> readiness(UUID institution, int persons) {
        List<ReadinessAnswer> out = new ArrayList<>();
        for (int i = 0; i < persons; i++) {
            UUID person = UUID.nameUUIDFromBytes((institution + "-" + i).getBytes());
            out.add(new ReadinessAnswer(institution, person, 1, "2024/2025", "outcome_q_confident", 4));
            out.add(new ReadinessAnswer(institution, person, 1, "2024/2025", "outcome_q_equipped", 5));
            out.add(new ReadinessAnswer(institution, person, 1, "2024/2025", "outcome_q_support", 3));
        }
        return out;
    }

    private static int sum(int[] values) {
        int total = 0;
        for (int v : values) {
            total += v;
        }
        return total;
    }
}
