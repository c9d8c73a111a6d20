package com.vespasync.sync.period;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodCalculatorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-02T08:00:00Z"), ZoneOffset.UTC);

    private final PeriodCalculator periods = new PeriodCalculator(8, CLOCK);

    @Test
    void period_shouldRollOverOnFirstDayOfFiscalStartMonth() {
        assertEquals("2024/2025", periods.period(LocalDate.of(2025, 7, 31), false));
        assertEquals("2025/2026", periods.period(LocalDate.of(2025, 8, 1), false));
        assertEquals("2024/2025", periods.period(LocalDate.of(2025, 1, 15), false));
    }

    @Test
    void period_shouldUseSameYearLabelForCalendarYearInstitutions() {
        assertEquals("2025/2025", periods.period(LocalDate.of(2025, 3, 1), true));
        assertEquals("2025/2025", periods.period(LocalDate.of(2025, 11, 30), true));
    }

    @Test
    void period_shouldFallBackToTodayWhenDateMissing() {
        assertEquals("2025/2026", periods.period(null, false));
        assertEquals("2025/2025", periods.periodForSourceDate("", true));
        assertEquals("2025/2026", periods.periodForSourceDate("not a date", false));
    }

    @Test
    void parseSourceDate_shouldAcceptSourceFormats() {
        assertEquals(LocalDate.of(2025, 3, 1), PeriodCalculator.parseSourceDate("01/03/2025").orElseThrow());
        assertEquals(LocalDate.of(2025, 3, 1), PeriodCalculator.parseSourceDate("1/3/2025").orElseThrow());
        assertEquals(LocalDate.of(2025, 3, 1), PeriodCalculator.parseSourceDate("2025-03-01T09:00:00").orElseThrow());
        assertEquals(LocalDate.of(2025, 3, 1), PeriodCalculator.parseSourceDate("01/03/2025 09:00").orElseThrow());
        assertTrue(PeriodCalculator.parseSourceDate("31/02/2025x").isEmpty());
        assertTrue(PeriodCalculator.parseSourceDate(null).isEmpty());
    }

    @Test
    void normalizeForBenchmark_shouldFoldCalendarLabelOntoFiscalLabel() {
        assertEquals("2025/2026", periods.normalizeForBenchmark("2025/2025"));
        assertEquals("2024/2025", periods.normalizeForBenchmark("2024/2025"));
        assertEquals("legacy", periods.normalizeForBenchmark("legacy"));
    }

    @Test
    void constructor_shouldRejectInvalidMonth() {
        assertThrows(IllegalArgumentException.class, () -> new PeriodCalculator(13, CLOCK));
        assertThrows(IllegalArgumentException.class, () -> new PeriodCalculator(0, CLOCK));
    }
}
