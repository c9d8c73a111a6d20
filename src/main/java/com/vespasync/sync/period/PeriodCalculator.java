package com.vespasync.sync.period;

import com.vespasync.sync.config.Config;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives reporting-period labels ("2024/2025") from dates and an institution calendar policy.
 * <p>
 * Fiscal institutions roll over on the first day of {@code fiscalStartMonth}; calendar-year
 * institutions use a same-year label ("2025/2025"). Benchmark comparisons fold calendar labels
 * onto the fiscal label that starts in the same year.
 */
public final class PeriodCalculator {
    private static final Pattern PERIOD_PATTERN = Pattern.compile("^(\\d{4})/(\\d{4})$");
    private static final List<DateTimeFormatter> SOURCE_DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("d/M/yyyy"),
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private final int fiscalStartMonth;
    private final Clock clock;

    public PeriodCalculator(int fiscalStartMonth, Clock clock) {
        if (fiscalStartMonth < 1 || fiscalStartMonth > 12) {
            throw new IllegalArgumentException("fiscal start month must be within 1..12: " + fiscalStartMonth);
        }
        this.fiscalStartMonth = fiscalStartMonth;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public PeriodCalculator(Config config, Clock clock) {
        this(config.getInt("period.fiscal_start_month", 8), clock);
    }

    public String period(LocalDate date, boolean usesCalendarYear) {
        LocalDate target = date == null ? today() : date;
        int year = target.getYear();
        if (usesCalendarYear) {
            return year + "/" + year;
        }
        if (target.getMonthValue() >= fiscalStartMonth) {
            return year + "/" + (year + 1);
        }
        return (year - 1) + "/" + year;
    }

    /**
     * Period for a raw source date; blank or unparseable input falls back to today.
     */
    public String periodForSourceDate(String rawDate, boolean usesCalendarYear) {
        return period(parseSourceDate(rawDate).orElse(null), usesCalendarYear);
    }

    public String normalizeForBenchmark(String period) {
        if (period == null) {
            return null;
        }
        Matcher m = PERIOD_PATTERN.matcher(period.trim());
        if (!m.matches()) {
            return period;
        }
        int start = Integer.parseInt(m.group(1));
        int end = Integer.parseInt(m.group(2));
        if (start == end) {
            return start + "/" + (start + 1);
        }
        return period;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public static Optional<LocalDate> parseSourceDate(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        // "2025-03-01T09:00:00" and "01/03/2025 09:00" both carry a time part
        int space = text.indexOf(' ');
        if (space > 0) {
            text = text.substring(0, space);
        }
        int t = text.indexOf('T');
        if (t > 0) {
            text = text.substring(0, t);
        }
        for (DateTimeFormatter format : SOURCE_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return Optional.empty();
    }
}
