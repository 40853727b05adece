package org.carball.sales.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesRecord;
import org.carball.sales.model.timeseries.TimeSeriesResult;
import org.carball.sales.model.timeseries.TimeSeriesRow;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Chronological rollups of a record set: calendar months with period-over-period growth,
 * the day-of-week pattern and the daily series with a trailing moving average.
 */
@Slf4j
public class TimeSeriesAnalyzer {

    public static final String TOTAL_SALES = StandardDimensions.TOTAL_SALES;
    public static final String AVG_TRANSACTION = StandardDimensions.AVG_TRANSACTION;
    public static final String NUM_TRANSACTIONS = StandardDimensions.NUM_TRANSACTIONS;
    public static final String DAILY_SALES = "Daily Sales";
    public static final String GROWTH = "Growth %";

    public static final int DEFAULT_WINDOW = 7;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final List<String> PERIOD_METRICS = List.of(TOTAL_SALES, AVG_TRANSACTION, NUM_TRANSACTIONS);

    /**
     * Sales per calendar month in calendar order, with growth against the previous month.
     */
    public TimeSeriesResult<YearMonth> monthly(RecordSet records) {
        requireRecords(records, "monthly analysis");

        SortedMap<YearMonth, List<SalesRecord>> byMonth = partition(records, SalesRecord::yearMonth,
                new TreeMap<YearMonth, List<SalesRecord>>());
        List<BigDecimal> totals = new ArrayList<>();
        byMonth.values().forEach(group -> totals.add(sum(group)));
        List<BigDecimal> growth = growthRates(totals);

        List<TimeSeriesRow<YearMonth>> rows = new ArrayList<>();
        int i = 0;
        for (Map.Entry<YearMonth, List<SalesRecord>> month : byMonth.entrySet()) {
            rows.add(new TimeSeriesRow<>(month.getKey(), month.getKey().format(MONTH_LABEL),
                    periodMetrics(month.getValue()), growth.get(i++), null));
        }

        log.debug("Monthly analysis produced {} periods", rows.size());
        return new TimeSeriesResult<>("monthly_performance", "Month", PERIOD_METRICS,
                Set.of(NUM_TRANSACTIONS), GROWTH, null, rows);
    }

    /**
     * Sales per day of week, Monday first. Days without sales are left out.
     */
    public TimeSeriesResult<DayOfWeek> weekly(RecordSet records) {
        requireRecords(records, "weekly pattern analysis");

        // EnumMap iterates in declaration order, which is MONDAY..SUNDAY
        Map<DayOfWeek, List<SalesRecord>> byDay = partition(records, SalesRecord::dayOfWeek,
                new EnumMap<DayOfWeek, List<SalesRecord>>(DayOfWeek.class));

        List<TimeSeriesRow<DayOfWeek>> rows = new ArrayList<>();
        byDay.forEach((day, group) -> rows.add(new TimeSeriesRow<>(day,
                day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), periodMetrics(group), null, null)));

        return new TimeSeriesResult<>("weekly_pattern", "Day of Week", PERIOD_METRICS,
                Set.of(NUM_TRANSACTIONS), null, null, rows);
    }

    /**
     * Summed sales per distinct date with a trailing moving average over {@code window} days.
     * Until the window fills, the average covers the days seen so far. A window of zero
     * leaves the moving average undefined.
     */
    public TimeSeriesResult<LocalDate> dailyTrend(RecordSet records, int window) {
        if (window < 0) {
            throw new IllegalArgumentException("Moving average window must not be negative: " + window);
        }
        requireRecords(records, "daily trend analysis");

        SortedMap<LocalDate, BigDecimal> daily = new TreeMap<>();
        for (SalesRecord record : records) {
            daily.merge(record.date(), record.salesAmount(), BigDecimal::add);
        }
        List<BigDecimal> sums = new ArrayList<>(daily.values());
        List<BigDecimal> averages = movingAverage(sums, window);

        List<TimeSeriesRow<LocalDate>> rows = new ArrayList<>(sums.size());
        int i = 0;
        for (Map.Entry<LocalDate, BigDecimal> day : daily.entrySet()) {
            Map<String, BigDecimal> metrics = new LinkedHashMap<>();
            metrics.put(DAILY_SALES, day.getValue());
            rows.add(new TimeSeriesRow<>(day.getKey(), day.getKey().toString(), metrics, null, averages.get(i++)));
        }

        return new TimeSeriesResult<>("daily_trend", "Date", List.of(DAILY_SALES), Set.of(), null,
                "Moving Average (" + window + "d)", rows);
    }

    /**
     * Percentage change of each value against its predecessor, rounded to two decimals.
     * The first entry, and any entry following a zero, is {@code null}.
     */
    public static List<BigDecimal> growthRates(List<BigDecimal> values) {
        List<BigDecimal> rates = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            BigDecimal previous = i == 0 ? null : values.get(i - 1);
            if (previous == null || previous.signum() == 0) {
                rates.add(null);
            } else {
                rates.add(values.get(i).subtract(previous)
                        .multiply(HUNDRED)
                        .divide(previous, 2, RoundingMode.HALF_UP));
            }
        }
        return rates;
    }

    /**
     * Trailing mean with a minimum of one period. Returns all {@code null} for a zero window.
     */
    public static List<BigDecimal> movingAverage(List<BigDecimal> values, int window) {
        List<BigDecimal> averages = new ArrayList<>(values.size());
        if (window == 0) {
            values.forEach(v -> averages.add(null));
            return averages;
        }

        BigDecimal windowSum = BigDecimal.ZERO;
        for (int i = 0; i < values.size(); i++) {
            windowSum = windowSum.add(values.get(i));
            if (i >= window) {
                windowSum = windowSum.subtract(values.get(i - window));
            }
            int periods = Math.min(i + 1, window);
            averages.add(windowSum.divide(BigDecimal.valueOf(periods), MathContext.DECIMAL128));
        }
        return averages;
    }

    private static <K, M extends Map<K, List<SalesRecord>>> M partition(RecordSet records,
                                                                        Function<SalesRecord, K> key, M target) {
        for (SalesRecord record : records) {
            target.computeIfAbsent(key.apply(record), k -> new ArrayList<>()).add(record);
        }
        return target;
    }

    private static Map<String, BigDecimal> periodMetrics(List<SalesRecord> group) {
        BigDecimal total = sum(group);
        Map<String, BigDecimal> metrics = new LinkedHashMap<>();
        metrics.put(TOTAL_SALES, total);
        metrics.put(AVG_TRANSACTION, total.divide(BigDecimal.valueOf(group.size()), MathContext.DECIMAL128));
        metrics.put(NUM_TRANSACTIONS, BigDecimal.valueOf(group.size()));
        return metrics;
    }

    private static BigDecimal sum(List<SalesRecord> group) {
        return group.stream().map(SalesRecord::salesAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void requireRecords(RecordSet records, String operation) {
        if (records.isEmpty()) {
            throw new EmptyDatasetException(operation);
        }
    }
}
