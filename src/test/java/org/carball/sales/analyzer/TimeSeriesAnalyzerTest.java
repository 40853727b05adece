package org.carball.sales.analyzer;

import org.carball.sales.SalesRecords;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.table.ResultTable;
import org.carball.sales.model.timeseries.TimeSeriesResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.sales.SalesRecords.sale;

class TimeSeriesAnalyzerTest {

    private final TimeSeriesAnalyzer analyzer = new TimeSeriesAnalyzer();

    @Test
    void shouldComputeGrowthAgainstPreviousPeriod() {
        List<BigDecimal> growth = TimeSeriesAnalyzer.growthRates(amounts("100", "150", "90"));

        assertThat(growth.get(0)).isNull();
        assertThat(growth.get(1)).isEqualByComparingTo("50.0");
        assertThat(growth.get(2)).isEqualByComparingTo("-40.0");
    }

    @Test
    void shouldLeaveGrowthUndefinedAfterZeroPeriod() {
        List<BigDecimal> growth = TimeSeriesAnalyzer.growthRates(amounts("0", "50", "75"));

        assertThat(growth.get(0)).isNull();
        assertThat(growth.get(1)).isNull();
        assertThat(growth.get(2)).isEqualByComparingTo("50.00");
    }

    @Test
    void shouldOrderMonthsChronologicallyAcrossYears() {
        RecordSet records = RecordSet.of(
                sale("2024-04-10", "40"),
                sale("2023-12-31", "10"),
                sale("2024-01-05", "20"),
                sale("2024-01-20", "30"));

        TimeSeriesResult<YearMonth> monthly = analyzer.monthly(records);

        assertThat(monthly.periods()).containsExactly(
                YearMonth.of(2023, 12), YearMonth.of(2024, 1), YearMonth.of(2024, 4));
        assertThat(monthly.rows().get(0).label()).isEqualTo("December 2023");
        assertThat(monthly.series(TimeSeriesAnalyzer.TOTAL_SALES))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("10"), new BigDecimal("50"), new BigDecimal("40"));
        assertThat(monthly.rows().get(1).metric(TimeSeriesAnalyzer.AVG_TRANSACTION)).isEqualByComparingTo("25");
        assertThat(monthly.growthSeries().get(1)).isEqualByComparingTo("400.00");
        assertThat(monthly.growthSeries().get(2)).isEqualByComparingTo("-20.00");
    }

    @Test
    void shouldRenderMonthlyTable() {
        ResultTable table = analyzer.monthly(SalesRecords.sampleSet()).toTable();

        assertThat(table.name()).isEqualTo("monthly_performance");
        assertThat(table.columns()).containsExactly("Month", "Total Sales", "Avg Transaction",
                "Num Transactions", "Growth %");
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.cell(0, "Month")).isEqualTo("January 2024");
        assertThat(table.cell(0, "Growth %")).isNull();
        assertThat(table.cell(1, "Total Sales")).isEqualTo(new BigDecimal("725.74"));
        assertThat(table.cell(1, "Num Transactions")).isEqualTo(3L);
        assertThat(table.cell(1, "Growth %")).isEqualTo(new BigDecimal("32.98"));
        assertThat(table.cell(2, "Growth %")).isEqualTo(new BigDecimal("-60.74"));
    }

    @Test
    void shouldOrderWeekdaysMondayFirstAndOmitAbsentDays() {
        TimeSeriesResult<DayOfWeek> weekly = analyzer.weekly(SalesRecords.sampleSet());

        assertThat(weekly.periods()).containsExactly(DayOfWeek.MONDAY, DayOfWeek.TUESDAY,
                DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);
        assertThat(weekly.rows().get(0).label()).isEqualTo("Monday");
        assertThat(weekly.rows().get(2).metric(TimeSeriesAnalyzer.TOTAL_SALES)).isEqualByComparingTo("925.74");
        assertThat(weekly.rows().get(2).metric(TimeSeriesAnalyzer.NUM_TRANSACTIONS)).isEqualByComparingTo("4");
        assertThat(weekly.hasGrowth()).isFalse();
    }

    @Test
    void shouldComputeTrailingMovingAverageWithMinimumOnePeriod() {
        List<BigDecimal> averages = TimeSeriesAnalyzer.movingAverage(amounts("10", "20", "30"), 7);

        assertThat(averages)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("10"), new BigDecimal("15"), new BigDecimal("20"));
    }

    @Test
    void shouldSlideWindowOnceFull() {
        List<BigDecimal> averages = TimeSeriesAnalyzer.movingAverage(amounts("10", "20", "30", "40"), 2);

        assertThat(averages)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("10"), new BigDecimal("15"), new BigDecimal("25"), new BigDecimal("35"));
    }

    @Test
    void shouldProduceOneDailyRowPerDistinctDate() {
        RecordSet records = SalesRecords.sampleSet();

        TimeSeriesResult<LocalDate> daily = analyzer.dailyTrend(records, TimeSeriesAnalyzer.DEFAULT_WINDOW);

        assertThat(daily.rows()).hasSize(9);
        assertThat(daily.periods()).isSorted();
        // 2024-01-03 carries two sales
        assertThat(daily.rows().get(1).metric(TimeSeriesAnalyzer.DAILY_SALES)).isEqualByComparingTo("345.50");
        assertThat(daily.movingAverageSeries().get(0)).isEqualByComparingTo("120.00");
        assertThat(daily.toTable().columns()).containsExactly("Date", "Daily Sales", "Moving Average (7d)");
    }

    @Test
    void shouldLeaveMovingAverageUndefinedForZeroWindow() {
        TimeSeriesResult<LocalDate> daily = analyzer.dailyTrend(SalesRecords.sampleSet(), 0);

        assertThat(daily.movingAverageSeries()).hasSize(9).containsOnlyNulls();
    }

    @Test
    void shouldRejectNegativeWindow() {
        assertThatThrownBy(() -> analyzer.dailyTrend(SalesRecords.sampleSet(), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void shouldRejectEmptyRecordSet() {
        assertThatThrownBy(() -> analyzer.monthly(RecordSet.empty()))
                .isInstanceOf(EmptyDatasetException.class);
        assertThatThrownBy(() -> analyzer.weekly(RecordSet.empty()))
                .isInstanceOf(EmptyDatasetException.class);
        assertThatThrownBy(() -> analyzer.dailyTrend(RecordSet.empty(), 7))
                .isInstanceOf(EmptyDatasetException.class);
    }

    private static List<BigDecimal> amounts(String... values) {
        return Arrays.stream(values).map(BigDecimal::new).collect(Collectors.toList());
    }
}
