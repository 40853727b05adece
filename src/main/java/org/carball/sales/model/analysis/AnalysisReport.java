package org.carball.sales.model.analysis;

import org.carball.sales.model.aggregation.AggregationResult;
import org.carball.sales.model.correlation.CorrelationResult;
import org.carball.sales.model.kpi.KpiResult;
import org.carball.sales.model.statistics.SummaryStatisticsResult;
import org.carball.sales.model.table.ResultTable;
import org.carball.sales.model.timeseries.TimeSeriesResult;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every result of one analysis run.
 */
public record AnalysisReport(
        KpiResult kpis,
        Map<String, AggregationResult> aggregations,
        TimeSeriesResult<YearMonth> monthly,
        TimeSeriesResult<DayOfWeek> weekly,
        TimeSeriesResult<LocalDate> dailyTrend,
        CorrelationResult correlation,
        SummaryStatisticsResult summaryStatistics
) {

    public AnalysisReport {
        aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
    }

    public AggregationResult aggregation(String name) {
        AggregationResult result = aggregations.get(name);
        if (result == null) {
            throw new IllegalArgumentException("No aggregation named " + name);
        }
        return result;
    }

    /**
     * All results as tables, in report order.
     */
    public List<ResultTable> tables() {
        List<ResultTable> tables = new ArrayList<>();
        tables.add(kpis.toTable());
        aggregations.values().forEach(a -> tables.add(a.toTable()));
        tables.add(monthly.toTable());
        tables.add(weekly.toTable());
        tables.add(dailyTrend.toTable());
        tables.add(correlation.toTable());
        tables.add(summaryStatistics.toTable());
        return tables;
    }
}
