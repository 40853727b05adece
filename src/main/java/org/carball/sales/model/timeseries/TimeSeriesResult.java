package org.carball.sales.model.timeseries;

import org.carball.sales.model.table.Presentation;
import org.carball.sales.model.table.ResultTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chronologically ordered series of periods keyed by {@code K}.
 */
public record TimeSeriesResult<K extends Comparable<? super K>>(
        String name,
        String periodColumn,
        List<String> metricLabels,
        Set<String> countLabels,
        String growthColumn,
        String movingAverageColumn,
        List<TimeSeriesRow<K>> rows
) {

    public TimeSeriesResult {
        metricLabels = List.copyOf(metricLabels);
        countLabels = Set.copyOf(countLabels);
        rows = List.copyOf(rows);
    }

    public boolean hasGrowth() {
        return growthColumn != null;
    }

    public boolean hasMovingAverage() {
        return movingAverageColumn != null;
    }

    public List<K> periods() {
        return rows.stream().map(TimeSeriesRow::period).collect(Collectors.toList());
    }

    public List<BigDecimal> series(String metricLabel) {
        return rows.stream().map(r -> r.metric(metricLabel)).collect(Collectors.toList());
    }

    public List<BigDecimal> growthSeries() {
        return rows.stream().map(TimeSeriesRow::growthPercent).collect(Collectors.toList());
    }

    public List<BigDecimal> movingAverageSeries() {
        return rows.stream().map(TimeSeriesRow::movingAverage).collect(Collectors.toList());
    }

    public ResultTable toTable() {
        List<String> columns = new ArrayList<>();
        columns.add(periodColumn);
        columns.addAll(metricLabels);
        if (hasGrowth()) {
            columns.add(growthColumn);
        }
        if (hasMovingAverage()) {
            columns.add(movingAverageColumn);
        }

        List<List<Object>> tableRows = new ArrayList<>(rows.size());
        for (TimeSeriesRow<K> row : rows) {
            List<Object> cells = new ArrayList<>();
            cells.add(row.label());
            for (String label : metricLabels) {
                BigDecimal value = row.metric(label);
                cells.add(countLabels.contains(label) ? value.longValueExact() : Presentation.round2(value));
            }
            if (hasGrowth()) {
                cells.add(row.growthPercent());
            }
            if (hasMovingAverage()) {
                cells.add(Presentation.round2(row.movingAverage()));
            }
            tableRows.add(cells);
        }
        return new ResultTable(name, columns, tableRows);
    }
}
