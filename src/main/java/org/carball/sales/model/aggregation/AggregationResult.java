package org.carball.sales.model.aggregation;

import org.carball.sales.model.table.Presentation;
import org.carball.sales.model.table.ResultTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ranked per-group metrics. Rows are ordered by the primary metric descending, then by group
 * key.
 */
public record AggregationResult(AggregationRequest request, List<AggregationRow> rows) {

    public AggregationResult {
        rows = List.copyOf(rows);
    }

    public String name() {
        return request.name();
    }

    public Optional<AggregationRow> top() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<AggregationRow> row(GroupKey key) {
        return rows.stream().filter(r -> r.key().equals(key)).findFirst();
    }

    public List<String> metricLabels() {
        List<String> labels = new ArrayList<>();
        request.metrics().forEach(m -> labels.add(m.label()));
        request.ratios().forEach(r -> labels.add(r.label()));
        return labels;
    }

    public ResultTable toTable() {
        List<String> columns = new ArrayList<>(request.grouping().columnLabels());
        List<String> metricLabels = metricLabels();
        columns.addAll(metricLabels);
        columns.add(request.shareLabel());

        List<List<Object>> tableRows = new ArrayList<>(rows.size());
        for (AggregationRow row : rows) {
            List<Object> cells = new ArrayList<>(row.key().parts());
            for (String label : metricLabels) {
                cells.add(present(label, row.metric(label)));
            }
            cells.add(row.sharePercent());
            tableRows.add(cells);
        }
        return new ResultTable(request.name(), columns, tableRows);
    }

    private Object present(String label, BigDecimal value) {
        if (value == null) {
            return null;
        }
        Reduction reduction = request.reductionOf(label);
        if (reduction != null && reduction.isCount()) {
            return value.longValueExact();
        }
        return Presentation.round2(value);
    }
}
