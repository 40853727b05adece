package org.carball.sales.model.statistics;

import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.table.Presentation;
import org.carball.sales.model.table.ResultTable;

import java.util.ArrayList;
import java.util.List;

public record SummaryStatisticsResult(List<DistributionSummary> summaries) {

    public static final String TABLE_NAME = "summary_statistics";

    public SummaryStatisticsResult {
        summaries = List.copyOf(summaries);
    }

    public DistributionSummary of(SalesField field) {
        return summaries.stream()
                .filter(s -> s.field() == field)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No summary for " + field.getColumnName()));
    }

    public ResultTable toTable() {
        List<String> columns = List.of("field", "count", "mean", "std", "min", "25%", "50%", "75%", "max", "outliers");
        List<List<Object>> rows = new ArrayList<>();
        for (DistributionSummary s : summaries) {
            List<Object> cells = new ArrayList<>();
            cells.add(s.field().getColumnName());
            cells.add(s.count());
            cells.add(Presentation.round(s.mean(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.std(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.min(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.q1(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.median(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.q3(), Presentation.MONEY_SCALE));
            cells.add(Presentation.round(s.max(), Presentation.MONEY_SCALE));
            cells.add(s.outliers());
            rows.add(cells);
        }
        return new ResultTable(TABLE_NAME, columns, rows);
    }
}
