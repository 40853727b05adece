package org.carball.sales.model.table;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Self-describing tabular form of an analysis result: a name, ordered column labels and
 * ordered rows. Cells may be {@code null} for undefined values.
 */
public record ResultTable(String name, List<String> columns, List<List<Object>> rows) {

    public ResultTable {
        columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row width %d does not match %d columns in table %s", row.size(), columns.size(), name));
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int rowCount() {
        return rows.size();
    }

    public Object cell(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column '" + column + "' in table " + name);
        }
        return rows.get(row).get(index);
    }

    /**
     * Text form of a cell as written to delimited output. Undefined cells render empty.
     */
    public static String formatCell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return "NaN";
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    public List<String> formatRow(int row) {
        List<String> cells = new ArrayList<>(columns.size());
        for (Object value : rows.get(row)) {
            cells.add(formatCell(value));
        }
        return cells;
    }
}
