package org.carball.sales.model.correlation;

import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.table.ResultTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Symmetric matrix of Pearson coefficients, rounded to three decimals. Cells involving a
 * zero-variance field are {@link Double#NaN}.
 */
public final class CorrelationResult {

    public static final String TABLE_NAME = "correlation_matrix";

    private final List<SalesField> fields;
    private final double[][] matrix;

    public CorrelationResult(List<SalesField> fields, double[][] matrix) {
        if (matrix.length != fields.size()) {
            throw new IllegalArgumentException("Matrix size does not match field count");
        }
        this.fields = List.copyOf(fields);
        this.matrix = new double[fields.size()][];
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != fields.size()) {
                throw new IllegalArgumentException("Correlation matrix must be square");
            }
            this.matrix[i] = matrix[i].clone();
        }
    }

    public List<SalesField> fields() {
        return fields;
    }

    public double get(SalesField row, SalesField column) {
        return matrix[indexOf(row)][indexOf(column)];
    }

    private int indexOf(SalesField field) {
        int index = fields.indexOf(field);
        if (index < 0) {
            throw new IllegalArgumentException("Field not in correlation matrix: " + field.getColumnName());
        }
        return index;
    }

    public ResultTable toTable() {
        List<String> columns = new ArrayList<>();
        columns.add("field");
        fields.forEach(f -> columns.add(f.getColumnName()));

        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            List<Object> cells = new ArrayList<>();
            cells.add(fields.get(i).getColumnName());
            for (int j = 0; j < fields.size(); j++) {
                cells.add(matrix[i][j]);
            }
            rows.add(cells);
        }
        return new ResultTable(TABLE_NAME, columns, rows);
    }
}
