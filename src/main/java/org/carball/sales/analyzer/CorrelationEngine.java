package org.carball.sales.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.correlation.CorrelationResult;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.record.SalesRecord;
import org.carball.sales.model.table.Presentation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.List;

/**
 * Pairwise Pearson correlation over numeric record fields.
 */
@Slf4j
public class CorrelationEngine {

    public static final List<SalesField> DEFAULT_FIELDS =
            List.of(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD, SalesField.UNIT_PRICE);

    public CorrelationResult correlate(RecordSet records) {
        return correlate(records, DEFAULT_FIELDS);
    }

    public CorrelationResult correlate(RecordSet records, List<SalesField> fields) {
        for (SalesField field : fields) {
            if (!field.isNumeric()) {
                throw new IllegalArgumentException("Cannot correlate non-numeric field: " + field.getColumnName());
            }
        }
        if (records.isEmpty()) {
            throw new EmptyDatasetException("correlation analysis");
        }

        int n = records.size();
        int k = fields.size();
        double[][] deviations = new double[k][n];
        double[] sumOfSquares = new double[k];
        boolean[] constant = new boolean[k];

        for (int f = 0; f < k; f++) {
            BigDecimal[] values = new BigDecimal[n];
            BigDecimal sum = BigDecimal.ZERO;
            int i = 0;
            for (SalesRecord record : records) {
                values[i] = fields.get(f).numericValueOf(record);
                sum = sum.add(values[i++]);
            }
            // decided on the exact values: a double mean of 0.1s is already off by one bit
            constant[f] = Arrays.stream(values).allMatch(v -> v.compareTo(values[0]) == 0);
            BigDecimal mean = sum.divide(BigDecimal.valueOf(n), MathContext.DECIMAL128);
            for (i = 0; i < n; i++) {
                deviations[f][i] = values[i].subtract(mean).doubleValue();
                sumOfSquares[f] += deviations[f][i] * deviations[f][i];
            }
            if (constant[f]) {
                log.debug("Field {} has zero variance, its correlations are undefined", fields.get(f).getColumnName());
            }
        }

        double[][] matrix = new double[k][k];
        for (int a = 0; a < k; a++) {
            for (int b = a; b < k; b++) {
                double value = constant[a] || constant[b]
                        ? Double.NaN
                        : coefficient(deviations[a], deviations[b], sumOfSquares[a], sumOfSquares[b], a == b);
                matrix[a][b] = value;
                matrix[b][a] = value;
            }
        }
        return new CorrelationResult(fields, matrix);
    }

    private static double coefficient(double[] x, double[] y, double ssX, double ssY, boolean diagonal) {
        if (diagonal) {
            return 1.0;
        }
        double crossProducts = 0;
        for (int i = 0; i < x.length; i++) {
            crossProducts += x[i] * y[i];
        }
        double r = crossProducts / Math.sqrt(ssX * ssY);
        // clamp floating error so a perfect fit never reads 1.0000000002
        r = Math.max(-1.0, Math.min(1.0, r));
        return Presentation.round(r, Presentation.CORRELATION_SCALE);
    }
}
