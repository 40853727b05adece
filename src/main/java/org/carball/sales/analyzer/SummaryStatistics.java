package org.carball.sales.analyzer;

import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.statistics.DistributionSummary;
import org.carball.sales.model.statistics.SummaryStatisticsResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Distribution summaries of numeric fields. Quartiles interpolate linearly between ranks and
 * outliers are values beyond 1.5 interquartile ranges from the quartiles.
 */
public class SummaryStatistics {

    public static final List<SalesField> DEFAULT_FIELDS = List.of(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD);

    private static final double IQR_FENCE = 1.5;

    public SummaryStatisticsResult summarize(RecordSet records) {
        return summarize(records, DEFAULT_FIELDS);
    }

    public SummaryStatisticsResult summarize(RecordSet records, List<SalesField> fields) {
        if (records.isEmpty()) {
            throw new EmptyDatasetException("summary statistics");
        }
        List<DistributionSummary> summaries = new ArrayList<>();
        for (SalesField field : fields) {
            summaries.add(describe(records, field));
        }
        return new SummaryStatisticsResult(summaries);
    }

    public DistributionSummary describe(RecordSet records, SalesField field) {
        double[] values = records.stream()
                .mapToDouble(r -> field.numericValueOf(r).doubleValue())
                .sorted()
                .toArray();
        int n = values.length;

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double std = n > 1 ? Math.sqrt(squares / (n - 1)) : Double.NaN;

        double q1 = quantile(values, 0.25);
        double q3 = quantile(values, 0.75);
        double iqr = q3 - q1;
        double lowerFence = q1 - IQR_FENCE * iqr;
        double upperFence = q3 + IQR_FENCE * iqr;
        long outliers = 0;
        for (double v : values) {
            if (v < lowerFence || v > upperFence) {
                outliers++;
            }
        }

        return DistributionSummary.builder()
                .field(field)
                .count(n)
                .mean(mean)
                .std(std)
                .min(values[0])
                .q1(q1)
                .median(quantile(values, 0.5))
                .q3(q3)
                .max(values[n - 1])
                .outliers(outliers)
                .build();
    }

    static double quantile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
