package org.carball.sales.model.statistics;

import lombok.Builder;
import org.carball.sales.model.record.SalesField;

/**
 * Descriptive statistics of one numeric field. The standard deviation is the sample one and
 * is {@link Double#NaN} for a single observation.
 */
@Builder
public record DistributionSummary(
        SalesField field,
        long count,
        double mean,
        double std,
        double min,
        double q1,
        double median,
        double q3,
        double max,
        long outliers
) {

    public double interquartileRange() {
        return q3 - q1;
    }
}
