package org.carball.sales.model.timeseries;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One period of a {@link TimeSeriesResult}. {@code growthPercent} is {@code null} for the
 * first period and after a zero-valued period; {@code movingAverage} is {@code null} when the
 * series carries no moving average.
 */
public record TimeSeriesRow<K>(
        K period,
        String label,
        Map<String, BigDecimal> metrics,
        BigDecimal growthPercent,
        BigDecimal movingAverage
) {

    public TimeSeriesRow {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public BigDecimal metric(String label) {
        if (!metrics.containsKey(label)) {
            throw new IllegalArgumentException("Unknown metric: " + label);
        }
        return metrics.get(label);
    }
}
