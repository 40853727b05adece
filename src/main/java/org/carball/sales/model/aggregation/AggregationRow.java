package org.carball.sales.model.aggregation;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One group of an {@link AggregationResult}. Metric values are unrounded; a {@code null}
 * value marks an undefined ratio.
 */
public record AggregationRow(GroupKey key, Map<String, BigDecimal> metrics, BigDecimal sharePercent) {

    public AggregationRow {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public BigDecimal metric(String label) {
        if (!metrics.containsKey(label)) {
            throw new IllegalArgumentException("Unknown metric: " + label);
        }
        return metrics.get(label);
    }
}
