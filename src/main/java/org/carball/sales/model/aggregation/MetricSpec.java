package org.carball.sales.model.aggregation;

import org.carball.sales.model.record.SalesField;

import java.util.Objects;

/**
 * Declares one per-group metric: which field is reduced, how, and the column it lands in.
 */
public record MetricSpec(SalesField field, Reduction reduction, String label) {

    public MetricSpec {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(reduction, "reduction");
        Objects.requireNonNull(label, "label");
        if ((reduction == Reduction.SUM || reduction == Reduction.MEAN) && !field.isNumeric()) {
            throw new IllegalArgumentException(reduction + " needs a numeric field, got " + field.getColumnName());
        }
    }

    public static MetricSpec sum(SalesField field, String label) {
        return new MetricSpec(field, Reduction.SUM, label);
    }

    public static MetricSpec mean(SalesField field, String label) {
        return new MetricSpec(field, Reduction.MEAN, label);
    }

    public static MetricSpec count(SalesField field, String label) {
        return new MetricSpec(field, Reduction.COUNT, label);
    }

    public static MetricSpec nunique(SalesField field, String label) {
        return new MetricSpec(field, Reduction.NUNIQUE, label);
    }
}
