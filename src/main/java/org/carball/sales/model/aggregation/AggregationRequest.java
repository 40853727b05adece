package org.carball.sales.model.aggregation;

import lombok.Builder;
import lombok.Singular;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a dimensional aggregation computes: the grouping, the per-group metrics, the
 * primary metric rows are ranked by, and the label of the share-of-total column.
 */
@Builder
public record AggregationRequest(
        String name,
        GroupingKey grouping,
        @Singular List<MetricSpec> metrics,
        @Singular List<RatioMetric> ratios,
        String primaryMetric,
        String shareLabel
) {

    public AggregationRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(grouping, "grouping");
        Objects.requireNonNull(primaryMetric, "primaryMetric");
        metrics = List.copyOf(metrics);
        ratios = ratios == null ? List.of() : List.copyOf(ratios);
        if (shareLabel == null) {
            shareLabel = "Share %";
        }

        Set<String> labels = new HashSet<>();
        for (MetricSpec metric : metrics) {
            if (!labels.add(metric.label())) {
                throw new IllegalArgumentException("Duplicate metric label: " + metric.label());
            }
        }
        if (!labels.contains(primaryMetric)) {
            throw new IllegalArgumentException("Primary metric '" + primaryMetric + "' is not one of the metrics of " + name);
        }
        for (RatioMetric ratio : ratios) {
            if (!labels.contains(ratio.numeratorLabel()) || !labels.contains(ratio.denominatorLabel())) {
                throw new IllegalArgumentException("Ratio '" + ratio.label() + "' refers to an unknown metric");
            }
            if (!labels.add(ratio.label())) {
                throw new IllegalArgumentException("Duplicate metric label: " + ratio.label());
            }
        }
        if (labels.contains(shareLabel)) {
            throw new IllegalArgumentException("Share label clashes with a metric: " + shareLabel);
        }
    }

    public Reduction reductionOf(String label) {
        return metrics.stream()
                .filter(m -> m.label().equals(label))
                .map(MetricSpec::reduction)
                .findFirst()
                .orElse(null);
    }
}
