package org.carball.sales.model.aggregation;

/**
 * Per-group metric derived by dividing two already reduced metrics. The value is undefined
 * ({@code null}) for groups whose denominator is zero.
 */
public record RatioMetric(String label, String numeratorLabel, String denominatorLabel) {
}
