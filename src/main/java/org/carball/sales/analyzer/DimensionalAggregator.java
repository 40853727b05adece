package org.carball.sales.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.exception.AnalysisCancelledException;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.aggregation.AggregationRequest;
import org.carball.sales.model.aggregation.AggregationResult;
import org.carball.sales.model.aggregation.AggregationRow;
import org.carball.sales.model.aggregation.GroupKey;
import org.carball.sales.model.aggregation.MetricSpec;
import org.carball.sales.model.aggregation.RatioMetric;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesRecord;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Generic group-by engine: partitions records by a grouping key, reduces each group with the
 * requested metrics and ranks groups by a primary metric with its share of the total.
 */
@Slf4j
public class DimensionalAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO_SHARE = BigDecimal.ZERO.setScale(2);

    public AggregationResult aggregate(RecordSet records, AggregationRequest request) {
        return aggregate(records, request, CancellationSignal.none());
    }

    /**
     * Runs the aggregation, checking {@code signal} before each group. A cancelled run
     * raises {@link AnalysisCancelledException} and produces no result.
     */
    public AggregationResult aggregate(RecordSet records, AggregationRequest request, CancellationSignal signal) {
        if (records.isEmpty()) {
            throw new EmptyDatasetException(request.name());
        }

        Map<GroupKey, List<SalesRecord>> groups = records.stream()
                .collect(Collectors.groupingBy(r -> request.grouping().keyOf(r), TreeMap::new, Collectors.toList()));
        log.debug("Aggregating {} records into {} groups for {}", records.size(), groups.size(), request.name());

        Map<GroupKey, Map<String, BigDecimal>> reduced = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, List<SalesRecord>> group : groups.entrySet()) {
            if (signal.isCancelled()) {
                log.info("Aggregation {} cancelled after {} of {} groups", request.name(), reduced.size(), groups.size());
                throw new AnalysisCancelledException(request.name());
            }
            reduced.put(group.getKey(), reduceGroup(group.getValue(), request));
        }

        BigDecimal total = reduced.values().stream()
                .map(metrics -> metrics.get(request.primaryMetric()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            log.warn("Total of {} is zero for {}, reporting all shares as 0", request.primaryMetric(), request.name());
        }

        List<AggregationRow> rows = new ArrayList<>(reduced.size());
        reduced.forEach((key, metrics) -> rows.add(
                new AggregationRow(key, metrics, share(metrics.get(request.primaryMetric()), total))));

        Comparator<AggregationRow> byPrimaryDescending = Comparator
                .comparing((AggregationRow row) -> row.metric(request.primaryMetric()))
                .reversed();
        rows.sort(byPrimaryDescending.thenComparing(AggregationRow::key));

        return new AggregationResult(request, rows);
    }

    private Map<String, BigDecimal> reduceGroup(List<SalesRecord> group, AggregationRequest request) {
        Map<String, BigDecimal> metrics = new LinkedHashMap<>();
        for (MetricSpec spec : request.metrics()) {
            metrics.put(spec.label(), reduce(spec, group));
        }
        for (RatioMetric ratio : request.ratios()) {
            BigDecimal denominator = metrics.get(ratio.denominatorLabel());
            BigDecimal value = denominator.signum() == 0
                    ? null
                    : metrics.get(ratio.numeratorLabel()).divide(denominator, MathContext.DECIMAL128);
            metrics.put(ratio.label(), value);
        }
        return metrics;
    }

    static BigDecimal reduce(MetricSpec spec, List<SalesRecord> group) {
        switch (spec.reduction()) {
            case SUM:
                return sum(spec, group);
            case MEAN:
                return sum(spec, group).divide(BigDecimal.valueOf(group.size()), MathContext.DECIMAL128);
            case COUNT:
                return BigDecimal.valueOf(group.size());
            case NUNIQUE:
                return BigDecimal.valueOf(group.stream()
                        .map(r -> spec.field().valueOf(r))
                        .distinct()
                        .count());
            default:
                throw new IllegalStateException("Unsupported reduction: " + spec.reduction());
        }
    }

    private static BigDecimal sum(MetricSpec spec, List<SalesRecord> group) {
        BigDecimal sum = BigDecimal.ZERO;
        for (SalesRecord record : group) {
            sum = sum.add(spec.field().numericValueOf(record));
        }
        return sum;
    }

    private static BigDecimal share(BigDecimal value, BigDecimal total) {
        if (total.signum() == 0) {
            return ZERO_SHARE;
        }
        return value.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
    }
}
