package org.carball.sales.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.config.AnalysisSettings;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.aggregation.AggregationRequest;
import org.carball.sales.model.aggregation.AggregationResult;
import org.carball.sales.model.analysis.AnalysisReport;
import org.carball.sales.model.correlation.CorrelationResult;
import org.carball.sales.model.kpi.KpiResult;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.record.ValidationResult;
import org.carball.sales.model.statistics.SummaryStatisticsResult;
import org.carball.sales.model.timeseries.TimeSeriesResult;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs every analysis over one record set. The record set is validated once up front; after
 * that the analyses only read it, so with a parallelism above one they run on a shared pool.
 */
@Slf4j
public class SalesAnalyzer {

    private final AnalysisSettings settings;
    private final List<AggregationRequest> dimensions;
    private final RecordSetValidator validator = new RecordSetValidator();
    private final KpiCalculator kpiCalculator = new KpiCalculator();
    private final DimensionalAggregator aggregator = new DimensionalAggregator();
    private final TimeSeriesAnalyzer timeSeriesAnalyzer = new TimeSeriesAnalyzer();
    private final CorrelationEngine correlationEngine = new CorrelationEngine();
    private final SummaryStatistics summaryStatistics = new SummaryStatistics();

    public SalesAnalyzer(AnalysisSettings settings) {
        this(settings, StandardDimensions.all());
    }

    public SalesAnalyzer(AnalysisSettings settings, List<AggregationRequest> dimensions) {
        this.settings = settings != null ? settings : AnalysisSettings.createDefaults();
        this.dimensions = List.copyOf(dimensions);
        log.info("Initialized SalesAnalyzer with settings: {}", this.settings.getDescription());
    }

    public AnalysisReport analyze(RecordSet records) {
        return analyze(records, CancellationSignal.none());
    }

    public AnalysisReport analyze(RecordSet records, CancellationSignal signal) {
        ValidationResult validation = validator.validate(records);
        if (!validation.isValid()) {
            log.error("Record set failed validation: {}", validation.describe());
            throw new EmptyDatasetException("analysis (" + String.join("; ", validation.problems()) + ")");
        }

        List<SalesField> correlationFields = settings.getCorrelationFieldList();
        int window = settings.getMovingAverageWindow();
        log.info("Starting analysis of {}", records);

        if (settings.getParallelism() <= 1) {
            Map<String, AggregationResult> aggregations = new LinkedHashMap<>();
            for (AggregationRequest request : dimensions) {
                aggregations.put(request.name(), aggregator.aggregate(records, request, signal));
            }
            return logged(new AnalysisReport(
                    kpiCalculator.calculate(records),
                    aggregations,
                    timeSeriesAnalyzer.monthly(records),
                    timeSeriesAnalyzer.weekly(records),
                    timeSeriesAnalyzer.dailyTrend(records, window),
                    correlationEngine.correlate(records, correlationFields),
                    summaryStatistics.summarize(records)));
        }

        ExecutorService pool = Executors.newFixedThreadPool(settings.getParallelism());
        try {
            CompletableFuture<KpiResult> kpis = submit(pool, () -> kpiCalculator.calculate(records));
            Map<String, CompletableFuture<AggregationResult>> aggregationFutures = new LinkedHashMap<>();
            for (AggregationRequest request : dimensions) {
                aggregationFutures.put(request.name(), submit(pool, () -> aggregator.aggregate(records, request, signal)));
            }
            CompletableFuture<TimeSeriesResult<YearMonth>> monthly = submit(pool, () -> timeSeriesAnalyzer.monthly(records));
            CompletableFuture<TimeSeriesResult<DayOfWeek>> weekly = submit(pool, () -> timeSeriesAnalyzer.weekly(records));
            CompletableFuture<TimeSeriesResult<LocalDate>> daily =
                    submit(pool, () -> timeSeriesAnalyzer.dailyTrend(records, window));
            CompletableFuture<CorrelationResult> correlation =
                    submit(pool, () -> correlationEngine.correlate(records, correlationFields));
            CompletableFuture<SummaryStatisticsResult> summary = submit(pool, () -> summaryStatistics.summarize(records));

            Map<String, AggregationResult> aggregations = new LinkedHashMap<>();
            for (Map.Entry<String, CompletableFuture<AggregationResult>> entry : aggregationFutures.entrySet()) {
                aggregations.put(entry.getKey(), join(entry.getValue()));
            }
            return logged(new AnalysisReport(join(kpis), aggregations, join(monthly), join(weekly), join(daily),
                    join(correlation), join(summary)));
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T> CompletableFuture<T> submit(ExecutorService pool, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, pool);
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
    }

    private AnalysisReport logged(AnalysisReport report) {
        log.info("Analysis complete: {} months, {} days, {} dimensional breakdowns",
                report.monthly().rows().size(), report.dailyTrend().rows().size(), report.aggregations().size());
        report.aggregations().values().forEach(result -> result.top().ifPresent(top ->
                log.debug("Top of {}: {} ({})", result.name(), top.key(), top.metric(result.request().primaryMetric()))));
        return report;
    }
}
