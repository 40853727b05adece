package org.carball.sales.model.kpi;

import lombok.Builder;
import org.carball.sales.model.table.Presentation;
import org.carball.sales.model.table.ResultTable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-dataset key performance indicators. Monetary values are exact and unrounded.
 */
@Builder
public record KpiResult(
        BigDecimal totalRevenue,
        BigDecimal averageTransactionValue,
        BigDecimal medianTransactionValue,
        long totalUnitsSold,
        long transactionCount,
        long uniqueCustomers,
        BigDecimal averageUnitsPerTransaction,
        LocalDate firstDate,
        LocalDate lastDate
) {

    public static final String TABLE_NAME = "kpis";

    public static final String TOTAL_REVENUE = "Total Revenue";
    public static final String AVERAGE_TRANSACTION_VALUE = "Average Transaction Value";
    public static final String MEDIAN_TRANSACTION_VALUE = "Median Transaction Value";
    public static final String TOTAL_UNITS_SOLD = "Total Units Sold";
    public static final String NUMBER_OF_TRANSACTIONS = "Number of Transactions";
    public static final String NUMBER_OF_UNIQUE_CUSTOMERS = "Number of Unique Customers";
    public static final String AVERAGE_UNITS_PER_TRANSACTION = "Average Units per Transaction";
    public static final String DATE_RANGE = "Date Range";

    /**
     * KPIs in report order, rounded for presentation.
     */
    public Map<String, Object> asMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put(TOTAL_REVENUE, Presentation.round2(totalRevenue));
        metrics.put(AVERAGE_TRANSACTION_VALUE, Presentation.round2(averageTransactionValue));
        metrics.put(MEDIAN_TRANSACTION_VALUE, Presentation.round2(medianTransactionValue));
        metrics.put(TOTAL_UNITS_SOLD, totalUnitsSold);
        metrics.put(NUMBER_OF_TRANSACTIONS, transactionCount);
        metrics.put(NUMBER_OF_UNIQUE_CUSTOMERS, uniqueCustomers);
        metrics.put(AVERAGE_UNITS_PER_TRANSACTION, Presentation.round2(averageUnitsPerTransaction));
        metrics.put(DATE_RANGE, firstDate + " to " + lastDate);
        return metrics;
    }

    public ResultTable toTable() {
        Map<String, Object> metrics = asMetrics();
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(metrics.values()));
        return new ResultTable(TABLE_NAME, new ArrayList<>(metrics.keySet()), rows);
    }
}
