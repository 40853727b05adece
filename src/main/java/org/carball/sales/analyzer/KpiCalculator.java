package org.carball.sales.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.kpi.KpiResult;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesRecord;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes whole-dataset KPIs with exact decimal accumulation.
 */
@Slf4j
public class KpiCalculator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public KpiResult calculate(RecordSet records) {
        if (records.isEmpty()) {
            throw new EmptyDatasetException("KPI calculation");
        }

        long count = records.size();
        BigDecimal totalRevenue = BigDecimal.ZERO;
        long totalUnits = 0;
        for (SalesRecord record : records) {
            totalRevenue = totalRevenue.add(record.salesAmount());
            totalUnits += record.unitsSold();
        }

        long uniqueCustomers = records.stream()
                .map(SalesRecord::customerId)
                .distinct()
                .count();

        KpiResult result = KpiResult.builder()
                .totalRevenue(totalRevenue)
                .averageTransactionValue(totalRevenue.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128))
                .medianTransactionValue(median(records))
                .totalUnitsSold(totalUnits)
                .transactionCount(count)
                .uniqueCustomers(uniqueCustomers)
                .averageUnitsPerTransaction(BigDecimal.valueOf(totalUnits)
                        .divide(BigDecimal.valueOf(count), MathContext.DECIMAL128))
                .firstDate(records.firstDate().orElseThrow())
                .lastDate(records.lastDate().orElseThrow())
                .build();

        log.debug("Calculated KPIs over {} transactions: revenue={}, customers={}",
                count, totalRevenue, uniqueCustomers);
        return result;
    }

    private BigDecimal median(RecordSet records) {
        List<BigDecimal> amounts = records.stream()
                .map(SalesRecord::salesAmount)
                .sorted()
                .collect(Collectors.toList());

        int middle = amounts.size() / 2;
        if (amounts.size() % 2 == 1) {
            return amounts.get(middle);
        }
        // halving a finite decimal always terminates
        return amounts.get(middle - 1).add(amounts.get(middle)).divide(TWO);
    }
}
