package org.carball.sales.analyzer;

import org.carball.sales.SalesRecords;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.kpi.KpiResult;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesRecord;
import org.carball.sales.model.table.ResultTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.sales.SalesRecords.sale;

class KpiCalculatorTest {

    private final KpiCalculator calculator = new KpiCalculator();

    @Test
    void shouldCalculateKpisForSampleSet() {
        KpiResult kpis = calculator.calculate(SalesRecords.sampleSet());

        assertThat(kpis.totalRevenue()).isEqualByComparingTo("1556.39");
        assertThat(kpis.averageTransactionValue()).isEqualByComparingTo("155.639");
        assertThat(kpis.medianTransactionValue()).isEqualByComparingTo("109.95");
        assertThat(kpis.totalUnitsSold()).isEqualTo(24);
        assertThat(kpis.transactionCount()).isEqualTo(10);
        assertThat(kpis.uniqueCustomers()).isEqualTo(7);
        assertThat(kpis.averageUnitsPerTransaction()).isEqualByComparingTo("2.4");
        assertThat(kpis.firstDate()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(kpis.lastDate()).isEqualTo(LocalDate.of(2024, 3, 9));
    }

    @Test
    void shouldSumRevenueExactlyOverManySmallAmounts() {
        List<SalesRecord> records = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            records.add(sale("2024-01-01", "0.10"));
        }

        KpiResult kpis = calculator.calculate(RecordSet.of(records));

        assertThat(kpis.totalRevenue()).isEqualByComparingTo(new BigDecimal("1000.00"));
    }

    @Test
    void shouldUseMiddleValueAsMedianForOddCount() {
        RecordSet records = RecordSet.of(
                sale("2024-01-01", "5"), sale("2024-01-02", "100"), sale("2024-01-03", "7"));

        assertThat(calculator.calculate(records).medianTransactionValue()).isEqualByComparingTo("7");
    }

    @Test
    void shouldRejectEmptyRecordSet() {
        assertThatThrownBy(() -> calculator.calculate(RecordSet.empty()))
                .isInstanceOf(EmptyDatasetException.class)
                .hasMessageContaining("KPI");
    }

    @Test
    void shouldPresentKpisAsSingleRowTableRoundedToCents() {
        RecordSet records = RecordSet.of(sale("2024-01-01", "10.005"), sale("2024-01-09", "20"));

        ResultTable table = calculator.calculate(records).toTable();

        assertThat(table.name()).isEqualTo("kpis");
        assertThat(table.rowCount()).isEqualTo(1);
        assertThat(table.columns()).containsExactly(
                "Total Revenue", "Average Transaction Value", "Median Transaction Value", "Total Units Sold",
                "Number of Transactions", "Number of Unique Customers", "Average Units per Transaction",
                "Date Range");
        assertThat(table.cell(0, "Total Revenue")).isEqualTo(new BigDecimal("30.01"));
        assertThat(table.cell(0, "Number of Transactions")).isEqualTo(2L);
        assertThat(table.cell(0, "Date Range")).isEqualTo("2024-01-01 to 2024-01-09");
    }
}
