package org.carball.sales.analyzer;

import org.carball.sales.SalesRecords;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.model.correlation.CorrelationResult;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.record.SalesRecord;
import org.carball.sales.model.table.ResultTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.sales.SalesRecords.sale;

class CorrelationEngineTest {

    private final CorrelationEngine engine = new CorrelationEngine();

    @Test
    void shouldBeSymmetricWithUnitDiagonal() {
        CorrelationResult result = engine.correlate(SalesRecords.sampleSet());

        for (SalesField a : result.fields()) {
            assertThat(result.get(a, a)).isEqualTo(1.0);
            for (SalesField b : result.fields()) {
                assertThat(result.get(a, b)).isEqualTo(result.get(b, a));
                assertThat(result.get(a, b)).isBetween(-1.0, 1.0);
            }
        }
    }

    @Test
    void shouldDetectPerfectCorrelationAndZeroVariance() {
        // unit price is 10 on every record
        RecordSet records = RecordSet.of(
                sale("2024-01-01", "10", 1, "NORTH", "Home", "C1", "Alice"),
                sale("2024-01-02", "20", 2, "NORTH", "Home", "C2", "Alice"),
                sale("2024-01-03", "30", 3, "NORTH", "Home", "C3", "Alice"));

        CorrelationResult result = engine.correlate(records);

        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD)).isEqualTo(1.0);
        assertThat(result.get(SalesField.UNIT_PRICE, SalesField.UNIT_PRICE)).isNaN();
        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.UNIT_PRICE)).isNaN();
        assertThat(result.get(SalesField.UNIT_PRICE, SalesField.UNITS_SOLD)).isNaN();
    }

    @Test
    void shouldTreatConstantDecimalAmountAsZeroVariance() {
        // Given: 0.1 has no exact double form, so a floating mean drifts off the values
        List<SalesRecord> records = new ArrayList<>();
        for (int units = 1; units <= 10; units++) {
            records.add(sale("2024-01-" + String.format("%02d", units), "0.1", units, "NORTH", "Home", "C" + units, "Alice"));
        }

        // When
        CorrelationResult result = engine.correlate(RecordSet.of(records));

        // Then
        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.SALES_AMOUNT)).isNaN();
        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD)).isNaN();
        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.UNIT_PRICE)).isNaN();
        assertThat(result.get(SalesField.UNITS_SOLD, SalesField.UNITS_SOLD)).isEqualTo(1.0);
        assertThat(result.get(SalesField.UNITS_SOLD, SalesField.UNIT_PRICE)).isLessThan(0.0);
    }

    @Test
    void shouldRoundToThreeDecimals() {
        RecordSet records = RecordSet.of(
                sale("2024-01-01", "10", 2, "NORTH", "Home", "C1", "Alice"),
                sale("2024-01-02", "20", 1, "NORTH", "Home", "C2", "Alice"),
                sale("2024-01-03", "30", 3, "NORTH", "Home", "C3", "Alice"));

        CorrelationResult result = engine.correlate(records, List.of(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD));

        assertThat(result.get(SalesField.SALES_AMOUNT, SalesField.UNITS_SOLD)).isEqualTo(0.5);
    }

    @Test
    void shouldRenderMatrixAsTable() {
        ResultTable table = engine.correlate(SalesRecords.sampleSet()).toTable();

        assertThat(table.name()).isEqualTo("correlation_matrix");
        assertThat(table.columns()).containsExactly("field", "sales_amount", "units_sold", "unit_price");
        assertThat(table.cell(1, "field")).isEqualTo("units_sold");
        assertThat(table.cell(1, "units_sold")).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNonNumericField() {
        assertThatThrownBy(() -> engine.correlate(SalesRecords.sampleSet(),
                List.of(SalesField.SALES_AMOUNT, SalesField.REGION)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("region");
    }

    @Test
    void shouldRejectEmptyRecordSet() {
        assertThatThrownBy(() -> engine.correlate(RecordSet.empty()))
                .isInstanceOf(EmptyDatasetException.class);
    }
}
