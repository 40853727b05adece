package org.carball.sales.model.record;

import org.carball.sales.exception.InvalidValueException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.sales.SalesRecords.sale;

class RecordSetTest {

    @Test
    void shouldOrderRecordsByDateKeepingInputOrderForEqualDates() {
        SalesRecord late = sale("2024-03-01", "10");
        SalesRecord sameDayFirst = sale("2024-01-05", "20");
        SalesRecord sameDaySecond = sale("2024-01-05", "30");

        RecordSet records = RecordSet.of(late, sameDayFirst, sameDaySecond);

        assertThat(records.records()).containsExactly(sameDayFirst, sameDaySecond, late);
        assertThat(records.firstDate()).contains(LocalDate.of(2024, 1, 5));
        assertThat(records.lastDate()).contains(LocalDate.of(2024, 3, 1));
    }

    @Test
    void shouldNotBeAffectedByLaterChangesToSourceList() {
        List<SalesRecord> source = new ArrayList<>(List.of(sale("2024-01-01", "10")));
        RecordSet records = RecordSet.of(source);

        source.add(sale("2024-01-02", "20"));

        assertThat(records.size()).isEqualTo(1);
        assertThatThrownBy(() -> records.records().add(sale("2024-01-03", "5")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectNonPositiveSalesAmount() {
        SalesRecord zero = sale("2024-01-01", "0.00");

        assertThatThrownBy(() -> RecordSet.of(sale("2024-01-01", "5"), zero))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("sales_amount")
                .hasMessageContaining("record #1");
    }

    @Test
    void shouldRejectNonPositiveUnits() {
        SalesRecord noUnits = sale("2024-01-01", "5", 0, "NORTH", "Home", "C1", "Alice");

        assertThatThrownBy(() -> RecordSet.of(noUnits))
                .isInstanceOf(InvalidValueException.class)
                .satisfies(e -> assertThat(((InvalidValueException) e).getField()).isEqualTo("units_sold"));
    }

    @Test
    void shouldDeriveUnitPriceAndCalendarFields() {
        SalesRecord record = sale("2024-05-18", "100.00", 8, "NORTH", "Home", "C1", "Alice");

        assertThat(record.unitPrice()).isEqualByComparingTo(new BigDecimal("12.5"));
        assertThat(record.year()).isEqualTo(2024);
        assertThat(record.monthNum()).isEqualTo(5);
        assertThat(record.quarter()).isEqualTo(2);
        assertThat(record.week()).isEqualTo(20);
        assertThat(record.dayOfWeek()).isEqualTo(DayOfWeek.SATURDAY);
        assertThat(record.yearMonth()).isEqualTo(YearMonth.of(2024, 5));
    }

    @Test
    void shouldExposeEmptySet() {
        assertThat(RecordSet.empty().isEmpty()).isTrue();
        assertThat(RecordSet.empty().firstDate()).isEmpty();
    }
}
