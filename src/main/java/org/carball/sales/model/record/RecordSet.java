package org.carball.sales.model.record;

import org.carball.sales.exception.InvalidValueException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable, date-ordered collection of sales records for one analysis run.
 *
 * <p>Records are re-checked on admission: a non-positive amount or unit count raises
 * {@link InvalidValueException} instead of flowing into the analyses. Records sharing a date
 * keep their input order.</p>
 */
public final class RecordSet implements Iterable<SalesRecord> {

    private static final RecordSet EMPTY = new RecordSet(List.of());

    private final List<SalesRecord> records;

    private RecordSet(List<SalesRecord> records) {
        this.records = records;
    }

    public static RecordSet of(List<SalesRecord> records) {
        List<SalesRecord> sorted = new ArrayList<>(records.size());
        int index = 0;
        for (SalesRecord record : records) {
            checkAdmissible(record, index++);
            sorted.add(record);
        }
        sorted.sort(Comparator.comparing(SalesRecord::date));
        return new RecordSet(Collections.unmodifiableList(sorted));
    }

    public static RecordSet of(SalesRecord... records) {
        return of(List.of(records));
    }

    public static RecordSet empty() {
        return EMPTY;
    }

    private static void checkAdmissible(SalesRecord record, int index) {
        if (record.salesAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidValueException(SalesField.SALES_AMOUNT.getColumnName(), record.salesAmount(),
                    "record #" + index + " on " + record.date());
        }
        if (record.unitsSold() <= 0) {
            throw new InvalidValueException(SalesField.UNITS_SOLD.getColumnName(), record.unitsSold(),
                    "record #" + index + " on " + record.date());
        }
    }

    public List<SalesRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<SalesRecord> stream() {
        return records.stream();
    }

    public Optional<LocalDate> firstDate() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0).date());
    }

    public Optional<LocalDate> lastDate() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1).date());
    }

    @Override
    public Iterator<SalesRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return String.format("RecordSet{size=%d, from=%s, to=%s}",
                records.size(), firstDate().orElse(null), lastDate().orElse(null));
    }
}
