package org.carball.sales.model.record;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * A single validated sales transaction. Calendar fields and the unit price are derived on
 * access so they can never drift from the stored values.
 */
public record SalesRecord(
        LocalDate date,
        BigDecimal salesAmount,
        int unitsSold,
        String region,
        String productCategory,
        String customerId,
        String salesRep
) {

    public SalesRecord {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(salesAmount, "salesAmount");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(productCategory, "productCategory");
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(salesRep, "salesRep");
    }

    public BigDecimal unitPrice() {
        return salesAmount.divide(BigDecimal.valueOf(unitsSold), MathContext.DECIMAL64);
    }

    public int year() {
        return date.getYear();
    }

    public int monthNum() {
        return date.getMonthValue();
    }

    public int quarter() {
        return date.get(IsoFields.QUARTER_OF_YEAR);
    }

    public int week() {
        return date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    public DayOfWeek dayOfWeek() {
        return date.getDayOfWeek();
    }

    public YearMonth yearMonth() {
        return YearMonth.from(date);
    }
}
