package org.carball.sales.model.record;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fields of a {@link SalesRecord} that analyses can group by, reduce or correlate.
 */
public enum SalesField {
    DATE("date", false, SalesRecord::date),
    SALES_AMOUNT("sales_amount", true, SalesRecord::salesAmount),
    UNITS_SOLD("units_sold", true, r -> BigDecimal.valueOf(r.unitsSold())),
    UNIT_PRICE("unit_price", true, SalesRecord::unitPrice),
    REGION("region", false, SalesRecord::region),
    PRODUCT_CATEGORY("product_category", false, SalesRecord::productCategory),
    CUSTOMER_ID("customer_id", false, SalesRecord::customerId),
    SALES_REP("sales_rep", false, SalesRecord::salesRep);

    /**
     * Columns a source file must provide; the remaining fields are derived.
     */
    public static final List<SalesField> REQUIRED_COLUMNS = List.of(
            DATE, SALES_AMOUNT, UNITS_SOLD, REGION, PRODUCT_CATEGORY, CUSTOMER_ID, SALES_REP);

    private final String columnName;
    private final boolean numeric;
    private final Function<SalesRecord, Object> extractor;

    SalesField(String columnName, boolean numeric, Function<SalesRecord, Object> extractor) {
        this.columnName = columnName;
        this.numeric = numeric;
        this.extractor = extractor;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public Object valueOf(SalesRecord record) {
        return extractor.apply(record);
    }

    public BigDecimal numericValueOf(SalesRecord record) {
        if (!numeric) {
            throw new IllegalStateException("Field " + columnName + " is not numeric");
        }
        return (BigDecimal) extractor.apply(record);
    }

    public static SalesField fromColumnName(String columnName) {
        return Arrays.stream(values())
                .filter(f -> f.columnName.equalsIgnoreCase(columnName.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sales field: " + columnName
                        + ". Valid fields: " + Arrays.stream(values())
                        .map(SalesField::getColumnName)
                        .collect(Collectors.joining(", "))));
    }
}
