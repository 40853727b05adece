package org.carball.sales.parser;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.carball.sales.exception.DataNotFoundException;
import org.carball.sales.exception.SchemaException;
import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.SalesField;
import org.carball.sales.model.record.SalesRecord;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads sales transactions from a CSV file with a header row and cleans them into a
 * {@link RecordSet}.
 *
 * <p>Cleaning drops rows with a missing required value, rows whose date or numbers cannot be
 * parsed, rows with a non-positive amount or unit count, and exact duplicates. Regions are
 * upper-cased and categories title-cased. Extra columns are ignored.</p>
 */
@Slf4j
public class SalesCsvLoader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public LoadResult load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new DataNotFoundException(file);
        }
        log.info("Loading sales data from {}", file);

        try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                throw new SchemaException(SalesField.REQUIRED_COLUMNS.stream()
                        .map(SalesField::getColumnName)
                        .collect(Collectors.toList()));
            }
            Map<SalesField, Integer> columns = resolveColumns(header);
            return readRows(reader, columns);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        }
    }

    private Map<SalesField, Integer> resolveColumns(String[] header) {
        List<String> names = new ArrayList<>(header.length);
        for (String name : header) {
            String cleaned = name == null ? "" : name.trim();
            if (!cleaned.isEmpty() && cleaned.charAt(0) == BYTE_ORDER_MARK) {
                cleaned = cleaned.substring(1);
            }
            names.add(cleaned.toLowerCase(Locale.ROOT));
        }

        Map<SalesField, Integer> columns = new EnumMap<>(SalesField.class);
        List<String> missing = new ArrayList<>();
        for (SalesField field : SalesField.REQUIRED_COLUMNS) {
            int index = names.indexOf(field.getColumnName());
            if (index < 0) {
                missing.add(field.getColumnName());
            } else {
                columns.put(field, index);
            }
        }
        if (!missing.isEmpty()) {
            log.error("Input is missing required columns: {}", missing);
            throw new SchemaException(missing);
        }
        return columns;
    }

    private LoadResult readRows(CSVReader reader, Map<SalesField, Integer> columns)
            throws IOException, CsvValidationException {
        List<SalesRecord> records = new ArrayList<>();
        Set<List<Object>> seen = new HashSet<>();
        int raw = 0;
        int missing = 0;
        int unparseable = 0;
        int nonPositive = 0;
        int duplicates = 0;

        String[] row;
        while ((row = reader.readNext()) != null) {
            if (row.length == 1 && row[0].isBlank()) {
                continue;
            }
            raw++;
            long lineNumber = reader.getLinesRead();

            if (hasMissingValue(row, columns)) {
                missing++;
                continue;
            }

            SalesRecord record;
            try {
                record = toRecord(row, columns);
            } catch (DateTimeParseException | NumberFormatException | ArithmeticException e) {
                log.warn("Skipping unparseable row at line {}: {}", lineNumber, e.getMessage());
                unparseable++;
                continue;
            }

            if (record == null) {
                nonPositive++;
                continue;
            }
            if (!seen.add(identity(record, row, columns))) {
                duplicates++;
                continue;
            }
            records.add(record);
        }

        LoadResult result = new LoadResult(RecordSet.of(records), raw, missing, unparseable, nonPositive, duplicates);
        logQualitySummary(result);
        return result;
    }

    private static boolean hasMissingValue(String[] row, Map<SalesField, Integer> columns) {
        for (int index : columns.values()) {
            if (index >= row.length || row[index] == null || row[index].isBlank()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builds a record from a row, or returns {@code null} when amount or units are not positive.
     */
    private static SalesRecord toRecord(String[] row, Map<SalesField, Integer> columns) {
        LocalDate date = parseDate(value(row, columns, SalesField.DATE));
        BigDecimal amount = new BigDecimal(value(row, columns, SalesField.SALES_AMOUNT));
        BigDecimal units = new BigDecimal(value(row, columns, SalesField.UNITS_SOLD));

        if (amount.signum() <= 0 || units.signum() <= 0) {
            return null;
        }

        return new SalesRecord(
                date,
                amount,
                units.stripTrailingZeros().intValueExact(),
                value(row, columns, SalesField.REGION).toUpperCase(Locale.ROOT),
                titleCase(value(row, columns, SalesField.PRODUCT_CATEGORY)),
                value(row, columns, SalesField.CUSTOMER_ID),
                value(row, columns, SalesField.SALES_REP));
    }

    private static String value(String[] row, Map<SalesField, Integer> columns, SalesField field) {
        return row[columns.get(field)].trim();
    }

    static LocalDate parseDate(String text) {
        // timestamps written by other tools keep the date in the first ten characters
        if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
            text = text.substring(0, 10);
        }
        return LocalDate.parse(text);
    }

    static String titleCase(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }

    /**
     * Duplicate key of a row. Text columns are compared as read, before region and category
     * are normalised, so rows differing only in case are both kept.
     */
    private static List<Object> identity(SalesRecord record, String[] row, Map<SalesField, Integer> columns) {
        return List.of(record.date(), record.salesAmount().stripTrailingZeros(), record.unitsSold(),
                value(row, columns, SalesField.REGION), value(row, columns, SalesField.PRODUCT_CATEGORY),
                record.customerId(), record.salesRep());
    }

    private void logQualitySummary(LoadResult result) {
        RecordSet records = result.records();
        log.info("Loaded {} raw rows, kept {} ({} dropped, {}%)", result.rawRows(), records.size(),
                result.droppedRows(), String.format("%.1f", result.droppedPercentage()));
        if (result.droppedRows() > 0) {
            log.warn("Dropped rows - missing values: {}, unparseable: {}, non-positive: {}, duplicates: {}",
                    result.missingValueRows(), result.unparseableRows(), result.nonPositiveRows(), result.duplicateRows());
        }
        if (records.isEmpty()) {
            return;
        }

        BigDecimal total = records.stream().map(SalesRecord::salesAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        log.info("Date range: {} to {}", records.firstDate().orElseThrow(), records.lastDate().orElseThrow());
        log.info("Total sales: {}", total.setScale(2, RoundingMode.HALF_UP));
        log.debug("Regions: {}, categories: {}, sales reps: {}",
                records.stream().map(SalesRecord::region).distinct().count(),
                records.stream().map(SalesRecord::productCategory).distinct().count(),
                records.stream().map(SalesRecord::salesRep).distinct().count());
    }
}
