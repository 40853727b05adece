package org.carball.sales.parser;

import org.carball.sales.model.record.RecordSet;

/**
 * Records admitted from a source file together with what cleaning removed.
 */
public record LoadResult(
        RecordSet records,
        int rawRows,
        int missingValueRows,
        int unparseableRows,
        int nonPositiveRows,
        int duplicateRows
) {

    public int droppedRows() {
        return missingValueRows + unparseableRows + nonPositiveRows + duplicateRows;
    }

    public double droppedPercentage() {
        return rawRows == 0 ? 0.0 : 100.0 * droppedRows() / rawRows;
    }
}
