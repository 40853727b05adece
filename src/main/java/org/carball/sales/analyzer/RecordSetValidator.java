package org.carball.sales.analyzer;

import org.carball.sales.model.record.RecordSet;
import org.carball.sales.model.record.ValidationResult;

import java.util.List;

/**
 * Gatekeeper run once before any analysis.
 */
public class RecordSetValidator {

    public ValidationResult validate(RecordSet records) {
        if (records.isEmpty()) {
            return ValidationResult.failure(ValidationResult.Status.EMPTY_DATASET,
                    List.of("no records remain after loading and cleaning"));
        }
        return ValidationResult.valid();
    }
}
