package org.carball.sales.model.record;

import java.util.List;

/**
 * Outcome of checking a {@link RecordSet} before any analysis runs.
 */
public record ValidationResult(Status status, List<String> problems) {

    public enum Status {
        VALID,
        EMPTY_DATASET
    }

    public ValidationResult {
        problems = List.copyOf(problems);
    }

    public static ValidationResult valid() {
        return new ValidationResult(Status.VALID, List.of());
    }

    public static ValidationResult failure(Status status, List<String> problems) {
        if (status == Status.VALID) {
            throw new IllegalArgumentException("A failure needs a non-VALID status");
        }
        return new ValidationResult(status, problems);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public String describe() {
        return isValid() ? "valid" : status + ": " + String.join("; ", problems);
    }
}
