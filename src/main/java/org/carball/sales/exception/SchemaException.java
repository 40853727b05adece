package org.carball.sales.exception;

import java.util.List;

/**
 * Raised when the input is missing required columns or a column cannot be interpreted.
 */
public class SchemaException extends SalesAnalyticsException {

    private final List<String> missingFields;

    public SchemaException(List<String> missingFields) {
        super("Missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public SchemaException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
