package org.carball.sales.exception;

/**
 * Raised when a record with a non-positive amount or unit count reaches the engine.
 */
public class InvalidValueException extends SalesAnalyticsException {

    private final String field;

    public InvalidValueException(String field, Object value, String context) {
        super(String.format("Invalid value for %s: %s (%s)", field, value, context));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
