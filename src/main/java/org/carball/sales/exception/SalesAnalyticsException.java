package org.carball.sales.exception;

/**
 * Base type for every failure the sales analyzer reports to its caller.
 */
public abstract class SalesAnalyticsException extends RuntimeException {

    protected SalesAnalyticsException(String message) {
        super(message);
    }

    protected SalesAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
