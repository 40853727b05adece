package org.carball.sales.exception;

public class EmptyDatasetException extends SalesAnalyticsException {

    public EmptyDatasetException(String operation) {
        super("No sales records available for " + operation);
    }
}
