package org.carball.sales.exception;

public class AnalysisCancelledException extends SalesAnalyticsException {

    public AnalysisCancelledException(String analysisName) {
        super("Analysis cancelled: " + analysisName);
    }
}
