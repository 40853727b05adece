package org.carball.sales.exception;

import java.nio.file.Path;

public class DataNotFoundException extends SalesAnalyticsException {

    private final Path source;

    public DataNotFoundException(Path source) {
        super("Sales data file not found: " + source);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
