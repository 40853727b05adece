package org.carball.sales.config;

public enum OutputFormat {
    CSV,
    JSON,
    MARKDOWN,
    ALL;

    public boolean includes(OutputFormat format) {
        return this == ALL || this == format;
    }
}
