package org.carball.sales.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.sales.model.record.SalesField;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tunable parameters of an analysis run, loadable from YAML.
 */
@Data
@Slf4j
public class AnalysisSettings {

    private static final int LONG_WINDOW_WARNING = 90;

    @JsonProperty("moving_average_window")
    private int movingAverageWindow = 7;

    @JsonProperty("correlation_fields")
    private List<String> correlationFields = new ArrayList<>(List.of("sales_amount", "units_sold", "unit_price"));

    // Number of analyses run at the same time; 1 runs them one after another
    @JsonProperty("parallelism")
    private int parallelism = 1;

    public static AnalysisSettings createDefaults() {
        return new AnalysisSettings();
    }

    /**
     * Resolves the configured correlation column names to fields.
     *
     * @throws IllegalArgumentException for unknown or non-numeric columns
     */
    @JsonIgnore
    public List<SalesField> getCorrelationFieldList() {
        List<SalesField> fields = correlationFields.stream()
                .map(SalesField::fromColumnName)
                .collect(Collectors.toList());
        for (SalesField field : fields) {
            if (!field.isNumeric()) {
                throw new IllegalArgumentException("Correlation field must be numeric: " + field.getColumnName());
            }
        }
        return fields;
    }

    /**
     * Rejects values no analysis can run with and warns about unusual ones.
     */
    public void validate() {
        if (movingAverageWindow < 0) {
            throw new IllegalArgumentException("Moving average window must not be negative: " + movingAverageWindow);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        if (correlationFields == null || correlationFields.size() < 2) {
            throw new IllegalArgumentException("At least two correlation fields are required");
        }
        getCorrelationFieldList();

        if (movingAverageWindow == 0) {
            log.warn("Moving average window is 0, the daily trend will carry no moving average");
        }
        if (movingAverageWindow > LONG_WINDOW_WARNING) {
            log.warn("Moving average window ({} days) is unusually long", movingAverageWindow);
        }
        int processors = Runtime.getRuntime().availableProcessors();
        if (parallelism > processors) {
            log.warn("Parallelism ({}) exceeds available processors ({})", parallelism, processors);
        }

        log.debug("Using settings - {}", getDescription());
    }

    @JsonIgnore
    public String getDescription() {
        return String.format("window=%d, correlationFields=%s, parallelism=%d",
                movingAverageWindow, correlationFields, parallelism);
    }
}
