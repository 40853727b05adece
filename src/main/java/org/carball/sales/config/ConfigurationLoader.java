package org.carball.sales.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_WINDOW = "SALES_MOVING_AVERAGE_WINDOW";
    static final String ENV_PARALLELISM = "SALES_PARALLELISM";
    static final String ENV_CORRELATION_FIELDS = "SALES_CORRELATION_FIELDS";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public AnalysisSettings loadSettings(Path configFile, String[] args) {
        log.debug("Loading analysis settings");

        AnalysisSettings settings = loadFile(configFile);
        applyEnvironmentVariables(settings);
        applyCLIArguments(settings, args);
        settings.validate();

        log.info("Settings loaded: {}", settings.getDescription());
        return settings;
    }

    /**
     * Reads settings from a YAML file, falling back to defaults when no usable file is given.
     */
    public AnalysisSettings loadFile(Path configFile) {
        if (configFile == null) {
            log.info("No settings file provided, using defaults");
            return AnalysisSettings.createDefaults();
        }
        if (!Files.exists(configFile)) {
            log.warn("Settings file not found: {}, using defaults", configFile);
            return AnalysisSettings.createDefaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            AnalysisSettings settings = mapper.readValue(configFile.toFile(), AnalysisSettings.class);
            log.info("Loaded settings from: {}", configFile);
            return settings;
        } catch (IOException e) {
            log.error("Failed to load settings from {}: {}, using defaults", configFile, e.getMessage());
            return AnalysisSettings.createDefaults();
        }
    }

    private void applyEnvironmentVariables(AnalysisSettings settings) {
        if (environment.containsKey(ENV_WINDOW)) {
            parseInt(ENV_WINDOW, environment.get(ENV_WINDOW), settings::setMovingAverageWindow);
        }
        if (environment.containsKey(ENV_PARALLELISM)) {
            parseInt(ENV_PARALLELISM, environment.get(ENV_PARALLELISM), settings::setParallelism);
        }
        if (environment.containsKey(ENV_CORRELATION_FIELDS)) {
            settings.setCorrelationFields(splitList(environment.get(ENV_CORRELATION_FIELDS)));
        }
    }

    private void applyCLIArguments(AnalysisSettings settings, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--window":
                case "-w":
                    parseInt(arg, value, settings::setMovingAverageWindow);
                    break;
                case "--parallelism":
                case "-p":
                    parseInt(arg, value, settings::setParallelism);
                    break;
                case "--correlation-fields":
                    settings.setCorrelationFields(splitList(value));
                    break;
            }
        }
    }

    private static void parseInt(String source, String value, IntConsumer target) {
        try {
            target.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Returns help text for the settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --window, -w <days>             Trailing moving average window (default: 7, 0 disables)
              --parallelism, -p <num>         Analyses run concurrently (default: 1)
              --correlation-fields <a,b,...>  Numeric fields of the correlation matrix
              --config <file.yml>             YAML settings file

            Environment Variables:
              SALES_MOVING_AVERAGE_WINDOW     Same as --window
              SALES_PARALLELISM               Same as --parallelism
              SALES_CORRELATION_FIELDS        Same as --correlation-fields

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
