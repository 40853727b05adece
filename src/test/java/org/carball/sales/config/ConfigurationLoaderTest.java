package org.carball.sales.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldUseDefaultsWithoutAnySource() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        AnalysisSettings settings = loader.loadSettings(null, new String[0]);

        // Then
        assertThat(settings).isEqualTo(AnalysisSettings.createDefaults());
    }

    @Test
    void shouldReadYamlFile() throws IOException {
        // Given
        Path file = tempDir.resolve("settings.yml");
        Files.writeString(file, """
            moving_average_window: 14
            parallelism: 2
            correlation_fields:
              - sales_amount
              - units_sold
            """);

        // When
        AnalysisSettings settings = new ConfigurationLoader(Map.of()).loadSettings(file, new String[0]);

        // Then
        assertThat(settings.getMovingAverageWindow()).isEqualTo(14);
        assertThat(settings.getParallelism()).isEqualTo(2);
        assertThat(settings.getCorrelationFields()).containsExactly("sales_amount", "units_sold");
    }

    @Test
    void shouldLetEnvironmentOverrideFileAndCliOverrideEnvironment() throws IOException {
        // Given
        Path file = tempDir.resolve("settings.yml");
        Files.writeString(file, "moving_average_window: 14\nparallelism: 2\n");
        Map<String, String> env = Map.of(
                ConfigurationLoader.ENV_WINDOW, "30",
                ConfigurationLoader.ENV_PARALLELISM, "3",
                ConfigurationLoader.ENV_CORRELATION_FIELDS, "sales_amount, unit_price");

        // When
        AnalysisSettings settings = new ConfigurationLoader(env)
                .loadSettings(file, new String[]{"data.csv", "--window", "5"});

        // Then
        assertThat(settings.getMovingAverageWindow()).isEqualTo(5);
        assertThat(settings.getParallelism()).isEqualTo(3);
        assertThat(settings.getCorrelationFields()).containsExactly("sales_amount", "unit_price");
    }

    @Test
    void shouldAcceptShortOptions() {
        AnalysisSettings settings = new ConfigurationLoader(Map.of())
                .loadSettings(null, new String[]{"data.csv", "-w", "0", "-p", "2"});

        assertThat(settings.getMovingAverageWindow()).isZero();
        assertThat(settings.getParallelism()).isEqualTo(2);
    }

    @Test
    void shouldWarnAndKeepValueOnInvalidNumber() {
        // When
        AnalysisSettings settings = new ConfigurationLoader(Map.of(ConfigurationLoader.ENV_WINDOW, "weekly"))
                .loadSettings(null, new String[0]);

        // Then
        assertThat(settings.getMovingAverageWindow()).isEqualTo(7);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("Invalid numeric value for SALES_MOVING_AVERAGE_WINDOW"));
    }

    @Test
    void shouldFallBackToDefaultsForMissingOrBrokenFile() throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "moving_average_window: [not, a, number\n");

        assertThat(loader.loadFile(tempDir.resolve("absent.yml"))).isEqualTo(AnalysisSettings.createDefaults());
        assertThat(loader.loadFile(broken)).isEqualTo(AnalysisSettings.createDefaults());
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN);
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.ERROR);
    }

    @Test
    void shouldRejectInvalidFinalSettings() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        assertThatThrownBy(() -> loader.loadSettings(null, new String[]{"data.csv", "--window", "-2"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDescribeEveryOptionInHelp() {
        assertThat(ConfigurationLoader.getSettingsHelp())
                .contains("--window", "--parallelism", "--correlation-fields", "SALES_MOVING_AVERAGE_WINDOW");
    }
}
