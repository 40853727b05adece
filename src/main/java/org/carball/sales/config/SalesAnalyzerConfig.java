package org.carball.sales.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class SalesAnalyzerConfig {
    private Path inputFile;
    private Path outputDirectory;
    private OutputFormat outputFormat;
    private boolean verbose;
    private AnalysisSettings settings;
}
