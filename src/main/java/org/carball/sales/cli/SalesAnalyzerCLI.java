package org.carball.sales.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.sales.analyzer.SalesAnalyzer;
import org.carball.sales.analyzer.StandardDimensions;
import org.carball.sales.config.AnalysisSettings;
import org.carball.sales.config.ConfigurationLoader;
import org.carball.sales.config.OutputFormat;
import org.carball.sales.config.SalesAnalyzerConfig;
import org.carball.sales.exception.DataNotFoundException;
import org.carball.sales.exception.EmptyDatasetException;
import org.carball.sales.exception.InvalidValueException;
import org.carball.sales.exception.SchemaException;
import org.carball.sales.model.aggregation.AggregationResult;
import org.carball.sales.model.analysis.AnalysisReport;
import org.carball.sales.model.table.Presentation;
import org.carball.sales.output.ReportAssembler;
import org.carball.sales.parser.LoadResult;
import org.carball.sales.parser.SalesCsvLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
public class SalesAnalyzerCLI {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_MISSING_INPUT = 1;
    public static final int EXIT_VALIDATION_FAILURE = 2;
    public static final int EXIT_INTERNAL_ERROR = 3;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║          Sales Analytics Engine v%s        ║
        ╚═══════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the full pipeline and returns the process exit code.
     */
    public static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_MISSING_INPUT : EXIT_SUCCESS;
        }

        SalesAnalyzerConfig config;
        try {
            config = parseArgs(args, new ConfigurationLoader());
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_MISSING_INPUT;
        }

        return execute(config);
    }

    /**
     * Loads, analyzes and writes for an already parsed configuration. Argument errors are
     * reported by {@link #run}; anything unexpected from here on is an internal error.
     */
    static int execute(SalesAnalyzerConfig config) {
        try {
            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Input file: " + config.getInputFile());
            System.out.println("   Output directory: " + config.getOutputDirectory());
            System.out.println("   Format: " + config.getOutputFormat().name().toLowerCase());
            System.out.println();

            System.out.print("📂 Loading sales data... ");
            LoadResult loaded = new SalesCsvLoader().load(config.getInputFile());
            System.out.println("✓ " + loaded.records().size() + " records");
            if (config.isVerbose()) {
                System.out.printf("     - Raw rows: %,d, dropped: %,d (%.1f%%)%n",
                        loaded.rawRows(), loaded.droppedRows(), loaded.droppedPercentage());
            }

            System.out.print("📊 Analyzing sales... ");
            AnalysisReport report = new SalesAnalyzer(config.getSettings()).analyze(loaded.records());
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            List<Path> written = new ReportAssembler(report.tables())
                    .write(config.getOutputDirectory(), config.getOutputFormat());
            System.out.println("✓");

            printSummary(report);

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   Output files:");
            written.forEach(path -> System.out.println("     - " + path));
            return EXIT_SUCCESS;

        } catch (DataNotFoundException e) {
            System.err.println("\n❌ " + e.getMessage());
            log.debug("Missing input details", e);
            return EXIT_MISSING_INPUT;
        } catch (SchemaException | EmptyDatasetException | InvalidValueException e) {
            System.err.println("\n❌ Validation error: " + e.getMessage());
            log.debug("Validation error details", e);
            return EXIT_VALIDATION_FAILURE;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_INTERNAL_ERROR;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_INTERNAL_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar sales-analyzer.jar <sales-file.csv> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  sales-file          CSV with columns date, sales_amount, units_sold, region,");
        System.out.println("                      product_category, customer_id, sales_rep");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output-dir, -o    Directory for result tables (default: output/tables)");
        System.out.println("  --format, -f        Output format: csv|json|markdown|all (default: csv)");
        System.out.println("  --config            YAML file with analysis settings (optional)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Exit codes: 0 success, 1 missing input, 2 validation failure, 3 internal error");
    }

    static SalesAnalyzerConfig parseArgs(String[] args, ConfigurationLoader configurationLoader) {
        SalesAnalyzerConfig config = new SalesAnalyzerConfig();
        config.setInputFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputDirectory(Paths.get("output", "tables"));
        config.setOutputFormat(OutputFormat.CSV);
        config.setVerbose(false);

        Path settingsFile = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output-dir":
                case "-o":
                    config.setOutputDirectory(Paths.get(requireValue(args, i++, "Output directory")));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: csv, json, markdown, or all");
                    }
                    break;

                case "--config":
                    settingsFile = Paths.get(requireValue(args, i++, "Settings file"));
                    break;

                case "--window":
                case "-w":
                case "--parallelism":
                case "-p":
                case "--correlation-fields":
                    // Value is applied by ConfigurationLoader
                    requireValue(args, i, args[i]);
                    i++;
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        AnalysisSettings settings = configurationLoader.loadSettings(settingsFile, args);
        config.setSettings(settings);
        return config;
    }

    private static String requireValue(String[] args, int optionIndex, String what) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[optionIndex + 1];
    }

    private static void printSummary(AnalysisReport report) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 KEY PERFORMANCE INDICATORS");
        System.out.println("=".repeat(60));
        for (Map.Entry<String, Object> kpi : report.kpis().asMetrics().entrySet()) {
            System.out.printf("%-40s %s%n", kpi.getKey(), kpi.getValue());
        }

        AggregationResult reps = report.aggregation(StandardDimensions.salesRep().name());
        reps.top().ifPresent(top -> System.out.printf("%n🏆 Top Performer: %s with %s in sales%n",
                top.key(), Presentation.round2(top.metric(StandardDimensions.TOTAL_SALES)).toPlainString()));

        System.out.println("\n📈 Monthly Performance:");
        System.out.println("-".repeat(60));
        report.monthly().rows().forEach(row -> System.out.printf("%-20s %15s  %s%n",
                row.label(),
                Presentation.round2(row.metric(StandardDimensions.TOTAL_SALES)).toPlainString(),
                row.growthPercent() == null ? "" : row.growthPercent().toPlainString() + "%"));
    }
}
