package org.carball.sales.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.carball.sales.config.OutputFormat;
import org.carball.sales.model.table.ResultTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes analysis tables out. Knows nothing about the analyses: every artifact is a
 * {@link ResultTable} written under its own name.
 */
@Slf4j
public class ReportAssembler {

    public static final String JSON_FILE = "analysis-report.json";
    public static final String MARKDOWN_FILE = "analysis-report.md";

    private final List<ResultTable> tables;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ReportAssembler(List<ResultTable> tables) {
        this(tables, LocalDateTime.now());
    }

    public ReportAssembler(List<ResultTable> tables, LocalDateTime timestamp) {
        this.tables = List.copyOf(tables);
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    /**
     * Writes the requested formats into {@code directory}, creating it if needed.
     *
     * @return the files written, in order
     */
    public List<Path> write(Path directory, OutputFormat format) throws IOException {
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();

        if (format.includes(OutputFormat.CSV)) {
            for (ResultTable table : tables) {
                written.add(writeCsv(directory, table));
            }
        }
        if (format.includes(OutputFormat.JSON)) {
            Path json = directory.resolve(JSON_FILE);
            Files.writeString(json, toJson(), StandardCharsets.UTF_8);
            written.add(json);
        }
        if (format.includes(OutputFormat.MARKDOWN)) {
            Path markdown = directory.resolve(MARKDOWN_FILE);
            Files.writeString(markdown, toMarkdown(), StandardCharsets.UTF_8);
            written.add(markdown);
        }

        log.info("Wrote {} report files to {}", written.size(), directory);
        return written;
    }

    public Path writeCsv(Path directory, ResultTable table) throws IOException {
        Path file = directory.resolve(table.name() + ".csv");
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.writeNext(table.columns().toArray(new String[0]), false);
            for (int i = 0; i < table.rowCount(); i++) {
                writer.writeNext(table.formatRow(i).toArray(new String[0]), false);
            }
        }
        log.debug("Saved {} ({} rows) to {}", table.name(), table.rowCount(), file);
        return file;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(timestamp, tables));
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Sales Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        for (ResultTable table : tables) {
            md.append("## ").append(title(table.name())).append("\n\n");
            if (table.rowCount() == 0) {
                md.append("_No rows._\n\n");
                continue;
            }
            md.append("| ").append(String.join(" | ", table.columns())).append(" |\n");
            md.append("|");
            table.columns().forEach(c -> md.append("---|"));
            md.append("\n");
            for (int i = 0; i < table.rowCount(); i++) {
                md.append("| ").append(String.join(" | ", table.formatRow(i))).append(" |\n");
            }
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by Sales Analyzer*\n");
        return md.toString();
    }

    static String title(String tableName) {
        StringBuilder title = new StringBuilder();
        for (String word : tableName.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.equalsIgnoreCase("kpis") ? "KPIs" : Character.toUpperCase(word.charAt(0)) + word.substring(1));
        }
        return title.toString();
    }

    record ReportData(LocalDateTime generated, List<ResultTable> tables) {
    }
}
