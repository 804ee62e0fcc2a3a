package com.storeradar.discovery.output;

import com.opencsv.CSVWriter;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appends one line per run to {outputDir}/discovery_runs.csv.
 * The header is written only when the file is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvRunReportWriter {

    static final String FILE_NAME = "discovery_runs.csv";

    private static final String[] HEADERS = {
            "run_id", "cadence", "started_at", "finished_at", "outcome",
            "total_candidates", "total_new", "total_refreshed", "total_rejected",
            "total_deferred", "total_duplicates", "total_errors",
            "rejections_by_stage", "failure_message"
    };

    private final DiscoveryProperties properties;

    public void write(RunReport report) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(FILE_NAME);
        boolean newFile = !Files.exists(outputPath);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(report));
            log.info("Run {} appended to CSV: {}", report.getRunId(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(RunReport r) {
        return new String[]{
                str(r.getRunId()),
                str(r.getCadence()),
                str(r.getStartedAt()),
                str(r.getFinishedAt()),
                str(r.getOutcome()),
                str(r.getTotalCandidates()),
                str(r.getTotalNew()),
                str(r.getTotalRefreshed()),
                str(r.getTotalRejected()),
                str(r.getTotalDeferred()),
                str(r.getTotalDuplicates()),
                str(r.getTotalErrors()),
                stages(r.getRejectionsByStage()),
                str(r.getFailureMessage())
        };
    }

    private static String stages(Map<RejectionStage, Long> byStage) {
        if (byStage == null || byStage.isEmpty()) return "";
        return byStage.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(";"));
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
