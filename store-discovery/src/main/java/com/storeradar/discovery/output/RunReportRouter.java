package com.storeradar.discovery.output;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes finished run reports to the configured sink(s).
 * Supports DATABASE, CSV, or BOTH modes. A failing sink is logged and does not fail the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunReportRouter {

    private final JdbcRunReportWriter jdbcWriter;
    private final CsvRunReportWriter csvWriter;
    private final DiscoveryProperties properties;

    public void ensureSchema() {
        if (properties.getOutput().getMode() != DiscoveryProperties.Output.OutputMode.CSV) {
            jdbcWriter.ensureSchema();
        }
    }

    public void write(RunReport report) {
        DiscoveryProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case DATABASE -> writeToDatabase(report);
            case CSV -> writeToCsv(report);
            case BOTH -> {
                writeToDatabase(report);
                writeToCsv(report);
            }
        }
    }

    private void writeToDatabase(RunReport report) {
        try {
            jdbcWriter.write(report);
        } catch (Exception e) {
            log.warn("Failed to write run {} to discovery_runs: {}", report.getRunId(), e.getMessage());
        }
    }

    private void writeToCsv(RunReport report) {
        try {
            csvWriter.write(report);
        } catch (Exception e) {
            log.warn("Failed to write run {} to CSV: {}", report.getRunId(), e.getMessage());
        }
    }
}
