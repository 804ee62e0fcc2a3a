package com.storeradar.discovery.output;

import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.RunOutcome;
import com.storeradar.discovery.model.RunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRunReportWriterTest {

    @TempDir
    Path outputDir;

    private CsvRunReportWriter writer;

    @BeforeEach
    void setUp() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getOutput().getCsv().setOutputDir(outputDir.resolve("reports").toString());
        writer = new CsvRunReportWriter(properties);
    }

    private RunReport report(String runId) {
        return RunReport.builder()
                .runId(runId)
                .cadence(Cadence.FAST)
                .startedAt(Instant.parse("2024-05-10T12:00:00Z"))
                .finishedAt(Instant.parse("2024-05-10T12:03:00Z"))
                .outcome(RunOutcome.COMPLETED)
                .perSourceCounts(Map.of())
                .totalCandidates(40)
                .totalNew(3)
                .totalRejected(7)
                .rejectionsByStage(Map.of(RejectionStage.PLATFORM, 5L, RejectionStage.INACTIVE, 2L))
                .build();
    }

    @Test
    void appendsOneLinePerRunWithSingleHeader() throws IOException {
        writer.write(report("run-1"));
        writer.write(report("run-2"));

        List<String> lines = Files.readAllLines(
                outputDir.resolve("reports").resolve(CsvRunReportWriter.FILE_NAME), StandardCharsets.UTF_8);

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("\"run_id\",\"cadence\"");
        assertThat(lines.get(1)).startsWith("\"run-1\",\"FAST\",\"2024-05-10T12:00:00Z\"");
        assertThat(lines.get(1)).contains("\"PLATFORM=5;INACTIVE=2\"");
        assertThat(lines.get(2)).startsWith("\"run-2\"");
    }
}
