package com.storeradar.discovery.run;

import com.storeradar.discovery.dedup.DedupResult;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.RunOutcome;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.SourceCounts;
import com.storeradar.discovery.source.FetchResult;
import com.storeradar.discovery.store.UpsertResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunReporterTest {

    private static final Instant START = Instant.parse("2024-05-10T12:00:00Z");

    private Candidate candidate(String url) {
        return Candidate.builder().rawUrl(url).normalizedUrl(url).sourceName("reddit").build();
    }

    @Test
    void aggregatesFetchDedupAndValidationCounts() {
        RunReporter reporter = new RunReporter("run-1", Cadence.FAST, START);

        reporter.pageFetched("reddit", FetchResult.builder()
                .candidates(List.of(candidate("https://a.com"), candidate("https://b.com"), candidate("https://c.com")))
                .dataErrors(1)
                .build());
        reporter.deduplicated("reddit", DedupResult.builder()
                .accepted(List.of(candidate("https://a.com")))
                .invalid(1)
                .seenInRun(1)
                .build());
        reporter.pageFetched("common-crawl", FetchResult.builder().throttled(true).build());
        reporter.pageFetched("wayback-machine", FetchResult.builder().error("connection reset").build());
        reporter.sourceSkipped("meta-ad-library", "not configured");
        reporter.accepted(UpsertResult.CREATED);
        reporter.rejected(RejectionStage.ACCESS_GATED);
        reporter.deferred();

        RunReport report = reporter.finish(RunOutcome.COMPLETED, START.plusSeconds(90), null);

        assertThat(report.getTotalCandidates()).isEqualTo(3);
        assertThat(report.getTotalNew()).isEqualTo(1);
        assertThat(report.getTotalRejected()).isEqualTo(2);
        assertThat(report.getTotalDeferred()).isEqualTo(1);
        assertThat(report.getTotalDuplicates()).isEqualTo(1);
        assertThat(report.getTotalErrors()).isEqualTo(2);
        assertThat(report.getRejectionsByStage())
                .containsEntry(RejectionStage.INVALID_URL, 1L)
                .containsEntry(RejectionStage.ACCESS_GATED, 1L);

        SourceCounts reddit = report.getPerSourceCounts().get("reddit");
        assertThat(reddit.getPages()).isEqualTo(1);
        assertThat(reddit.getFetched()).isEqualTo(3);
        assertThat(reddit.getUnique()).isEqualTo(1);
        assertThat(reddit.getDataErrors()).isEqualTo(1);
        assertThat(report.getPerSourceCounts().get("common-crawl").isThrottled()).isTrue();
        assertThat(report.getPerSourceCounts().get("wayback-machine").getLastError()).isEqualTo("connection reset");
        assertThat(report.getPerSourceCounts().get("meta-ad-library").getSkippedReason()).isEqualTo("not configured");
    }

    @Test
    void seededRetriesCountAsCandidates() {
        RunReporter reporter = new RunReporter("run-2", Cadence.DEEP, START);

        reporter.seeded("retry-queue", 4);
        reporter.accepted(UpsertResult.REFRESHED);

        RunReport report = reporter.finish(RunOutcome.CANCELLED, START.plusSeconds(5), null);
        assertThat(report.getTotalCandidates()).isEqualTo(4);
        assertThat(report.getTotalRefreshed()).isEqualTo(1);
        assertThat(report.getOutcome()).isEqualTo(RunOutcome.CANCELLED);
        assertThat(report.getPerSourceCounts().get("retry-queue").getUnique()).isEqualTo(4);
    }
}
