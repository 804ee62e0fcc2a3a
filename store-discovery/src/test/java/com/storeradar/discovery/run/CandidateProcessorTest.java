package com.storeradar.discovery.run;

import com.storeradar.discovery.event.CandidateRejectedEvent;
import com.storeradar.discovery.event.DiscoveryEventPublisher;
import com.storeradar.discovery.event.StoreAcceptedEvent;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.RetryEntry;
import com.storeradar.discovery.model.RunOutcome;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.model.ValidationMode;
import com.storeradar.discovery.model.ValidationOutcome;
import com.storeradar.discovery.store.RetryQueue;
import com.storeradar.discovery.store.StoreRepository;
import com.storeradar.discovery.store.UpsertResult;
import com.storeradar.discovery.support.MutableClock;
import com.storeradar.discovery.support.TestSettings;
import com.storeradar.discovery.validation.ValidationPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateProcessorTest {

    private static final String URL = "https://coolstore.com";

    @Mock
    private ValidationPipeline pipeline;

    @Mock
    private StoreRepository storeRepository;

    @Mock
    private RetryQueue retryQueue;

    @Mock
    private DiscoveryEventPublisher events;

    private MutableClock clock;
    private CandidateProcessor processor;
    private RunContext ctx;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-10T12:00:00Z");
        processor = new CandidateProcessor(pipeline, storeRepository, retryQueue, events, clock);
        ctx = new RunContext("run-1", TestSettings.defaults(), clock.instant());
    }

    private Candidate candidate(ValidationMode mode) {
        return Candidate.builder()
                .rawUrl(URL + "/products/x")
                .normalizedUrl(URL)
                .sourceName("reddit")
                .discoveredAt(clock.instant())
                .mode(mode)
                .build();
    }

    private RunReport report() {
        return ctx.getReporter().finish(RunOutcome.COMPLETED, clock.instant(), null);
    }

    @Test
    @DisplayName("accepted create-mode candidate is stored and leaves the retry queue")
    void acceptedCreate() {
        // given
        StoreRecord record = StoreRecord.builder().identityUrl(URL).productCount(12).build();
        when(pipeline.validate(any(), isNull(), any())).thenReturn(ValidationOutcome.accepted(record));
        when(storeRepository.upsert(record)).thenReturn(UpsertResult.CREATED);

        // when
        processor.process(candidate(ValidationMode.CREATE), ctx);

        // then
        verify(retryQueue).remove(URL);
        ArgumentCaptor<StoreAcceptedEvent> event = ArgumentCaptor.forClass(StoreAcceptedEvent.class);
        verify(events).storeAccepted(event.capture());
        assertThat(event.getValue().created()).isTrue();
        assertThat(report().getTotalNew()).isEqualTo(1);
    }

    @Test
    @DisplayName("refresh-mode rejection deactivates the stored record")
    void rejectedRefreshDeactivates() {
        // given
        StoreRecord existing = StoreRecord.builder().identityUrl(URL).build();
        when(storeRepository.findByIdentityUrl(URL)).thenReturn(Optional.of(existing));
        when(pipeline.validate(any(), eq(existing), any()))
                .thenReturn(ValidationOutcome.rejected(RejectionStage.INACTIVE, "storefront unavailable"));

        // when
        processor.process(candidate(ValidationMode.REFRESH), ctx);

        // then
        verify(storeRepository).markInactive(URL, clock.instant());
        verify(retryQueue, never()).remove(anyString());
        ArgumentCaptor<CandidateRejectedEvent> event = ArgumentCaptor.forClass(CandidateRejectedEvent.class);
        verify(events).candidateRejected(event.capture());
        assertThat(event.getValue().mode()).isEqualTo(ValidationMode.REFRESH);
        assertThat(report().getRejectionsByStage()).containsEntry(RejectionStage.INACTIVE, 1L);
    }

    @Test
    void rejectedCreateClearsQueueEntry() {
        when(pipeline.validate(any(), isNull(), any()))
                .thenReturn(ValidationOutcome.rejected(RejectionStage.PLATFORM, "not a storefront"));

        processor.process(candidate(ValidationMode.CREATE), ctx);

        verify(retryQueue).remove(URL);
        verify(storeRepository, never()).markInactive(anyString(), any());
        assertThat(report().getTotalRejected()).isEqualTo(1);
    }

    @Test
    @DisplayName("first deferral of a new candidate is queued one base delay out")
    void deferredCreateIsQueued() {
        // given
        when(pipeline.validate(any(), isNull(), any())).thenReturn(ValidationOutcome.deferred("timeout"));
        when(retryQueue.findBatch(List.of(URL))).thenReturn(Map.of());

        // when
        processor.process(candidate(ValidationMode.CREATE), ctx);

        // then
        ArgumentCaptor<RetryEntry> saved = ArgumentCaptor.forClass(RetryEntry.class);
        verify(retryQueue).save(saved.capture());
        assertThat(saved.getValue().getRetryCount()).isEqualTo(1);
        assertThat(saved.getValue().getNextRetryAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
        assertThat(saved.getValue().getSourceName()).isEqualTo("reddit");
        assertThat(saved.getValue().getLastError()).isEqualTo("timeout");
        assertThat(report().getTotalDeferred()).isEqualTo(1);
    }

    @Test
    @DisplayName("a candidate past its retry budget is dropped and counted as an error")
    void exhaustedCreateIsDropped() {
        // given
        when(pipeline.validate(any(), isNull(), any())).thenReturn(ValidationOutcome.deferred("timeout"));
        when(retryQueue.findBatch(List.of(URL))).thenReturn(Map.of(URL,
                RetryEntry.builder().identityUrl(URL).sourceName("common-crawl").retryCount(5).build()));

        // when
        processor.process(candidate(ValidationMode.CREATE), ctx);

        // then
        verify(retryQueue).remove(URL);
        verify(retryQueue, never()).save(any());
        RunReport report = report();
        assertThat(report.getTotalErrors()).isEqualTo(1);
        assertThat(report.getTotalDeferred()).isZero();
    }

    @Test
    void deferredRefreshSchedulesOnRecord() {
        StoreRecord existing = StoreRecord.builder().identityUrl(URL).retryCount(2).build();
        when(storeRepository.findByIdentityUrl(URL)).thenReturn(Optional.of(existing));
        when(pipeline.validate(any(), eq(existing), any())).thenReturn(ValidationOutcome.deferred("503"));

        processor.process(candidate(ValidationMode.REFRESH), ctx);

        verify(storeRepository).scheduleRetry(URL, 3, clock.instant().plus(Duration.ofHours(3)));
        verifyNoInteractions(retryQueue);
    }

    @Test
    void unexpectedFailureIsCountedNotThrown() {
        when(pipeline.validate(any(), isNull(), any())).thenThrow(new IllegalStateException("boom"));

        processor.process(candidate(ValidationMode.CREATE), ctx);

        assertThat(report().getTotalErrors()).isEqualTo(1);
    }

    @Test
    void cancelledRunSkipsValidation() {
        ctx.cancel();

        processor.process(candidate(ValidationMode.CREATE), ctx);

        verifyNoInteractions(pipeline, storeRepository, retryQueue, events);
    }
}
