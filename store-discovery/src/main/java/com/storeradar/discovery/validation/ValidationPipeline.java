package com.storeradar.discovery.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.RunSettings;
import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.Candidate;
import com.storeradar.discovery.model.Classification;
import com.storeradar.discovery.model.StoreMetadata;
import com.storeradar.discovery.model.StoreRecord;
import com.storeradar.discovery.model.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs a candidate through platform → access → metadata → classification → acceptance.
 *
 * The first stage that rejects or defers ends validation. A transient probe failure
 * that escapes a stage defers the candidate. On acceptance the store record to upsert
 * is built here; the caller persists it.
 */
@Service
@Slf4j
public class ValidationPipeline {

    private final List<ValidationStage> stages;
    private final StorefrontHttpClient client;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ValidationPipeline(PlatformMembershipCheck platformCheck,
                              AccessCheck accessCheck,
                              MetadataExtractor metadataExtractor,
                              StoreClassifier classifier,
                              AcceptanceGate acceptanceGate,
                              StorefrontHttpClient client,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.stages = List.of(platformCheck, accessCheck, metadataExtractor, classifier, acceptanceGate);
        this.client = client;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param existing the stored record in refresh mode, null in create mode
     */
    public ValidationOutcome validate(Candidate candidate, StoreRecord existing, RunSettings settings) {
        ValidationContext ctx = new ValidationContext(candidate, existing, settings, client, objectMapper);

        for (ValidationStage stage : stages) {
            StageResult result;
            try {
                result = stage.apply(ctx);
            } catch (TransientProbeException e) {
                result = StageResult.defer(stage.name() + ": " + e.getMessage());
            }

            switch (result.kind()) {
                case REJECT -> {
                    log.debug("{} rejected at {}: {}", ctx.identityUrl(), result.stage(), result.reason());
                    return ValidationOutcome.rejected(result.stage(), result.reason());
                }
                case DEFER -> {
                    log.debug("{} deferred at {}: {}", ctx.identityUrl(), stage.name(), result.reason());
                    return ValidationOutcome.deferred(result.reason());
                }
                case PASS -> { }
            }
        }

        return ValidationOutcome.accepted(buildRecord(ctx));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private StoreRecord buildRecord(ValidationContext ctx) {
        Instant now = clock.instant();
        StoreRecord existing = ctx.getExisting();
        StoreMetadata metadata = ctx.getMetadata();
        RunSettings settings = ctx.getSettings();

        StoreRecord.StoreRecordBuilder builder = existing != null
                ? existing.toBuilder()
                : StoreRecord.builder()
                        .identityUrl(ctx.identityUrl())
                        .firstSeenAt(now)
                        .sourceName(ctx.getCandidate().getSourceName());

        builder.displayName(metadata.getDisplayName())
                .country(metadata.getCountry())
                .theme(metadata.getTheme())
                .productCount(metadata.getProductCount())
                .active(true)
                .lastValidatedAt(now)
                .retryCount(0)
                .nextRetryAt(null);

        Classification classification = ctx.getClassification();
        if (classification != null) {
            builder.businessModel(classification.getBusinessModel())
                    .businessModelConfidence(classification.getConfidence())
                    .tags(classification.getTags())
                    .runningAds(classification.isRunningAds());

            if (classification.isConfident()) {
                builder.classificationAttempts(0);
            } else {
                int attempts = (existing == null ? 0 : existing.getClassificationAttempts()) + 1;
                builder.classificationAttempts(attempts);
                if (attempts <= settings.getMaxReclassificationAttempts()) {
                    builder.nextRetryAt(now.plus(settings.getReclassifyDelay()));
                }
            }
        }
        return builder.build();
    }
}
