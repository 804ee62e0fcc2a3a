package com.storeradar.discovery.event;

import com.storeradar.discovery.model.RejectionStage;
import com.storeradar.discovery.model.ValidationMode;

public record CandidateRejectedEvent(String runId,
                                     String identityUrl,
                                     String sourceName,
                                     ValidationMode mode,
                                     RejectionStage stage,
                                     String reason) {}
