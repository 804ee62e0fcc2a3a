package com.storeradar.discovery.dedup;

import com.storeradar.discovery.model.Candidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What survived deduplication, with the mode each survivor is validated in,
 * and how many were dropped for which reason.
 */
@Value
@Builder
public class DedupResult {

    List<Candidate> accepted;
    int invalid;            // normalizer produced the INVALID sentinel
    int seenInRun;          // another adapter (or page) already produced the identity
    int alreadyKnown;       // stored and not due for revalidation
    int awaitingRetry;      // deferred earlier and not yet due

    public int duplicates() {
        return seenInRun + alreadyKnown + awaitingRetry;
    }
}
