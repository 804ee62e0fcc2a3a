package com.storeradar.discovery.source;

import com.storeradar.discovery.model.Candidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page from a source.
 *
 * nextCursor is where the following call should resume; null means start over.
 * A throttled, cancelled or failed page still carries whatever was collected before it stopped.
 */
@Value
@Builder
public class FetchResult {

    @Builder.Default
    List<Candidate> candidates = List.of();
    String nextCursor;
    boolean exhausted;
    boolean throttled;
    boolean cancelled;
    int dataErrors;
    String error;

    public boolean isFailed() {
        return error != null;
    }
}
