package com.storeradar.discovery.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of accepted and rejected storefronts.
 */
@Component
@Slf4j
public class DiscoveryEventLogger {

    @EventListener
    public void onAccepted(StoreAcceptedEvent event) {
        log.info("[{}] {} {} ({} products, tags {})",
                event.runId(),
                event.created() ? "NEW" : "REFRESHED",
                event.record().getIdentityUrl(),
                event.record().getProductCount(),
                event.record().getTags());
    }

    @EventListener
    public void onRejected(CandidateRejectedEvent event) {
        log.debug("[{}] rejected {} from {} at {}: {}",
                event.runId(), event.identityUrl(), event.sourceName(), event.stage(), event.reason());
    }
}
