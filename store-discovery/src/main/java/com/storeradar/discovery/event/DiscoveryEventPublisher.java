package com.storeradar.discovery.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Hands pipeline events to Spring listeners on the notification executor, so a slow
 * listener never holds up a validation worker.
 */
@Component
@Slf4j
public class DiscoveryEventPublisher {

    private final ApplicationEventPublisher publisher;
    private final Executor notificationExecutor;

    public DiscoveryEventPublisher(ApplicationEventPublisher publisher,
                                   @Qualifier("notificationExecutor") Executor notificationExecutor) {
        this.publisher = publisher;
        this.notificationExecutor = notificationExecutor;
    }

    public void storeAccepted(StoreAcceptedEvent event) {
        dispatch(event);
    }

    public void candidateRejected(CandidateRejectedEvent event) {
        dispatch(event);
    }

    private void dispatch(Object event) {
        try {
            notificationExecutor.execute(() -> {
                try {
                    publisher.publishEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage());
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Notification queue full, dropped {}", event.getClass().getSimpleName());
        }
    }
}
