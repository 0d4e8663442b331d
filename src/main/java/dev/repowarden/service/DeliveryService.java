package dev.repowarden.service;

import dev.repowarden.domain.event.DeliveryReceivedEvent;
import dev.repowarden.domain.event.RepositoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Hands validated deliveries to the async listener so the webhook can answer at once.
 */
@Service
public class DeliveryService {
    private static final Logger log = LoggerFactory.getLogger(DeliveryService.class);
    private final ApplicationEventPublisher eventPublisher;

    public DeliveryService(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public void enqueue(RepositoryEvent event) {
        eventPublisher.publishEvent(new DeliveryReceivedEvent(event, Instant.now()));
        log.info("Queued delivery {} ({}) for {}", event.deliveryId(), event.kind(), event.repository());
    }
}
