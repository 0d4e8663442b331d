package dev.repowarden.domain.event;

import java.time.Instant;

/**
 * Application event published when a webhook delivery has been validated and mapped.
 * Consumed asynchronously by the delivery listener.
 */
public record DeliveryReceivedEvent(RepositoryEvent event, Instant receivedAt) {
    public DeliveryReceivedEvent {
        if (event == null) throw new IllegalArgumentException("event required");
        if (receivedAt == null) receivedAt = Instant.now();
    }
}
