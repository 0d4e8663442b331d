package dev.repowarden.infrastructure.async;

import dev.repowarden.domain.event.DeliveryReceivedEvent;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.domain.valueobject.DispatchOutcome;
import dev.repowarden.service.EventPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Consumes queued deliveries on the delivery executor.
 *
 * <p>Deliveries are in-process only. A crash loses whatever is still queued; GitHub's
 * redelivery plus the dispatcher's idempotency checks make a resend safe.
 */
@Component
public class DeliveryListener {

    private static final Logger log = LoggerFactory.getLogger(DeliveryListener.class);

    private final EventPipeline pipeline;

    public DeliveryListener(EventPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Async("deliveryExecutor")
    @EventListener
    public void onDelivery(DeliveryReceivedEvent delivery) {
        RepositoryEvent event = delivery.event();
        MDC.put("deliveryId", event.deliveryId());
        MDC.put("repository", event.repository());
        try {
            DispatchOutcome outcome = pipeline.handle(event);
            if (outcome.isSkipped()) {
                log.info("Delivery {} skipped: {}", event.deliveryId(), outcome.skipReason());
            } else if (outcome.hasFailures()) {
                log.warn("Delivery {} finished with failures: {}", event.deliveryId(), outcome.actions());
            } else {
                log.info("Delivery {} done: {} action(s)", event.deliveryId(), outcome.actions().size());
            }
        } catch (RuntimeException e) {
            log.error("Delivery {} failed", event.deliveryId(), e);
        } finally {
            MDC.remove("deliveryId");
            MDC.remove("repository");
        }
    }
}
