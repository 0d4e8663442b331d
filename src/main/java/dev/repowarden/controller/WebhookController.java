package dev.repowarden.controller;

import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.infrastructure.github.WebhookEventMapper;
import dev.repowarden.infrastructure.github.WebhookSignatureVerifier;
import dev.repowarden.service.DeliveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * GitHub webhook receiver. Verifies the HMAC signature, maps the payload and
 * queues it; processing happens on the delivery executor.
 */
@RestController
public class WebhookController {
    public static final String WEBHOOK_PATH = "/webhooks/github";

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookEventMapper eventMapper;
    private final DeliveryService deliveryService;

    public WebhookController(WebhookSignatureVerifier signatureVerifier,
                             WebhookEventMapper eventMapper,
                             DeliveryService deliveryService) {
        this.signatureVerifier = signatureVerifier;
        this.eventMapper = eventMapper;
        this.deliveryService = deliveryService;
    }

    @PostMapping(WEBHOOK_PATH)
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader("X-GitHub-Event") String eventType,
            @RequestHeader("X-GitHub-Delivery") String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody String rawBody) {

        // verify against the raw bytes, before any parsing
        if (!signatureVerifier.isValid(rawBody.getBytes(StandardCharsets.UTF_8), signature)) {
            log.warn("Webhook signature verification failed for delivery={}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", "invalid signature"));
        }

        RepositoryEvent event = eventMapper.map(eventType, deliveryId, rawBody);
        if (event.kind() == EventKind.UNSUPPORTED) {
            log.debug("Ignoring {} delivery={}", eventType, deliveryId);
            return ResponseEntity.ok(Map.of("status", "ignored", "reason", "unsupported event"));
        }

        MDC.put("deliveryId", deliveryId);
        MDC.put("repository", event.repository());
        try {
            log.info("Webhook: event={}, kind={}, delivery={}", eventType, event.kind(), deliveryId);
            deliveryService.enqueue(event);
        } finally {
            MDC.remove("deliveryId");
            MDC.remove("repository");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "queued", "deliveryId", deliveryId, "kind", event.kind().name()));
    }
}
