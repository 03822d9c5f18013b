package com.aigreentick.services.marketing.kafka.consumer;

import java.time.Duration;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.campaign.enums.ReconcileOutcome;
import com.aigreentick.services.marketing.campaign.service.impl.StatusReconciler;
import com.aigreentick.services.marketing.kafka.event.DeliveryStatusEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Feeds provider status callbacks into the reconciler.
 *
 * - Malformed events are acknowledged and skipped
 * - Infrastructure errors are nacked so the record is redelivered
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryStatusConsumer {

    static final Duration REDELIVERY_DELAY = Duration.ofSeconds(5);

    private final StatusReconciler statusReconciler;

    @KafkaListener(
        topics = "${kafka.topics.delivery-status.name}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "deliveryStatusListenerFactory"
    )
    public void consumeDeliveryStatus(
            @Payload DeliveryStatusEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Received status event: providerMessageId={} type={} partition={} offset={}",
                event.getProviderMessageId(), event.getEventType(), partition, offset);

        try {
            ReconcileOutcome outcome = statusReconciler.reconcile(event);
            log.debug("Status event reconciled. providerMessageId={} outcome={}", event.getProviderMessageId(), outcome);
            acknowledgment.acknowledge();

        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed status event. providerMessageId={} type={} partition={} offset={} error={}",
                    event.getProviderMessageId(), event.getEventType(), partition, offset, e.getMessage());
            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("Failed to reconcile status event. providerMessageId={} partition={} offset={}",
                    event.getProviderMessageId(), partition, offset, e);
            acknowledgment.nack(REDELIVERY_DELAY);
        }
    }
}
