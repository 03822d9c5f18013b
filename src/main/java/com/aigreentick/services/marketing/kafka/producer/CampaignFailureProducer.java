package com.aigreentick.services.marketing.kafka.producer;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.kafka.event.CampaignFailureEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignFailureProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.campaign-failures.name}")
    private String topicName;

    /**
     * Publishes a dead-letter record. Publishing is best effort: the failure is already
     * persisted on the recipient row, so a broker outage is logged and does not fail the caller.
     */
    public void publish(CampaignFailureEvent event) {
        String partitionKey = event.getCampaignId() != null
                ? String.valueOf(event.getCampaignId())
                : event.getProviderMessageId();

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topicName, partitionKey, event);
        } catch (RuntimeException e) {
            log.error("Failed to publish campaign failure event. kind={} campaignId={} recipientId={}",
                    event.getKind(), event.getCampaignId(), event.getRecipientId(), e);
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Campaign failure event not delivered. kind={} campaignId={} eventId={}",
                        event.getKind(), event.getCampaignId(), event.getEventId(), ex);
            } else {
                log.debug("Campaign failure event published. kind={} eventId={} partition={} offset={}",
                        event.getKind(),
                        event.getEventId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
