package com.aigreentick.services.marketing.kafka.event;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dead-letter record for a terminal failure that needs operator review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignFailureEvent {

    public enum Kind {
        RECIPIENT_FAILED,
        STATUS_EVENT_DROPPED
    }

    private String eventId;

    private Kind kind;

    private Long campaignId;

    private Long recipientId;

    private String phone;

    private String providerMessageId;

    private String errorType;

    private String reason;

    private boolean retryable;

    private Long timestamp;

    public static CampaignFailureEvent recipientFailed(
            Long campaignId,
            Long recipientId,
            String phone,
            String errorType,
            String reason,
            long timestamp) {

        return CampaignFailureEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .kind(Kind.RECIPIENT_FAILED)
                .campaignId(campaignId)
                .recipientId(recipientId)
                .phone(phone)
                .errorType(errorType)
                .reason(reason)
                .retryable(false)
                .timestamp(timestamp)
                .build();
    }

    public static CampaignFailureEvent statusEventDropped(
            String providerMessageId,
            String eventType,
            String reason,
            long timestamp) {

        return CampaignFailureEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .kind(Kind.STATUS_EVENT_DROPPED)
                .providerMessageId(providerMessageId)
                .errorType(eventType)
                .reason(reason)
                .retryable(false)
                .timestamp(timestamp)
                .build();
    }
}
