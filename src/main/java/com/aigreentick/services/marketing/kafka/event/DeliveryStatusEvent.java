package com.aigreentick.services.marketing.kafka.event;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flattened provider status callback, as published by the webhook relay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryStatusEvent {

    @JsonAlias({"provider_message_id", "id"})
    private String providerMessageId;

    /** delivered, read or failed */
    @JsonAlias({"event_type", "status"})
    private String eventType;

    /** Epoch seconds, as sent by the provider. */
    private Long timestamp;

    @JsonAlias("failure_reason")
    private String failureReason;
}
