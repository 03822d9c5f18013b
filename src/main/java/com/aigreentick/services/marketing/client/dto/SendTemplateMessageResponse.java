package com.aigreentick.services.marketing.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendTemplateMessageResponse {

    @JsonProperty("messaging_product")
    private String messagingProduct;

    private List<WhatsAppContactDto> contacts;
    private List<WhatsAppMessageDto> messages;

    /**
     * Provider id of the first accepted message, or null when the provider returned none.
     */
    public String firstMessageId() {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        return messages.get(0).getId();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WhatsAppContactDto {
        private String input;

        @JsonProperty("wa_id")
        private String waId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WhatsAppMessageDto {
        private String id;

        @JsonProperty("message_status")
        private String messageStatus;
    }
}
