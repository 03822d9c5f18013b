package com.aigreentick.services.marketing.client.service;

import com.aigreentick.services.marketing.client.dto.ProviderResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse;

/**
 * Transport for WhatsApp Cloud API calls.
 * The real and mock implementations are switched by Spring profile.
 */
public interface WhatsappClientService {

    /**
     * Posts a template message.
     *
     * @param bodyJson JSON payload for the message
     * @param phoneNumberId WhatsApp Business phone number id
     * @param accessToken WhatsApp Business API access token
     * @return parsed response, or error details with the HTTP status (0 when no response arrived)
     */
    ProviderResponse<SendTemplateMessageResponse> sendMessage(
            String bodyJson,
            String phoneNumberId,
            String accessToken);
}
