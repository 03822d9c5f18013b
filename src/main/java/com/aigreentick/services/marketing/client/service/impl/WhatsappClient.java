package com.aigreentick.services.marketing.client.service.impl;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.campaign.dto.OutboundMessage;
import com.aigreentick.services.marketing.campaign.enums.GatewayErrorType;
import com.aigreentick.services.marketing.campaign.service.MessageSendGateway;
import com.aigreentick.services.marketing.campaign.service.impl.TemplateBuilderService;
import com.aigreentick.services.marketing.client.config.WhatsappClientProperties;
import com.aigreentick.services.marketing.client.dto.ProviderResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse;
import com.aigreentick.services.marketing.client.service.WhatsappClientService;
import com.aigreentick.services.marketing.exception.GatewaySendException;

import lombok.RequiredArgsConstructor;

/**
 * Send gateway backed by the WhatsApp Cloud API. Turns provider responses into a message id
 * or a classified {@link GatewaySendException}.
 */
@RequiredArgsConstructor
@Component
public class WhatsappClient implements MessageSendGateway {

    private final WhatsappClientService whatsappClientService;
    private final TemplateBuilderService templateBuilderService;
    private final WhatsappClientProperties properties;

    @Override
    public String send(OutboundMessage message) {
        String payload = templateBuilderService.toPayload(message);

        ProviderResponse<SendTemplateMessageResponse> response = whatsappClientService.sendMessage(
                payload, properties.getPhoneNumberId(), properties.getAccessToken());

        if (!response.isSuccess()) {
            GatewayErrorType type = classify(response.getStatusCode(), response.getErrorMessage());
            throw new GatewaySendException(type, response.getStatusCode(), response.getErrorMessage());
        }

        String messageId = response.getData() == null ? null : response.getData().firstMessageId();
        if (messageId == null || messageId.isBlank()) {
            throw new GatewaySendException(GatewayErrorType.TRANSIENT_NETWORK, response.getStatusCode(),
                    "Provider accepted the request but returned no message id");
        }
        return messageId;
    }

    static GatewayErrorType classify(int statusCode, String errorMessage) {
        if (statusCode == 429) {
            return GatewayErrorType.RATE_LIMITED;
        }
        if (statusCode == 0 || statusCode == 408 || statusCode >= 500) {
            return GatewayErrorType.TRANSIENT_NETWORK;
        }
        String text = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        if (statusCode == 404 || text.contains("template")) {
            return GatewayErrorType.INVALID_TEMPLATE;
        }
        return GatewayErrorType.INVALID_RECIPIENT;
    }
}
