package com.aigreentick.services.marketing.client.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aigreentick.services.marketing.campaign.dto.OutboundMessage;
import com.aigreentick.services.marketing.campaign.enums.GatewayErrorType;
import com.aigreentick.services.marketing.campaign.service.impl.TemplateBuilderService;
import com.aigreentick.services.marketing.client.config.WhatsappClientProperties;
import com.aigreentick.services.marketing.client.dto.ProviderResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse;
import com.aigreentick.services.marketing.client.service.WhatsappClientService;
import com.aigreentick.services.marketing.exception.GatewaySendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class WhatsappClientTest {

    @Mock
    private WhatsappClientService whatsappClientService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WhatsappClient client;

    private final OutboundMessage message = OutboundMessage.builder()
            .phone(" 919812345678 ")
            .templateName("summer_sale")
            .languageCode("en_US")
            .parameters(List.of("Summer", "20%"))
            .build();

    @BeforeEach
    void setUp() {
        WhatsappClientProperties properties = new WhatsappClientProperties();
        properties.setPhoneNumberId("1098765");
        properties.setAccessToken("token");
        client = new WhatsappClient(whatsappClientService, new TemplateBuilderService(objectMapper), properties);
    }

    @Test
    void returnsProviderMessageIdAndSendsTemplatePayload() throws Exception {
        when(whatsappClientService.sendMessage(anyString(), eq("1098765"), eq("token")))
                .thenReturn(ProviderResponse.success(accepted("wamid.HBgM"), 200));

        String id = client.send(message);

        assertThat(id).isEqualTo("wamid.HBgM");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(whatsappClientService).sendMessage(body.capture(), eq("1098765"), eq("token"));
        JsonNode json = objectMapper.readTree(body.getValue());
        assertThat(json.path("messaging_product").asText()).isEqualTo("whatsapp");
        assertThat(json.path("to").asText()).isEqualTo("919812345678");
        assertThat(json.path("type").asText()).isEqualTo("template");
        assertThat(json.path("template").path("name").asText()).isEqualTo("summer_sale");
        assertThat(json.path("template").path("language").path("code").asText()).isEqualTo("en_US");
        JsonNode params = json.path("template").path("components").get(0).path("parameters");
        assertThat(params.get(0).path("text").asText()).isEqualTo("Summer");
        assertThat(params.get(1).path("text").asText()).isEqualTo("20%");
    }

    @Test
    void providerErrorsAreClassified() {
        when(whatsappClientService.sendMessage(anyString(), anyString(), anyString()))
                .thenReturn(ProviderResponse.error("(#131047) Re-engagement message", 400));

        assertThatThrownBy(() -> client.send(message))
                .isInstanceOfSatisfying(GatewaySendException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(GatewayErrorType.INVALID_RECIPIENT);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    void acceptedWithoutMessageIdIsTransient() {
        when(whatsappClientService.sendMessage(anyString(), anyString(), anyString()))
                .thenReturn(ProviderResponse.success(new SendTemplateMessageResponse(), 200));

        assertThatThrownBy(() -> client.send(message))
                .isInstanceOfSatisfying(GatewaySendException.class,
                        e -> assertThat(e.getErrorType()).isEqualTo(GatewayErrorType.TRANSIENT_NETWORK));
    }

    @Test
    void classification() {
        assertThat(WhatsappClient.classify(429, "Too many requests")).isEqualTo(GatewayErrorType.RATE_LIMITED);
        assertThat(WhatsappClient.classify(0, "Connection refused")).isEqualTo(GatewayErrorType.TRANSIENT_NETWORK);
        assertThat(WhatsappClient.classify(408, null)).isEqualTo(GatewayErrorType.TRANSIENT_NETWORK);
        assertThat(WhatsappClient.classify(503, "Service unavailable")).isEqualTo(GatewayErrorType.TRANSIENT_NETWORK);
        assertThat(WhatsappClient.classify(404, null)).isEqualTo(GatewayErrorType.INVALID_TEMPLATE);
        assertThat(WhatsappClient.classify(400, "Template name does not exist in the translation"))
                .isEqualTo(GatewayErrorType.INVALID_TEMPLATE);
        assertThat(WhatsappClient.classify(400, "Invalid parameter: to")).isEqualTo(GatewayErrorType.INVALID_RECIPIENT);
    }

    private static SendTemplateMessageResponse accepted(String messageId) {
        SendTemplateMessageResponse response = new SendTemplateMessageResponse();
        response.setMessagingProduct("whatsapp");
        response.setMessages(List.of(new SendTemplateMessageResponse.WhatsAppMessageDto(messageId, "accepted")));
        return response;
    }
}
