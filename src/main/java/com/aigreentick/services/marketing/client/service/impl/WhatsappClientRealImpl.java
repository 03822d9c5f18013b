package com.aigreentick.services.marketing.client.service.impl;

import java.net.URI;

import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.aigreentick.services.marketing.client.config.WhatsappClientProperties;
import com.aigreentick.services.marketing.client.dto.ProviderResponse;
import com.aigreentick.services.marketing.client.dto.SendTemplateMessageResponse;
import com.aigreentick.services.marketing.client.service.WhatsappClientService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls the WhatsApp Business Cloud API. Active unless the 'mock' profile is on.
 */
@Slf4j
@RequiredArgsConstructor
@Service
@Profile("!mock")
public class WhatsappClientRealImpl implements WhatsappClientService {

    private final WebClient.Builder webClientBuilder;
    private final WhatsappClientProperties properties;

    @Override
    public ProviderResponse<SendTemplateMessageResponse> sendMessage(
            String bodyJson,
            String phoneNumberId,
            String accessToken) {

        if (!properties.isOutgoingEnabled()) {
            return ProviderResponse.error("Outgoing requests disabled", 503);
        }

        URI uri = UriComponentsBuilder
                .fromUriString(properties.getBaseUrl())
                .pathSegment(properties.getApiVersion(), phoneNumberId, "messages")
                .build()
                .toUri();

        try {
            SendTemplateMessageResponse response = webClientBuilder.build()
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(SendTemplateMessageResponse.class)
                    .block(properties.getRequestTimeout());

            log.debug("Template message sent. phoneNumberId={} response={}", phoneNumberId, response);
            return ProviderResponse.success(response, 200);

        } catch (WebClientResponseException ex) {
            log.warn("Provider rejected message. phoneNumberId={} status={} body={}",
                    phoneNumberId, ex.getStatusCode().value(), ex.getResponseBodyAsString());
            return ProviderResponse.error(ex.getResponseBodyAsString(), ex.getStatusCode().value());

        } catch (WebClientRequestException ex) {
            log.warn("Provider unreachable. phoneNumberId={} error={}", phoneNumberId, ex.getMessage());
            return ProviderResponse.error("Network error: " + ex.getMessage(), 0);

        } catch (IllegalStateException ex) {
            // block(Duration) timed out
            log.warn("Provider call timed out after {}. phoneNumberId={}", properties.getRequestTimeout(), phoneNumberId);
            return ProviderResponse.error("Timeout: " + ex.getMessage(), 0);
        }
    }
}
