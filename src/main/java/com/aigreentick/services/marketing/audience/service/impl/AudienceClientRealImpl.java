package com.aigreentick.services.marketing.audience.service.impl;

import java.net.URI;
import java.util.List;

import org.springframework.context.annotation.Profile;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;

import com.aigreentick.services.marketing.audience.config.AudienceClientProperties;
import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.audience.service.AudienceClientService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
@Service
@Profile("!mock")
public class AudienceClientRealImpl implements AudienceClientService {

    private static final ParameterizedTypeReference<List<String>> PHONE_LIST = new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final AudienceClientProperties properties;

    @Override
    public List<String> findPhones(AudienceFilter filter) {
        URI uri = UriComponentsBuilder
                .fromUriString(properties.getBaseUrl())
                .path(properties.getSearchPath())
                .build()
                .toUri();

        try {
            List<String> phones = webClientBuilder.build()
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(filter)
                    .retrieve()
                    .bodyToMono(PHONE_LIST)
                    .block(properties.getRequestTimeout());

            log.info("Profile service returned {} phones for filter={}", phones == null ? 0 : phones.size(), filter);
            return phones == null ? List.of() : phones;

        } catch (WebClientException ex) {
            log.error("Profile service lookup failed. filter={}", filter, ex);
            throw new IllegalStateException("Audience lookup failed: " + ex.getMessage(), ex);
        }
    }
}
