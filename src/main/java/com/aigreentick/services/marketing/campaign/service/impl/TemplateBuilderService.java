package com.aigreentick.services.marketing.campaign.service.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.campaign.dto.OutboundMessage;
import com.aigreentick.services.marketing.campaign.dto.build.BuildTemplate;
import com.aigreentick.services.marketing.campaign.dto.build.Component;
import com.aigreentick.services.marketing.campaign.dto.build.Language;
import com.aigreentick.services.marketing.campaign.dto.build.SendableTemplate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateBuilderService {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public BuildTemplate buildTemplate(OutboundMessage message) {
        List<Component> components = new ArrayList<>();

        List<String> parameters = message.getParameters();
        if (parameters != null && !parameters.isEmpty()) {
            List<Map<String, Object>> bodyParams = new ArrayList<>();
            for (String value : parameters) {
                Map<String, Object> param = new HashMap<>();
                param.put("type", "text");
                param.put("text", value);
                bodyParams.add(param);
            }
            components.add(new Component("body", bodyParams));
        }

        SendableTemplate template = new SendableTemplate(
                message.getTemplateName(),
                new Language(message.getLanguageCode()),
                components.isEmpty() ? null : components);

        return BuildTemplate.builder()
                .to(message.getPhone().trim())
                .template(template)
                .build();
    }

    public String toPayload(OutboundMessage message) {
        try {
            return objectMapper.writeValueAsString(buildTemplate(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template payload for " + message.getTemplateName(), e);
        }
    }

    /**
     * Parses the stored JSON array of body parameters. Blank input yields an empty list.
     */
    public List<String> parseParameters(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Template parameters are not a JSON string array", e);
        }
    }

    public String writeParameters(List<String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template parameters", e);
        }
    }
}
