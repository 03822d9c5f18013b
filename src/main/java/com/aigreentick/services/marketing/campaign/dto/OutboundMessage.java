package com.aigreentick.services.marketing.campaign.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One template send handed to the gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {

    private String phone;

    private String templateName;

    private String languageCode;

    @Builder.Default
    private List<String> parameters = List.of();
}
