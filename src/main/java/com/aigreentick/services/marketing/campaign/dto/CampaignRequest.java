package com.aigreentick.services.marketing.campaign.dto;

import java.time.LocalDate;
import java.util.List;

import com.aigreentick.services.marketing.audience.dto.AudienceFilter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRequest {
    private String name;
    private String description;
    private String templateName;
    private String languageCode;
    private List<String> templateParameters;
    private Integer dailySendLimit;
    private Integer priority;
    private AudienceFilter targetAudience;
    private Boolean useTargetAudience;
    private LocalDate startDate;
    private String createdBy;
}
