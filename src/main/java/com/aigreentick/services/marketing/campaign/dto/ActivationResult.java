package com.aigreentick.services.marketing.campaign.dto;

import java.time.LocalDate;

import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;

public record ActivationResult(
        Long campaignId,
        CampaignStatus status,
        int recipientCount,
        int dailyCap,
        LocalDate startDate,
        LocalDate lastScheduledDate) {
}
