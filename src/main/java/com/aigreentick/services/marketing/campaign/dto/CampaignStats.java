package com.aigreentick.services.marketing.campaign.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live progress of one campaign. Rates are percentages with two decimals and are null when
 * their denominator is zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStats {

    private Long campaignId;
    private String name;
    private CampaignStatus status;

    private long total;
    private long pending;
    /**
     * Accepted by the provider: sent, delivered, read, or failed after being accepted.
     * A recipient the provider rejected outright counts only under {@link #failed}.
     */
    private long sent;
    /** Delivered or read. */
    private long delivered;
    private long read;
    /** Every failed recipient, including those also counted in {@link #sent}. */
    private long failed;

    private BigDecimal deliveryRate;
    private BigDecimal readRate;
    private BigDecimal progress;

    private int dailyCap;
    private LocalDate startDate;
    /** Null when nothing is pending or the campaign is completed or cancelled. */
    private LocalDate estimatedCompletionDate;
}
