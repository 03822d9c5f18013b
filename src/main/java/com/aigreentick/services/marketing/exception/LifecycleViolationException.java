package com.aigreentick.services.marketing.exception;

import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;

/**
 * Raised when a lifecycle action is not allowed from the campaign's current status,
 * e.g. activating a campaign that is already active or cancelled.
 */
public class LifecycleViolationException extends CampaignException {

    private final Long campaignId;
    private final CampaignStatus currentStatus;
    private final String action;

    public LifecycleViolationException(Long campaignId, CampaignStatus currentStatus, String action) {
        super(String.format("Cannot %s campaign %d while it is %s",
                action, campaignId, currentStatus.getValue()));
        this.campaignId = campaignId;
        this.currentStatus = currentStatus;
        this.action = action;
    }

    public Long getCampaignId() {
        return campaignId;
    }

    public CampaignStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getAction() {
        return action;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
