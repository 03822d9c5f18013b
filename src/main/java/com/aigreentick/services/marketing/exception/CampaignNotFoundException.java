package com.aigreentick.services.marketing.exception;

public class CampaignNotFoundException extends CampaignException {

    private final Long campaignId;

    public CampaignNotFoundException(Long campaignId) {
        super("Campaign not found with ID: " + campaignId);
        this.campaignId = campaignId;
    }

    public Long getCampaignId() {
        return campaignId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
