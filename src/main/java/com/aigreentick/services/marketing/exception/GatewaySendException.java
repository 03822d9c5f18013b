package com.aigreentick.services.marketing.exception;

import com.aigreentick.services.marketing.campaign.enums.GatewayErrorType;

public class GatewaySendException extends CampaignException {

    private final GatewayErrorType errorType;
    private final int statusCode;

    public GatewaySendException(GatewayErrorType errorType, int statusCode, String message) {
        super(message);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public GatewayErrorType getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return errorType.isTransient();
    }
}
