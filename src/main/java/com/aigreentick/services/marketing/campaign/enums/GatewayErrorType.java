package com.aigreentick.services.marketing.campaign.enums;

/**
 * Failure classes returned by the outbound send gateway.
 */
public enum GatewayErrorType {
    RATE_LIMITED("rate_limited", true),
    TRANSIENT_NETWORK("transient_network", true),
    INVALID_TEMPLATE("invalid_template", false),
    INVALID_RECIPIENT("invalid_recipient", false);

    private final String value;
    private final boolean transientFailure;

    GatewayErrorType(String value, boolean transientFailure) {
        this.value = value;
        this.transientFailure = transientFailure;
    }

    public String getValue() {
        return value;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
