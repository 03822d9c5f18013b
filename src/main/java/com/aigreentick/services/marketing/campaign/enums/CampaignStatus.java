package com.aigreentick.services.marketing.campaign.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Campaign lifecycle states.
 *
 * <pre>
 * DRAFT  --activate--> ACTIVE
 * ACTIVE --pause-->    PAUSED
 * PAUSED --resume-->   ACTIVE
 * {DRAFT, ACTIVE, PAUSED} --cancel--> CANCELLED
 * ACTIVE --(all recipients terminal)--> COMPLETED
 * </pre>
 */
public enum CampaignStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    public static final Set<CampaignStatus> CANCELLABLE = EnumSet.of(DRAFT, ACTIVE, PAUSED);

    private final String value;

    CampaignStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static CampaignStatus fromValue(String value) {
        for (CampaignStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown campaign status: " + value);
    }
}
