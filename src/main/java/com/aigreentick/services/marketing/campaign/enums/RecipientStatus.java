package com.aigreentick.services.marketing.campaign.enums;

/**
 * Send status of a single (campaign, phone) recipient.
 * Maps to the lowercase values reported by the provider.
 */
public enum RecipientStatus {
    PENDING("pending", 0),
    SENT("sent", 1),
    DELIVERED("delivered", 2),
    READ("read", 3),
    FAILED("failed", 99);

    private final String value;
    private final int rank;

    RecipientStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Delivered, read and failed stop tracking. Read may still follow delivered.
     */
    public boolean isTerminal() {
        return this == DELIVERED || this == READ || this == FAILED;
    }

    public static RecipientStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        String lowerValue = value.toLowerCase();
        for (RecipientStatus status : values()) {
            if (status.value.equals(lowerValue)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown recipient status: " + value);
    }
}
