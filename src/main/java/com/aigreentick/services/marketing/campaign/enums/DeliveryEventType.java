package com.aigreentick.services.marketing.campaign.enums;

public enum DeliveryEventType {
    DELIVERED("delivered"),
    READ("read"),
    FAILED("failed");

    private final String value;

    DeliveryEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DeliveryEventType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Delivery event type is required");
        }
        for (DeliveryEventType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown delivery event type: " + value);
    }
}
