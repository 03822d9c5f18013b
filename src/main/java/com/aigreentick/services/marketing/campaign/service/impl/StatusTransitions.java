package com.aigreentick.services.marketing.campaign.service.impl;

import java.util.Optional;

import com.aigreentick.services.marketing.campaign.enums.DeliveryEventType;
import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;

/**
 * Next recipient status for a provider event, as a function of the recorded status only.
 *
 * <pre>
 * SENT      + delivered -> DELIVERED
 * SENT      + read      -> READ
 * SENT      + failed    -> FAILED
 * DELIVERED + read      -> READ
 * </pre>
 *
 * Anything else is a duplicate, out of order or arrives before the send was recorded,
 * and yields empty.
 */
public final class StatusTransitions {

    private StatusTransitions() {
    }

    public static Optional<RecipientStatus> next(RecipientStatus current, DeliveryEventType event) {
        if (current == null || event == null) {
            return Optional.empty();
        }
        RecipientStatus target = target(event);

        switch (current) {
            case SENT:
                return Optional.of(target);
            case DELIVERED:
                return target == RecipientStatus.READ ? Optional.of(target) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    static RecipientStatus target(DeliveryEventType event) {
        switch (event) {
            case DELIVERED:
                return RecipientStatus.DELIVERED;
            case READ:
                return RecipientStatus.READ;
            case FAILED:
                return RecipientStatus.FAILED;
            default:
                throw new IllegalArgumentException("Unhandled event type: " + event);
        }
    }
}
