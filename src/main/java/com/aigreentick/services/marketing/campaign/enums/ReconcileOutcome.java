package com.aigreentick.services.marketing.campaign.enums;

public enum ReconcileOutcome {
    /** Status advanced on the recipient row. */
    APPLIED,
    /** Duplicate, regressive or post-terminal event. */
    IGNORED,
    /** provider_message_id not known yet; kept for replay. */
    HELD,
    /** Gave up on an unknown provider_message_id. */
    DROPPED
}
