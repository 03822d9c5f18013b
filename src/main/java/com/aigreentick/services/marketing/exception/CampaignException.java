package com.aigreentick.services.marketing.exception;

/**
 * Base type for errors surfaced by the campaign engine.
 * Every subtype states whether the operation may succeed if retried later.
 */
public abstract class CampaignException extends RuntimeException {

    protected CampaignException(String message) {
        super(message);
    }

    protected CampaignException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
