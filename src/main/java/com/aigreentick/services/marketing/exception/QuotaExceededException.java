package com.aigreentick.services.marketing.exception;

import java.time.LocalDate;

/**
 * The global provider cap for the day is used up. Soft: the recipient is deferred, not failed.
 */
public class QuotaExceededException extends CampaignException {

    private final LocalDate date;
    private final int cap;

    public QuotaExceededException(LocalDate date, int cap) {
        super("Daily send quota of " + cap + " exhausted for " + date);
        this.date = date;
        this.cap = cap;
    }

    public LocalDate getDate() {
        return date;
    }

    public int getCap() {
        return cap;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
