package com.aigreentick.services.marketing.campaign.dto;

import java.time.LocalDate;

/**
 * Totals of one dispatch cycle.
 *
 * @param messagesRetried transient failures put back for another attempt
 * @param messagesDeferred recipients moved to the next day because the global quota ran out
 */
public record DispatchSummary(
        LocalDate date,
        int campaignsProcessed,
        int messagesSent,
        int messagesFailed,
        int messagesRetried,
        int messagesDeferred,
        boolean quotaExhausted) {
}
