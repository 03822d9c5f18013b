package com.aigreentick.services.marketing.campaign.scheduler;

import java.time.LocalDate;

/**
 * A phone and the calendar day it is scheduled to be sent on.
 */
public record RecipientSlot(String phone, LocalDate scheduledDate) {
}
