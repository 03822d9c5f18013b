package com.aigreentick.services.marketing.campaign.scheduler;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Spreads an ordered phone list over consecutive calendar days, at most {@code dailyCap} per day.
 * The first {@code dailyCap} phones go on the start date, the next block on the day after, and so on,
 * so the same input always yields the same dates.
 */
public final class SendSchedulePlanner {

    private SendSchedulePlanner() {
    }

    public static List<RecipientSlot> partition(List<String> phones, LocalDate startDate, int dailyCap) {
        if (dailyCap < 1) {
            throw new IllegalArgumentException("dailyCap must be at least 1, was " + dailyCap);
        }
        if (startDate == null) {
            throw new IllegalArgumentException("startDate is required");
        }

        List<RecipientSlot> slots = new ArrayList<>(phones.size());
        for (int i = 0; i < phones.size(); i++) {
            slots.add(new RecipientSlot(phones.get(i), startDate.plusDays(i / dailyCap)));
        }
        return slots;
    }

    public static int daysNeeded(int recipientCount, int dailyCap) {
        if (recipientCount <= 0) {
            return 0;
        }
        return (recipientCount + dailyCap - 1) / dailyCap;
    }

    /**
     * Last scheduled date, or null when there is nothing to send.
     */
    public static LocalDate lastDate(LocalDate startDate, int recipientCount, int dailyCap) {
        int days = daysNeeded(recipientCount, dailyCap);
        return days == 0 ? null : startDate.plusDays(days - 1L);
    }
}
