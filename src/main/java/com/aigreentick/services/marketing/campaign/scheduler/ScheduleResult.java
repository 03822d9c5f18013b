package com.aigreentick.services.marketing.campaign.scheduler;

import java.time.LocalDate;

public record ScheduleResult(
        int recipientCount,
        int insertedCount,
        int dailyCap,
        LocalDate firstDate,
        LocalDate lastDate) {

    public static ScheduleResult empty(int dailyCap) {
        return new ScheduleResult(0, 0, dailyCap, null, null);
    }
}
