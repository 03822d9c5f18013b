package com.aigreentick.services.marketing.campaign.job;

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.campaign.dto.DispatchSummary;
import com.aigreentick.services.marketing.campaign.service.impl.DispatchCoordinator;
import com.aigreentick.services.marketing.config.CampaignProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the dispatch cycle on a cron. A trigger that fires while a cycle is still running in
 * this process is skipped; cycles in other instances are made safe by the claim and quota updates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignDispatchJob {

    private final DispatchCoordinator dispatchCoordinator;
    private final CampaignProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${campaign.dispatch.cron}", zone = "${campaign.zone-id:UTC}")
    public void dispatch() {
        if (!properties.getDispatch().isEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous dispatch cycle still running, skipping this trigger");
            return;
        }
        try {
            DispatchSummary summary = dispatchCoordinator.processToday();
            if (summary.quotaExhausted()) {
                log.info("Daily quota reached for {}. Deferred={}", summary.date(), summary.messagesDeferred());
            }
        } catch (RuntimeException e) {
            log.error("Dispatch cycle aborted", e);
        } finally {
            running.set(false);
        }
    }
}
