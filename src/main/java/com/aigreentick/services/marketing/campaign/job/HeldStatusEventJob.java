package com.aigreentick.services.marketing.campaign.job;

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.campaign.service.impl.StatusReconciler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class HeldStatusEventJob {

    private final StatusReconciler statusReconciler;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${campaign.reconcile.held-replay-interval-ms:60000}")
    public void replayHeldEvents() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            statusReconciler.retryHeldEvents();
        } catch (RuntimeException e) {
            log.error("Held status event replay failed", e);
        } finally {
            running.set(false);
        }
    }
}
