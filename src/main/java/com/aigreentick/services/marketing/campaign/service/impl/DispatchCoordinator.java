package com.aigreentick.services.marketing.campaign.service.impl;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.campaign.dto.DispatchSummary;
import com.aigreentick.services.marketing.campaign.dto.OutboundMessage;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.enums.GatewayErrorType;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.campaign.repository.CampaignRepository;
import com.aigreentick.services.marketing.campaign.scheduler.CampaignScheduler;
import com.aigreentick.services.marketing.campaign.service.MessageSendGateway;
import com.aigreentick.services.marketing.config.CampaignProperties;
import com.aigreentick.services.marketing.exception.GatewaySendException;
import com.aigreentick.services.marketing.exception.QuotaExceededException;
import com.aigreentick.services.marketing.kafka.event.CampaignFailureEvent;
import com.aigreentick.services.marketing.kafka.producer.CampaignFailureProducer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends today's due recipients of active campaigns.
 *
 * Campaigns are served by (priority, created_at, id). Each recipient is claimed, then a slot of
 * the campaign's daily cap and a global quota slot are reserved, then the gateway is called. Every step is an independent conditional
 * update, so overlapping or repeated runs never send a recipient twice or exceed the daily cap.
 * One recipient's failure never stops the rest of the cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchCoordinator {

    private enum Outcome { SENT, FAILED, RETRY_SCHEDULED, SKIPPED, CAMPAIGN_CAP_REACHED, QUOTA_EXHAUSTED }

    private final CampaignRepository campaignRepository;
    private final CampaignRecipientRepository recipientRepository;
    private final DailyQuotaLedger quotaLedger;
    private final MessageSendGateway sendGateway;
    private final StatusReconciler statusReconciler;
    private final CampaignLifecycleServiceImpl lifecycleService;
    private final CampaignScheduler campaignScheduler;
    private final TemplateBuilderService templateBuilderService;
    private final CampaignFailureProducer failureProducer;
    private final CampaignProperties properties;
    private final Clock clock;

    public DispatchSummary processToday() {
        LocalDate today = LocalDate.now(clock);
        long startTime = clock.millis();
        log.info("=== Dispatch cycle started: date={} quotaRemaining={} ===", today, quotaLedger.remaining(today));

        Tally tally = new Tally();
        List<Campaign> campaigns = campaignRepository.findByStatusOrderByPriorityAscCreatedAtAscIdAsc(CampaignStatus.ACTIVE);

        for (Campaign campaign : campaigns) {
            boolean exhausted = dispatchCampaign(campaign, today, tally);
            tally.campaignsProcessed++;
            lifecycleService.completeIfFinished(campaign.getId());
            if (exhausted) {
                tally.quotaExhausted = true;
                break;
            }
        }

        if (tally.quotaExhausted) {
            deferRemaining(today, tally);
        }

        DispatchSummary summary = new DispatchSummary(today, tally.campaignsProcessed, tally.sent, tally.failed,
                tally.retried, tally.deferred, tally.quotaExhausted);
        log.info("=== Dispatch cycle finished in {}ms: {} ===", clock.millis() - startTime, summary);
        return summary;
    }

    /**
     * @return true when the global quota ran out while serving this campaign
     */
    private boolean dispatchCampaign(Campaign campaign, LocalDate today, Tally tally) {
        Long campaignId = campaign.getId();
        int dailyCap = campaignScheduler.effectiveDailyCap(campaign);
        int remaining = Math.max(0, dailyCap - quotaLedger.campaignSentOn(campaignId, today));
        if (remaining == 0) {
            log.debug("Campaign daily cap already reached. campaignId={} cap={}", campaignId, dailyCap);
            return false;
        }

        OutboundMessage template = OutboundMessage.builder()
                .templateName(campaign.getTemplateName())
                .languageCode(campaign.getLanguageCode())
                .parameters(templateBuilderService.parseParameters(campaign.getTemplateParameters()))
                .build();

        log.info("Dispatching campaign {} (priority={}) remainingToday={}", campaignId, campaign.getPriority(), remaining);
        long cursor = 0L;

        while (remaining > 0) {
            // pause or cancel issued during the cycle stops the campaign at the next page
            if (campaignRepository.findStatusById(campaignId) != CampaignStatus.ACTIVE) {
                log.info("Campaign {} is no longer active, stopping its dispatch", campaignId);
                return false;
            }

            int pageSize = Math.min(remaining, properties.getDispatch().getPageSize());
            List<CampaignRecipient> due = recipientRepository.findDue(campaignId, cursor, today,
                    LocalDateTime.now(clock), PageRequest.of(0, pageSize));
            if (due.isEmpty()) {
                return false;
            }

            for (CampaignRecipient recipient : due) {
                if (remaining == 0) {
                    break;
                }
                cursor = recipient.getId();

                Outcome outcome;
                try {
                    outcome = dispatchRecipient(campaign, recipient, template, today, dailyCap, remaining);
                } catch (RuntimeException e) {
                    log.error("Unexpected error dispatching recipient; it stays claimed until the lease expires. campaignId={} recipientId={}",
                            campaignId, recipient.getId(), e);
                    continue;
                }

                switch (outcome) {
                    case SENT -> {
                        tally.sent++;
                        remaining--;
                    }
                    case FAILED -> tally.failed++;
                    case RETRY_SCHEDULED -> tally.retried++;
                    case CAMPAIGN_CAP_REACHED -> {
                        log.info("Campaign {} reached its daily cap of {} in another run", campaignId, dailyCap);
                        return false;
                    }
                    case QUOTA_EXHAUSTED -> {
                        tally.deferred++;
                        return true;
                    }
                    case SKIPPED -> log.debug("Recipient already claimed elsewhere. recipientId={}", recipient.getId());
                }
            }
        }
        return false;
    }

    private Outcome dispatchRecipient(Campaign campaign, CampaignRecipient recipient, OutboundMessage template,
            LocalDate today, int dailyCap, int campaignRemaining) {

        LocalDateTime now = LocalDateTime.now(clock);
        String token = UUID.randomUUID().toString();
        Long recipientId = recipient.getId();
        Long campaignId = campaign.getId();

        if (recipientRepository.claim(recipientId, token, now, now.minus(properties.getClaimLease())) == 0) {
            return Outcome.SKIPPED;
        }

        if (!quotaLedger.reserveCampaignSlot(campaignId, today, dailyCap)) {
            recipientRepository.deferClaimed(recipientId, token, recipient.getScheduledDate(), now);
            return Outcome.CAMPAIGN_CAP_REACHED;
        }

        try {
            quotaLedger.reserveSlot(today);
        } catch (QuotaExceededException e) {
            quotaLedger.releaseCampaignSlot(campaignId, today);
            recipientRepository.deferClaimed(recipientId, token, today.plusDays(1), now);
            log.info("Global quota exhausted for {} (cap={}); deferring remaining recipients", today, e.getCap());
            return Outcome.QUOTA_EXHAUSTED;
        }

        OutboundMessage message = OutboundMessage.builder()
                .phone(recipient.getPhone())
                .templateName(template.getTemplateName())
                .languageCode(template.getLanguageCode())
                .parameters(template.getParameters())
                .build();

        String providerMessageId;
        try {
            providerMessageId = sendGateway.send(message);
        } catch (GatewaySendException e) {
            quotaLedger.releaseCampaignSlot(campaignId, today);
            return handleSendFailure(campaign, recipient, token, e, today, campaignRemaining);
        } catch (RuntimeException e) {
            quotaLedger.releaseCampaignSlot(campaignId, today);
            GatewaySendException wrapped = new GatewaySendException(GatewayErrorType.TRANSIENT_NETWORK, 0,
                    "Gateway call failed: " + e.getMessage());
            return handleSendFailure(campaign, recipient, token, wrapped, today, campaignRemaining);
        }

        LocalDateTime sentAt = LocalDateTime.now(clock);
        if (recipientRepository.markSent(recipientId, token, providerMessageId, sentAt) == 0) {
            log.error("Send succeeded but the claim was lost. campaignId={} recipientId={} providerMessageId={}",
                    campaign.getId(), recipientId, providerMessageId);
        }
        statusReconciler.replayHeld(providerMessageId);
        return Outcome.SENT;
    }

    private Outcome handleSendFailure(Campaign campaign, CampaignRecipient recipient, String token,
            GatewaySendException e, LocalDate today, int campaignRemaining) {

        LocalDateTime now = LocalDateTime.now(clock);
        int attempts = recipient.getRetryCount() + 1;
        String reason = e.getErrorType().getValue() + ": " + e.getMessage();

        if (!e.isRetryable() || attempts >= properties.getMaxRetries()) {
            String finalReason = e.isRetryable() ? "Retries exhausted after " + attempts + " attempts, " + reason : reason;
            recipientRepository.markFailed(recipient.getId(), token, finalReason, now);
            log.error("Recipient permanently failed. campaignId={} recipientId={} phone={} reason={}",
                    campaign.getId(), recipient.getId(), recipient.getPhone(), finalReason);
            failureProducer.publish(CampaignFailureEvent.recipientFailed(
                    campaign.getId(), recipient.getId(), recipient.getPhone(),
                    e.getErrorType().getValue(), finalReason, clock.millis()));
            return Outcome.FAILED;
        }

        LocalDateTime nextAttempt = now.plus(properties.getRetryBackoff());
        boolean retryToday = campaignRemaining > 0
                && quotaLedger.remaining(today) > 0
                && nextAttempt.toLocalDate().equals(today);

        if (retryToday) {
            recipientRepository.rescheduleRetry(recipient.getId(), token, today, nextAttempt, reason, now);
        } else {
            recipientRepository.rescheduleRetry(recipient.getId(), token, today.plusDays(1), null, reason, now);
        }
        log.warn("Send failed, retry {} of {} scheduled {}. campaignId={} recipientId={} reason={}",
                attempts, properties.getMaxRetries(), retryToday ? "at " + nextAttempt : "for tomorrow",
                campaign.getId(), recipient.getId(), reason);
        return Outcome.RETRY_SCHEDULED;
    }

    private void deferRemaining(LocalDate today, Tally tally) {
        List<Long> activeIds = campaignRepository.findByStatusOrderByPriorityAscCreatedAtAscIdAsc(CampaignStatus.ACTIVE)
                .stream()
                .map(Campaign::getId)
                .toList();
        if (activeIds.isEmpty()) {
            return;
        }
        int moved = recipientRepository.deferDue(activeIds, today, today.plusDays(1), LocalDateTime.now(clock));
        tally.deferred += moved;
        log.info("Deferred {} due recipients of {} active campaigns to {}", moved, activeIds.size(), today.plusDays(1));
    }

    private static final class Tally {
        int campaignsProcessed;
        int sent;
        int failed;
        int retried;
        int deferred;
        boolean quotaExhausted;
    }
}
