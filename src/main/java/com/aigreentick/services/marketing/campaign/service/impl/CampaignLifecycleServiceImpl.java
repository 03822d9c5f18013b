package com.aigreentick.services.marketing.campaign.service.impl;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.dto.ActivationResult;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.campaign.repository.CampaignRepository;
import com.aigreentick.services.marketing.campaign.scheduler.CampaignScheduler;
import com.aigreentick.services.marketing.campaign.scheduler.ScheduleResult;
import com.aigreentick.services.marketing.exception.CampaignNotFoundException;
import com.aigreentick.services.marketing.exception.LifecycleViolationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Campaign state machine. Every transition is a conditional update on the current status,
 * so two callers racing on the same campaign cannot both succeed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignLifecycleServiceImpl {

    private static final Set<RecipientStatus> OPEN_RECIPIENT_STATUSES = EnumSet.of(RecipientStatus.PENDING, RecipientStatus.SENT);

    private final CampaignRepository campaignRepository;
    private final CampaignRecipientRepository recipientRepository;
    private final CampaignScheduler campaignScheduler;
    private final Clock clock;

    /**
     * Moves a draft campaign to active and schedules its recipients, in one transaction.
     * The draft guard is taken before the audience is resolved, so a repeated or concurrent
     * activation fails without writing anything.
     *
     * @param requestedStartDate first send date; falls back to the campaign's start date, then tomorrow
     */
    @Transactional
    public ActivationResult activate(Long campaignId, LocalDate requestedStartDate) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));

        LocalDate today = LocalDate.now(clock);
        LocalDate startDate = requestedStartDate != null ? requestedStartDate
                : campaign.getStartDate() != null ? campaign.getStartDate()
                : today.plusDays(1);
        LocalDateTime now = LocalDateTime.now(clock);

        int updated = campaignRepository.activate(campaignId, startDate, now);
        if (updated == 0) {
            throw violation(campaignId, "activate");
        }
        log.info("=== Activating campaign {} ({}) start={} ===", campaignId, campaign.getName(), startDate);

        ScheduleResult schedule = campaignScheduler.schedule(campaign, startDate);

        CampaignStatus status = CampaignStatus.ACTIVE;
        if (schedule.recipientCount() == 0) {
            campaignRepository.complete(campaignId, now);
            status = CampaignStatus.COMPLETED;
            log.info("Campaign {} resolved no recipients and was completed immediately", campaignId);
        }

        return new ActivationResult(campaignId, status, schedule.recipientCount(), schedule.dailyCap(),
                startDate, schedule.lastDate());
    }

    /**
     * Stops dispatch from the next cycle on. Pending recipients keep their dates.
     */
    public CampaignStatus pause(Long campaignId) {
        return move(campaignId, EnumSet.of(CampaignStatus.ACTIVE), CampaignStatus.PAUSED, "pause");
    }

    public CampaignStatus resume(Long campaignId) {
        return move(campaignId, EnumSet.of(CampaignStatus.PAUSED), CampaignStatus.ACTIVE, "resume");
    }

    /**
     * Terminal. Pending recipients are kept and never sent.
     */
    public CampaignStatus cancel(Long campaignId) {
        return move(campaignId, CampaignStatus.CANCELLABLE, CampaignStatus.CANCELLED, "cancel");
    }

    /**
     * Completes an active campaign once none of its recipients is pending or awaiting a delivery outcome.
     *
     * @return true when this call completed the campaign
     */
    public boolean completeIfFinished(Long campaignId) {
        if (recipientRepository.countByCampaignIdAndStatusIn(campaignId, OPEN_RECIPIENT_STATUSES) > 0) {
            return false;
        }
        boolean completed = campaignRepository.complete(campaignId, LocalDateTime.now(clock)) == 1;
        if (completed) {
            log.info("Campaign {} completed: every recipient reached a terminal status", campaignId);
        }
        return completed;
    }

    private CampaignStatus move(Long campaignId, Set<CampaignStatus> from, CampaignStatus to, String action) {
        int updated = campaignRepository.transition(campaignId, from, to, LocalDateTime.now(clock));
        if (updated == 0) {
            throw violation(campaignId, action);
        }
        log.info("Campaign {} moved to {} ({})", campaignId, to.getValue(), action);
        return to;
    }

    private RuntimeException violation(Long campaignId, String action) {
        CampaignStatus current = campaignRepository.findStatusById(campaignId);
        if (current == null) {
            return new CampaignNotFoundException(campaignId);
        }
        log.warn("Rejected lifecycle action. campaignId={} action={} status={}", campaignId, action, current.getValue());
        return new LifecycleViolationException(campaignId, current, action);
    }
}
