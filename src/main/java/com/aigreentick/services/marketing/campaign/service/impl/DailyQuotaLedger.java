package com.aigreentick.services.marketing.campaign.service.impl;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.campaign.model.CampaignDailySend;
import com.aigreentick.services.marketing.campaign.model.DailyQuota;
import com.aigreentick.services.marketing.campaign.repository.CampaignDailySendRepository;
import com.aigreentick.services.marketing.campaign.repository.DailyQuotaRepository;
import com.aigreentick.services.marketing.config.CampaignProperties;
import com.aigreentick.services.marketing.exception.QuotaExceededException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-day send counters: the global one shared by every campaign and every dispatch run, and
 * one per campaign bounded by its own daily cap.
 *
 * Conditional increments on these rows are the only points where concurrent dispatchers
 * serialize. Global slots are never given back, including after a failed provider call.
 * A campaign slot is given back when its message was not accepted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyQuotaLedger {

    private final DailyQuotaRepository dailyQuotaRepository;
    private final CampaignDailySendRepository campaignDailySendRepository;
    private final CampaignProperties properties;
    private final Clock clock;

    /**
     * Takes one send slot for {@code date}.
     *
     * @throws QuotaExceededException when the global cap for that date is already reached
     */
    public void reserveSlot(LocalDate date) {
        int cap = properties.getGlobalDailyCap();
        ensureRow(date);

        int updated = dailyQuotaRepository.tryIncrement(date, cap, LocalDateTime.now(clock));
        if (updated == 0) {
            log.debug("Quota exhausted. date={} cap={}", date, cap);
            throw new QuotaExceededException(date, cap);
        }
    }

    public int sentOn(LocalDate date) {
        Integer sent = dailyQuotaRepository.findMessagesSent(date);
        return sent == null ? 0 : sent;
    }

    public int remaining(LocalDate date) {
        return Math.max(0, properties.getGlobalDailyCap() - sentOn(date));
    }

    /**
     * Takes one of {@code campaignId}'s sends for {@code date}.
     *
     * @return false when the campaign already reserved {@code cap} sends that day
     */
    public boolean reserveCampaignSlot(Long campaignId, LocalDate date, int cap) {
        ensureCampaignRow(campaignId, date);
        return campaignDailySendRepository.tryIncrement(campaignId, date, cap, LocalDateTime.now(clock)) == 1;
    }

    public void releaseCampaignSlot(Long campaignId, LocalDate date) {
        campaignDailySendRepository.decrement(campaignId, date, LocalDateTime.now(clock));
    }

    public int campaignSentOn(Long campaignId, LocalDate date) {
        Integer sent = campaignDailySendRepository.findMessagesSent(campaignId, date);
        return sent == null ? 0 : sent;
    }

    private void ensureCampaignRow(Long campaignId, LocalDate date) {
        if (campaignDailySendRepository.existsById(new CampaignDailySend.Key(campaignId, date))) {
            return;
        }
        try {
            campaignDailySendRepository.saveAndFlush(CampaignDailySend.open(campaignId, date, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Campaign send counter already created concurrently. campaignId={} date={}", campaignId, date);
        }
    }

    private void ensureRow(LocalDate date) {
        if (dailyQuotaRepository.existsById(date)) {
            return;
        }
        try {
            dailyQuotaRepository.saveAndFlush(DailyQuota.open(date, LocalDateTime.now(clock)));
            log.info("Opened daily quota row. date={} cap={}", date, properties.getGlobalDailyCap());
        } catch (DataIntegrityViolationException e) {
            // another dispatcher created it first
            log.debug("Daily quota row already created concurrently. date={}", date);
        }
    }
}
