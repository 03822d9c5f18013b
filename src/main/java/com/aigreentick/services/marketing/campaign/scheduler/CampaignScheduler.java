package com.aigreentick.services.marketing.campaign.scheduler;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.audience.service.impl.AudienceResolver;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.config.CampaignProperties;
import com.aigreentick.services.marketing.exception.CampaignValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns send dates to a campaign's recipients when it is activated.
 *
 * Manually added rows come first in the order they were added, followed by the resolved
 * audience minus any phone already on the campaign. The combined list is split into blocks of
 * the effective daily cap on consecutive days from the start date.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignScheduler {

    private final CampaignRecipientRepository recipientRepository;
    private final RecipientBatchWriter recipientBatchWriter;
    private final AudienceResolver audienceResolver;
    private final CampaignProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public int effectiveDailyCap(Campaign campaign) {
        int limit = campaign.getDailySendLimit() == null
                ? properties.getDefaultDailyLimit()
                : campaign.getDailySendLimit();
        return Math.max(1, Math.min(limit, properties.getGlobalDailyCap()));
    }

    public ScheduleResult schedule(Campaign campaign, LocalDate startDate) {
        Long campaignId = campaign.getId();
        int dailyCap = effectiveDailyCap(campaign);
        LocalDateTime now = LocalDateTime.now(clock);

        List<CampaignRecipient> manual = recipientRepository.findByCampaignIdAndScheduledDateIsNullOrderByIdAsc(campaignId);

        List<String> fresh = new ArrayList<>();
        if (Boolean.TRUE.equals(campaign.getUseTargetAudience())) {
            Set<String> existing = new HashSet<>(recipientRepository.findPhonesByCampaignId(campaignId));
            for (String phone : audienceResolver.resolve(readFilter(campaign))) {
                if (existing.add(phone)) {
                    fresh.add(phone);
                }
            }
        }

        int total = manual.size() + fresh.size();
        if (total == 0) {
            log.info("Campaign has no recipients to schedule. campaignId={}", campaignId);
            return ScheduleResult.empty(dailyCap);
        }

        List<String> ordered = new ArrayList<>(total);
        manual.forEach(r -> ordered.add(r.getPhone()));
        ordered.addAll(fresh);
        List<RecipientSlot> slots = SendSchedulePlanner.partition(ordered, startDate, dailyCap);

        List<Long> manualIds = new ArrayList<>(manual.size());
        List<LocalDate> manualDates = new ArrayList<>(manual.size());
        for (int i = 0; i < manual.size(); i++) {
            manualIds.add(manual.get(i).getId());
            manualDates.add(slots.get(i).scheduledDate());
        }
        recipientBatchWriter.assignDates(manualIds, manualDates, now);
        int inserted = recipientBatchWriter.insertPending(campaignId, slots.subList(manual.size(), total), now);

        LocalDate lastDate = SendSchedulePlanner.lastDate(startDate, total, dailyCap);
        log.info("Campaign scheduled. campaignId={} recipients={} (manual={} resolved={}) dailyCap={} days={} from={} to={}",
                campaignId, total, manual.size(), fresh.size(), dailyCap,
                SendSchedulePlanner.daysNeeded(total, dailyCap), startDate, lastDate);

        return new ScheduleResult(total, inserted, dailyCap, startDate, lastDate);
    }

    private AudienceFilter readFilter(Campaign campaign) {
        String json = campaign.getTargetAudience();
        if (json == null || json.isBlank()) {
            return AudienceFilter.everyone();
        }
        try {
            return objectMapper.readValue(json, AudienceFilter.class);
        } catch (JsonProcessingException e) {
            throw new CampaignValidationException("Stored target audience of campaign " + campaign.getId()
                    + " is not valid JSON: " + e.getOriginalMessage());
        }
    }
}
