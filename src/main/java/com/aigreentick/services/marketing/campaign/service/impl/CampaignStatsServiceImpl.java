package com.aigreentick.services.marketing.campaign.service.impl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.dto.CampaignStats;
import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.campaign.repository.CampaignRepository;
import com.aigreentick.services.marketing.campaign.scheduler.CampaignScheduler;
import com.aigreentick.services.marketing.exception.CampaignNotFoundException;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CampaignStatsServiceImpl {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CampaignRepository campaignRepository;
    private final CampaignRecipientRepository recipientRepository;
    private final CampaignScheduler campaignScheduler;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CampaignStats getStats(Long campaignId) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));

        Map<RecipientStatus, Long> counts = new EnumMap<>(RecipientStatus.class);
        List<Object[]> rows = recipientRepository.countByStatus(campaignId);
        for (Object[] row : rows) {
            counts.put((RecipientStatus) row[0], ((Number) row[1]).longValue());
        }

        long pending = counts.getOrDefault(RecipientStatus.PENDING, 0L);
        long read = counts.getOrDefault(RecipientStatus.READ, 0L);
        long delivered = counts.getOrDefault(RecipientStatus.DELIVERED, 0L) + read;
        long failed = counts.getOrDefault(RecipientStatus.FAILED, 0L);
        long failedAfterSend = failed == 0 ? 0 : recipientRepository.countFailedAfterSend(campaignId);
        long sent = counts.getOrDefault(RecipientStatus.SENT, 0L) + delivered + failedAfterSend;
        long total = pending + counts.getOrDefault(RecipientStatus.SENT, 0L) + delivered + failed;

        int dailyCap = campaignScheduler.effectiveDailyCap(campaign);

        return CampaignStats.builder()
                .campaignId(campaignId)
                .name(campaign.getName())
                .status(campaign.getStatus())
                .total(total)
                .pending(pending)
                .sent(sent)
                .delivered(delivered)
                .read(read)
                .failed(failed)
                .deliveryRate(percentage(delivered, sent))
                .readRate(percentage(read, delivered))
                .progress(percentage(sent, total))
                .dailyCap(dailyCap)
                .startDate(campaign.getStartDate())
                .estimatedCompletionDate(estimateCompletion(campaign, pending, dailyCap))
                .build();
    }

    static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return null;
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    /**
     * Later of start date and today, plus the days needed to drain what is pending at the daily cap.
     */
    private LocalDate estimateCompletion(Campaign campaign, long pending, int dailyCap) {
        if (pending == 0 || campaign.getStatus().isTerminal()) {
            return null;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate base = campaign.getStartDate() == null || campaign.getStartDate().isBefore(today)
                ? today
                : campaign.getStartDate();
        long days = (pending + dailyCap - 1) / dailyCap;
        return base.plusDays(days);
    }
}
