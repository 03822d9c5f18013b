package com.aigreentick.services.marketing.campaign.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.aigreentick.services.marketing.campaign.dto.ActivationResult;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.exception.CampaignNotFoundException;
import com.aigreentick.services.marketing.exception.LifecycleViolationException;

@DataJpaTest
class CampaignLifecycleServiceImplTest extends CampaignEngineTestSupport {

    @Test
    void activationSpreadsTenThousandRecipientsOverFortyDays() {
        audience.addAll(phones("91900", 10_000));
        Campaign campaign = draft("big", 1, 250);

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.status()).isEqualTo(CampaignStatus.ACTIVE);
        assertThat(result.recipientCount()).isEqualTo(10_000);
        assertThat(result.lastScheduledDate()).isEqualTo(LocalDate.of(2025, 7, 10));

        Map<LocalDate, Long> perDay = recipientsOf(campaign.getId()).stream()
                .collect(Collectors.groupingBy(CampaignRecipient::getScheduledDate, Collectors.counting()));
        assertThat(perDay).hasSize(40);
        assertThat(perDay.values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(250L));
        assertThat(perDay.keySet()).contains(DAY_ONE, LocalDate.of(2025, 7, 10));
    }

    @Test
    void dailyCapIsBoundedByTheGlobalCap() {
        properties.setGlobalDailyCap(100);
        audience.addAll(phones("91901", 250));
        Campaign campaign = campaignService.createCampaign(request("bounded").dailySendLimit(100).build());
        campaign.setDailySendLimit(500);
        campaignRepository.saveAndFlush(campaign);

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.dailyCap()).isEqualTo(100);
        assertThat(result.lastScheduledDate()).isEqualTo(DAY_ONE.plusDays(2));
    }

    @Test
    void startDateDefaultsToTomorrow() {
        audience.add("919811111111");
        Campaign campaign = draft("default-start", 1, 10);

        ActivationResult result = lifecycleService.activate(campaign.getId(), null);

        assertThat(result.startDate()).isEqualTo(DAY_ONE.plusDays(1));
        assertThat(recipient(campaign.getId(), "919811111111").getScheduledDate()).isEqualTo(DAY_ONE.plusDays(1));
    }

    @Test
    void reactivationIsRejectedWithoutWritingRecipients() {
        audience.addAll(phones("91902", 30));
        Campaign campaign = draft("once", 1, 10);
        lifecycleService.activate(campaign.getId(), DAY_ONE);
        audience.addAll(phones("91903", 5));

        assertThatThrownBy(() -> lifecycleService.activate(campaign.getId(), DAY_ONE))
                .isInstanceOf(LifecycleViolationException.class)
                .hasMessageContaining("active")
                .satisfies(e -> assertThat(((LifecycleViolationException) e).isRetryable()).isFalse());

        assertThat(recipientRepository.countByCampaignId(campaign.getId())).isEqualTo(30);
        assertThat(audienceCalls).isEqualTo(1);
    }

    @Test
    void duplicatePhonesProduceOneRecipientEach() {
        audience.addAll(List.of("919822222222", " 919833333333 ", "919822222222", "", "919833333333"));
        Campaign campaign = draft("dupes", 1, 10);

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.recipientCount()).isEqualTo(2);
        assertThat(recipientsOf(campaign.getId()))
                .extracting(CampaignRecipient::getPhone)
                .containsExactly("919822222222", "919833333333");
    }

    @Test
    void manualRecipientsAreScheduledAheadOfTheResolvedAudience() {
        audience.addAll(List.of("919844444444", "919855555555", "919866666666"));
        Campaign campaign = draft("mixed", 1, 2);
        campaignService.addRecipients(campaign.getId(), List.of("919866666666", "919877777777"));

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.recipientCount()).isEqualTo(4);
        assertThat(recipient(campaign.getId(), "919866666666").getScheduledDate()).isEqualTo(DAY_ONE);
        assertThat(recipient(campaign.getId(), "919877777777").getScheduledDate()).isEqualTo(DAY_ONE);
        assertThat(recipient(campaign.getId(), "919844444444").getScheduledDate()).isEqualTo(DAY_ONE.plusDays(1));
        assertThat(recipient(campaign.getId(), "919855555555").getScheduledDate()).isEqualTo(DAY_ONE.plusDays(1));
    }

    @Test
    void emptyAudienceCompletesImmediately() {
        Campaign campaign = draft("nobody", 1, 10);

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.status()).isEqualTo(CampaignStatus.COMPLETED);
        assertThat(result.recipientCount()).isZero();
        Campaign stored = campaignRepository.findById(campaign.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(CampaignStatus.COMPLETED);
        assertThat(stored.getCompletedAt()).isNotNull();
    }

    @Test
    void pauseResumeAndCancelFollowTheStateGraph() {
        audience.add("919888888888");
        Campaign campaign = draft("graph", 1, 10);

        assertThatThrownBy(() -> lifecycleService.pause(campaign.getId()))
                .isInstanceOf(LifecycleViolationException.class);
        lifecycleService.activate(campaign.getId(), DAY_ONE);
        assertThatThrownBy(() -> lifecycleService.resume(campaign.getId()))
                .isInstanceOf(LifecycleViolationException.class);

        assertThat(lifecycleService.pause(campaign.getId())).isEqualTo(CampaignStatus.PAUSED);
        assertThat(lifecycleService.resume(campaign.getId())).isEqualTo(CampaignStatus.ACTIVE);
        assertThat(lifecycleService.cancel(campaign.getId())).isEqualTo(CampaignStatus.CANCELLED);

        assertThatThrownBy(() -> lifecycleService.cancel(campaign.getId()))
                .isInstanceOf(LifecycleViolationException.class)
                .hasMessage("Cannot cancel campaign %d while it is cancelled", campaign.getId());
        assertThatThrownBy(() -> lifecycleService.activate(campaign.getId(), DAY_ONE))
                .isInstanceOf(LifecycleViolationException.class);
        assertThat(recipientRepository.countByCampaignId(campaign.getId())).isEqualTo(1);
    }

    @Test
    void draftCanBeCancelled() {
        Campaign campaign = draft("abandoned", 1, 10);

        assertThat(lifecycleService.cancel(campaign.getId())).isEqualTo(CampaignStatus.CANCELLED);
    }

    @Test
    void unknownCampaignIsReportedAsNotFound() {
        assertThatThrownBy(() -> lifecycleService.activate(999L, DAY_ONE))
                .isInstanceOf(CampaignNotFoundException.class);
        assertThatThrownBy(() -> lifecycleService.pause(999L))
                .isInstanceOf(CampaignNotFoundException.class);
    }

    @Test
    void invalidAudienceValuesAreNotScheduled() {
        audience.addAll(List.of("919877700001", "not-a-phone", "+91987770000200000000000", "919877700003"));
        Campaign campaign = draft("dirty-audience", 1, 10);

        ActivationResult result = lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThat(result.recipientCount()).isEqualTo(2);
        assertThat(recipientsOf(campaign.getId()))
                .extracting(CampaignRecipient::getPhone)
                .containsExactly("919877700001", "919877700003");
    }
}
