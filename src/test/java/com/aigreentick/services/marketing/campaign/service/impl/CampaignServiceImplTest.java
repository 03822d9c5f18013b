package com.aigreentick.services.marketing.campaign.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.aigreentick.services.marketing.audience.dto.AudienceFilter;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.exception.CampaignNotFoundException;
import com.aigreentick.services.marketing.exception.CampaignValidationException;
import com.aigreentick.services.marketing.exception.LifecycleViolationException;

@DataJpaTest
class CampaignServiceImplTest extends CampaignEngineTestSupport {

    @Test
    void createsDraftWithDefaults() {
        Campaign campaign = campaignService.createCampaign(request("defaults")
                .targetAudience(AudienceFilter.builder().city("Pune").tags(List.of("vip")).build())
                .build());

        assertThat(campaign.getId()).isNotNull();
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.DRAFT);
        assertThat(campaign.getDailySendLimit()).isEqualTo(250);
        assertThat(campaign.getPriority()).isEqualTo(5);
        assertThat(campaign.getUseTargetAudience()).isTrue();
        assertThat(campaign.getTemplateParameters()).isEqualTo("[\"Summer\",\"20%\"]");
        assertThat(campaign.getTargetAudience()).contains("\"city\":\"Pune\"").contains("\"vip\"");
        assertThat(campaign.getCreatedAt()).isNotNull();
    }

    @Test
    void rejectsInvalidRequestListingEveryProblem() {
        properties.setGlobalDailyCap(100);

        assertThatThrownBy(() -> campaignService.createCampaign(request(" ")
                .templateName("Summer Sale")
                .languageCode("english")
                .dailySendLimit(101)
                .priority(0)
                .templateParameters(List.of("ok", " "))
                .startDate(DAY_ONE.minusDays(1))
                .targetAudience(AudienceFilter.builder().subscription("unsubscribed").build())
                .build()))
                .isInstanceOfSatisfying(CampaignValidationException.class, e -> assertThat(e.getViolations())
                        .hasSize(8)
                        .anyMatch(v -> v.contains("dailySendLimit must be between 1 and 100"))
                        .anyMatch(v -> v.contains("startDate")));

        assertThat(campaignRepository.count()).isZero();
    }

    @Test
    void onlyApprovedTemplatesWhenAListIsConfigured() {
        properties.setApprovedTemplates(List.of("welcome_offer"));

        assertThatThrownBy(() -> campaignService.createCampaign(request("unapproved").build()))
                .isInstanceOf(CampaignValidationException.class)
                .hasMessageContaining("not approved");

        Campaign approved = campaignService.createCampaign(request("approved").templateName("welcome_offer").build());
        assertThat(approved.getTemplateName()).isEqualTo("welcome_offer");
    }

    @Test
    void addRecipientsDeduplicatesAndSkipsExistingPhones() {
        Campaign campaign = campaignService.createCampaign(request("manual").useTargetAudience(false).build());

        int first = campaignService.addRecipients(campaign.getId(),
                List.of("919811111111", " 919811111111 ", "+919822222222"));
        int second = campaignService.addRecipients(campaign.getId(), List.of("919822222222", "+919822222222"));

        assertThat(first).isEqualTo(2);
        assertThat(second).isEqualTo(1);
        assertThat(recipientsOf(campaign.getId()))
                .extracting(CampaignRecipient::getPhone)
                .containsExactly("919811111111", "+919822222222", "919822222222");
        assertThat(recipientsOf(campaign.getId()))
                .allSatisfy(r -> assertThat(r.getScheduledDate()).isNull());
    }

    @Test
    void addRecipientsRejectsMalformedPhones() {
        Campaign campaign = campaignService.createCampaign(request("bad-phones").build());

        assertThatThrownBy(() -> campaignService.addRecipients(campaign.getId(), List.of("919811111111", "call-me")))
                .isInstanceOf(CampaignValidationException.class)
                .hasMessageContaining("call-me");

        assertThat(recipientRepository.countByCampaignId(campaign.getId())).isZero();
    }

    @Test
    void addRecipientsOnlyWhileDraft() {
        Campaign campaign = manualDraft("running", 1, 10, List.of("919811111111"));
        lifecycleService.activate(campaign.getId(), DAY_ONE);

        assertThatThrownBy(() -> campaignService.addRecipients(campaign.getId(), List.of("919833333333")))
                .isInstanceOf(LifecycleViolationException.class)
                .hasMessageContaining("add recipients to");
    }

    @Test
    void listsByPriorityThenCreationTime() {
        Campaign low = draft("low", 9, 10);
        clock.advance(Duration.ofMinutes(1));
        Campaign urgentLater = draft("urgent-later", 1, 10);
        clock.advance(Duration.ofMinutes(1));
        Campaign urgentLatest = draft("urgent-latest", 1, 10);
        lifecycleService.cancel(low.getId());

        assertThat(campaignService.listCampaigns(null, 50))
                .extracting(Campaign::getName)
                .containsExactly("urgent-later", "urgent-latest", "low");
        assertThat(campaignService.listCampaigns(CampaignStatus.DRAFT, 1))
                .extracting(Campaign::getId)
                .containsExactly(urgentLater.getId());
        assertThat(campaignService.listCampaigns(CampaignStatus.CANCELLED, 50))
                .extracting(Campaign::getId)
                .containsExactly(low.getId());
        assertThat(urgentLatest.getId()).isNotNull();
    }

    @Test
    void unknownCampaign() {
        assertThatThrownBy(() -> campaignService.getCampaign(77L))
                .isInstanceOf(CampaignNotFoundException.class)
                .hasMessageContaining("77");
    }
}
