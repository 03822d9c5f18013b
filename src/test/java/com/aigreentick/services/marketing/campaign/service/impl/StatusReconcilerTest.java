package com.aigreentick.services.marketing.campaign.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.aigreentick.services.marketing.campaign.dto.HeldReplaySummary;
import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.enums.ReconcileOutcome;
import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.kafka.event.CampaignFailureEvent;
import com.aigreentick.services.marketing.kafka.event.DeliveryStatusEvent;

@DataJpaTest
class StatusReconcilerTest extends CampaignEngineTestSupport {

    private static final String PHONE = "919812340000";
    private static final long DELIVERED_AT = LocalDateTime.of(2025, 6, 1, 9, 5).toEpochSecond(ZoneOffset.UTC);
    private static final long READ_AT = LocalDateTime.of(2025, 6, 1, 9, 10).toEpochSecond(ZoneOffset.UTC);

    @Test
    void statusMovesForwardAndNeverRegresses() {
        Campaign campaign = sentCampaign("wamid.forward");

        assertThat(statusReconciler.reconcile(event("wamid.forward", "delivered", DELIVERED_AT)))
                .isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(statusReconciler.reconcile(event("wamid.forward", "read", READ_AT)))
                .isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(statusReconciler.reconcile(event("wamid.forward", "delivered", DELIVERED_AT)))
                .isEqualTo(ReconcileOutcome.IGNORED);
        assertThat(statusReconciler.reconcile(failed("wamid.forward", "late failure")))
                .isEqualTo(ReconcileOutcome.IGNORED);

        CampaignRecipient recipient = recipient(campaign.getId(), PHONE);
        assertThat(recipient.getStatus()).isEqualTo(RecipientStatus.READ);
        assertThat(recipient.getDeliveredAt()).isEqualTo(LocalDateTime.of(2025, 6, 1, 9, 5));
        assertThat(recipient.getReadAt()).isEqualTo(LocalDateTime.of(2025, 6, 1, 9, 10));
        assertThat(recipient.getFailureReason()).isNull();
    }

    @Test
    void readBeforeDeliveredStillRecordsDelivery() {
        Campaign campaign = sentCampaign("wamid.read-first");

        statusReconciler.reconcile(event("wamid.read-first", "read", READ_AT));
        ReconcileOutcome late = statusReconciler.reconcile(event("wamid.read-first", "delivered", DELIVERED_AT));

        assertThat(late).isEqualTo(ReconcileOutcome.IGNORED);
        CampaignRecipient recipient = recipient(campaign.getId(), PHONE);
        assertThat(recipient.getStatus()).isEqualTo(RecipientStatus.READ);
        assertThat(recipient.getDeliveredAt()).isEqualTo(recipient.getReadAt());
    }

    @Test
    void failureIsRecordedWithReasonAndCompletesTheCampaign() {
        Campaign campaign = sentCampaign("wamid.failed");

        assertThat(statusReconciler.reconcile(failed("wamid.failed", "131026: undeliverable")))
                .isEqualTo(ReconcileOutcome.APPLIED);

        CampaignRecipient recipient = recipient(campaign.getId(), PHONE);
        assertThat(recipient.getStatus()).isEqualTo(RecipientStatus.FAILED);
        assertThat(recipient.getFailureReason()).isEqualTo("131026: undeliverable");
        assertThat(recipient.getFailedAt()).isNotNull();
        assertThat(campaignRepository.findStatusById(campaign.getId())).isEqualTo(CampaignStatus.COMPLETED);
    }

    @Test
    void eventForUnsentMessageIsHeldAndAppliedOnceTheSendIsRecorded() {
        Campaign campaign = manualDraft("early-webhook", 1, 10, List.of(PHONE));
        lifecycleService.activate(campaign.getId(), DAY_ONE);
        gateway.useMessageId(PHONE, "wamid.early");

        ReconcileOutcome outcome = statusReconciler.reconcile(event("wamid.early", "delivered", DELIVERED_AT));

        assertThat(outcome).isEqualTo(ReconcileOutcome.HELD);
        assertThat(heldStatusEventRepository.count()).isEqualTo(1);

        dispatchCoordinator.processToday();

        CampaignRecipient recipient = recipient(campaign.getId(), PHONE);
        assertThat(recipient.getStatus()).isEqualTo(RecipientStatus.DELIVERED);
        assertThat(recipient.getProviderMessageId()).isEqualTo("wamid.early");
        assertThat(heldStatusEventRepository.count()).isZero();
        assertThat(campaignRepository.findStatusById(campaign.getId())).isEqualTo(CampaignStatus.COMPLETED);
    }

    @Test
    void heldEventIsRetriedPeriodically() {
        statusReconciler.reconcile(event("wamid.slow", "read", READ_AT));
        Campaign campaign = sentCampaign("wamid.slow-other");
        CampaignRecipient recipient = recipient(campaign.getId(), PHONE);

        // not due before the retry delay
        assertThat(statusReconciler.retryHeldEvents()).isEqualTo(new HeldReplaySummary(0, 0, 0));

        jdbcTemplate.update("UPDATE campaign_recipients SET provider_message_id = ? WHERE id = ?",
                "wamid.slow", recipient.getId());
        clock.advance(Duration.ofMinutes(2));

        assertThat(statusReconciler.retryHeldEvents()).isEqualTo(new HeldReplaySummary(1, 0, 0));
        assertThat(recipient(campaign.getId(), PHONE).getStatus()).isEqualTo(RecipientStatus.READ);
    }

    @Test
    void heldEventIsDroppedAfterTheAttemptLimit() {
        properties.getReconcile().setHeldMaxAttempts(2);
        properties.getReconcile().setHeldRetryDelay(Duration.ofMinutes(1));
        statusReconciler.reconcile(event("wamid.unknown", "delivered", DELIVERED_AT));

        clock.advance(Duration.ofMinutes(2));
        assertThat(statusReconciler.retryHeldEvents()).isEqualTo(new HeldReplaySummary(0, 0, 1));

        clock.advance(Duration.ofMinutes(2));
        assertThat(statusReconciler.retryHeldEvents()).isEqualTo(new HeldReplaySummary(0, 1, 0));

        assertThat(heldStatusEventRepository.count()).isZero();
        verify(failureProducer).publish(argThat((CampaignFailureEvent e) ->
                e.getKind() == CampaignFailureEvent.Kind.STATUS_EVENT_DROPPED
                        && "wamid.unknown".equals(e.getProviderMessageId())
                        && !e.isRetryable()));
    }

    @Test
    void heldEventIsDroppedOnceTooOld() {
        properties.getReconcile().setHeldMaxAge(Duration.ofMinutes(30));
        statusReconciler.reconcile(event("wamid.stale", "read", READ_AT));

        clock.advance(Duration.ofMinutes(31));

        assertThat(statusReconciler.retryHeldEvents().dropped()).isEqualTo(1);
    }

    @Test
    void malformedEventsAreRejected() {
        assertThatThrownBy(() -> statusReconciler.reconcile(event("wamid.x", "bounced", READ_AT)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> statusReconciler.reconcile(event(" ", "read", READ_AT)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Campaign sentCampaign(String providerMessageId) {
        Campaign campaign = manualDraft("sent-" + providerMessageId, 1, 10, List.of(PHONE));
        lifecycleService.activate(campaign.getId(), DAY_ONE);
        gateway.useMessageId(PHONE, providerMessageId);
        dispatchCoordinator.processToday();
        return campaign;
    }

    private static DeliveryStatusEvent event(String providerMessageId, String type, long timestamp) {
        return DeliveryStatusEvent.builder()
                .providerMessageId(providerMessageId)
                .eventType(type)
                .timestamp(timestamp)
                .build();
    }

    private static DeliveryStatusEvent failed(String providerMessageId, String reason) {
        return DeliveryStatusEvent.builder()
                .providerMessageId(providerMessageId)
                .eventType("failed")
                .timestamp(DELIVERED_AT)
                .failureReason(reason)
                .build();
    }
}
