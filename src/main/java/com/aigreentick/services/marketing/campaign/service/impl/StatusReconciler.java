package com.aigreentick.services.marketing.campaign.service.impl;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.aigreentick.services.marketing.campaign.dto.HeldReplaySummary;
import com.aigreentick.services.marketing.campaign.enums.DeliveryEventType;
import com.aigreentick.services.marketing.campaign.enums.ReconcileOutcome;
import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;
import com.aigreentick.services.marketing.campaign.model.HeldStatusEvent;
import com.aigreentick.services.marketing.campaign.repository.CampaignRecipientRepository;
import com.aigreentick.services.marketing.campaign.repository.HeldStatusEventRepository;
import com.aigreentick.services.marketing.config.CampaignProperties;
import com.aigreentick.services.marketing.kafka.event.CampaignFailureEvent;
import com.aigreentick.services.marketing.kafka.event.DeliveryStatusEvent;
import com.aigreentick.services.marketing.kafka.producer.CampaignFailureProducer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies provider delivery, read and failure events to recipient rows.
 *
 * Updates are conditional on the status that was read, so duplicates and late events never
 * move a recipient backwards. An event for a message id that has no recipient yet is held and
 * replayed when the send is recorded, or periodically until it ages out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusReconciler {

    static final int MAX_APPLY_ATTEMPTS = 3;

    private final CampaignRecipientRepository recipientRepository;
    private final HeldStatusEventRepository heldStatusEventRepository;
    private final CampaignLifecycleServiceImpl lifecycleService;
    private final CampaignFailureProducer failureProducer;
    private final CampaignProperties properties;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException when the event has no message id or an unknown type
     */
    public ReconcileOutcome reconcile(DeliveryStatusEvent event) {
        if (event.getProviderMessageId() == null || event.getProviderMessageId().isBlank()) {
            throw new IllegalArgumentException("Status event has no provider message id");
        }
        DeliveryEventType type = DeliveryEventType.fromValue(event.getEventType());
        LocalDateTime occurredAt = occurredAt(event.getTimestamp());

        Optional<CampaignRecipient> recipient = recipientRepository.findByProviderMessageId(event.getProviderMessageId());
        if (recipient.isEmpty()) {
            hold(event.getProviderMessageId(), type, occurredAt, event.getFailureReason());
            return ReconcileOutcome.HELD;
        }
        return apply(recipient.get(), type, occurredAt, event.getFailureReason());
    }

    /**
     * Applies every held event for a message id that now has a recipient.
     *
     * @return number of held events consumed
     */
    public int replayHeld(String providerMessageId) {
        List<HeldStatusEvent> held = heldStatusEventRepository.findByProviderMessageIdOrderByOccurredAtAscIdAsc(providerMessageId);
        if (held.isEmpty()) {
            return 0;
        }

        int consumed = 0;
        for (HeldStatusEvent event : held) {
            Optional<CampaignRecipient> recipient = recipientRepository.findByProviderMessageId(providerMessageId);
            if (recipient.isEmpty()) {
                break;
            }
            ReconcileOutcome outcome = apply(recipient.get(), event.getEventType(), event.getOccurredAt(), event.getFailureReason());
            heldStatusEventRepository.delete(event);
            consumed++;
            log.info("Held status event replayed. providerMessageId={} type={} outcome={}",
                    providerMessageId, event.getEventType().getValue(), outcome);
        }
        return consumed;
    }

    /**
     * Retries held events whose next attempt is due. Events past the attempt or age limit are
     * dropped as mismatches and sent to the dead letter topic.
     */
    public HeldReplaySummary retryHeldEvents() {
        LocalDateTime now = LocalDateTime.now(clock);
        CampaignProperties.Reconcile config = properties.getReconcile();
        List<HeldStatusEvent> ready = heldStatusEventRepository.findReady(now, PageRequest.of(0, config.getHeldBatchSize()));

        int applied = 0;
        int dropped = 0;
        int stillHeld = 0;
        for (HeldStatusEvent event : ready) {
            switch (retryHeld(event, now, config)) {
                case APPLIED -> applied++;
                case DROPPED -> dropped++;
                default -> stillHeld++;
            }
        }

        if (!ready.isEmpty()) {
            log.info("Held status events processed. applied={} dropped={} stillHeld={}", applied, dropped, stillHeld);
        }
        return new HeldReplaySummary(applied, dropped, stillHeld);
    }

    private ReconcileOutcome retryHeld(HeldStatusEvent event, LocalDateTime now, CampaignProperties.Reconcile config) {
        Optional<CampaignRecipient> recipient = recipientRepository.findByProviderMessageId(event.getProviderMessageId());
        if (recipient.isPresent()) {
            apply(recipient.get(), event.getEventType(), event.getOccurredAt(), event.getFailureReason());
            heldStatusEventRepository.delete(event);
            return ReconcileOutcome.APPLIED;
        }

        int attempts = event.getAttempts() + 1;
        boolean expired = attempts >= config.getHeldMaxAttempts()
                || !event.getFirstSeenAt().plus(config.getHeldMaxAge()).isAfter(now);
        if (!expired) {
            event.setAttempts(attempts);
            event.setNextAttemptAt(now.plus(config.getHeldRetryDelay()));
            heldStatusEventRepository.save(event);
            return ReconcileOutcome.HELD;
        }

        heldStatusEventRepository.delete(event);
        log.warn("Dropping status event for unknown message. providerMessageId={} type={} attempts={} firstSeenAt={}",
                event.getProviderMessageId(), event.getEventType().getValue(), attempts, event.getFirstSeenAt());
        failureProducer.publish(CampaignFailureEvent.statusEventDropped(
                event.getProviderMessageId(),
                event.getEventType().getValue(),
                "No recipient matched after " + attempts + " attempts",
                clock.millis()));
        return ReconcileOutcome.DROPPED;
    }

    private ReconcileOutcome apply(CampaignRecipient recipient, DeliveryEventType type,
            LocalDateTime occurredAt, String failureReason) {

        CampaignRecipient current = recipient;
        for (int attempt = 1; attempt <= MAX_APPLY_ATTEMPTS; attempt++) {
            RecipientStatus from = current.getStatus();
            Optional<RecipientStatus> next = StatusTransitions.next(from, type);
            if (next.isEmpty()) {
                log.debug("Status event ignored. recipientId={} status={} event={}",
                        current.getId(), from.getValue(), type.getValue());
                return ReconcileOutcome.IGNORED;
            }

            RecipientStatus to = next.get();
            int updated = recipientRepository.advanceStatus(
                    current.getId(),
                    from,
                    to,
                    to == RecipientStatus.DELIVERED || to == RecipientStatus.READ ? occurredAt : null,
                    to == RecipientStatus.READ ? occurredAt : null,
                    to == RecipientStatus.FAILED ? occurredAt : null,
                    to == RecipientStatus.FAILED ? failureReason : null,
                    LocalDateTime.now(clock));

            if (updated == 1) {
                log.debug("Recipient status advanced. recipientId={} {} -> {}", current.getId(), from.getValue(), to.getValue());
                if (to.isTerminal()) {
                    lifecycleService.completeIfFinished(current.getCampaignId());
                }
                return ReconcileOutcome.APPLIED;
            }

            // status changed underneath us; decide again on the fresh row
            Optional<CampaignRecipient> reread = recipientRepository.findById(current.getId());
            if (reread.isEmpty()) {
                return ReconcileOutcome.IGNORED;
            }
            current = reread.get();
        }

        log.warn("Status event not applied after {} attempts. recipientId={} event={}",
                MAX_APPLY_ATTEMPTS, recipient.getId(), type.getValue());
        return ReconcileOutcome.IGNORED;
    }

    private void hold(String providerMessageId, DeliveryEventType type, LocalDateTime occurredAt, String failureReason) {
        LocalDateTime now = LocalDateTime.now(clock);
        heldStatusEventRepository.save(HeldStatusEvent.builder()
                .providerMessageId(providerMessageId)
                .eventType(type)
                .occurredAt(occurredAt)
                .failureReason(failureReason)
                .attempts(0)
                .firstSeenAt(now)
                .nextAttemptAt(now.plus(properties.getReconcile().getHeldRetryDelay()))
                .build());
        log.info("Status event held: no recipient yet. providerMessageId={} type={}", providerMessageId, type.getValue());
    }

    private LocalDateTime occurredAt(Long epochSeconds) {
        if (epochSeconds == null) {
            return LocalDateTime.now(clock);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), clock.getZone());
    }
}
