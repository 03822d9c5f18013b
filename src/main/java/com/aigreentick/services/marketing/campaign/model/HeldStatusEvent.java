package com.aigreentick.services.marketing.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.marketing.campaign.enums.DeliveryEventType;

/**
 * A provider status event that arrived before the matching send was recorded.
 */
@Entity
@Table(
    name = "held_status_events",
    indexes = {
        @Index(name = "idx_held_provider_message_id", columnList = "provider_message_id"),
        @Index(name = "idx_held_next_attempt", columnList = "next_attempt_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeldStatusEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_message_id", nullable = false, length = 128)
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private DeliveryEventType eventType;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "first_seen_at", nullable = false)
    private LocalDateTime firstSeenAt;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;
}
