package com.aigreentick.services.marketing.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;

/**
 * One (campaign, phone) send. Rows are never deleted; they are the audit trail of a campaign.
 */
@Entity
@Table(
    name = "campaign_recipients",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_campaign_recipient", columnNames = {"campaign_id", "phone"})
    },
    indexes = {
        @Index(name = "idx_recipients_due", columnList = "campaign_id, status, scheduled_date"),
        @Index(name = "idx_recipients_provider_message_id", columnList = "provider_message_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignRecipient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(nullable = false, length = 20)
    private String phone;

    @Column(name = "scheduled_date")
    private LocalDate scheduledDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RecipientStatus status = RecipientStatus.PENDING;

    @Column(name = "provider_message_id", length = 128)
    private String providerMessageId;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Column(name = "claim_token", length = 36)
    private String claimToken;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }
}
