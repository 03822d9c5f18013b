package com.aigreentick.services.marketing.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;

@Entity
@Table(
    name = "campaigns",
    indexes = {
        @Index(name = "idx_campaigns_status_priority", columnList = "status, priority, created_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(name = "template_name", nullable = false, length = 100)
    private String templateName;

    @Column(name = "language_code", nullable = false, length = 10)
    private String languageCode;

    // JSON array of body text parameters
    @Column(name = "template_parameters", length = 4000)
    private String templateParameters;

    // JSON audience filter
    @Column(name = "target_audience", length = 4000)
    private String targetAudience;

    @Column(name = "use_target_audience", nullable = false)
    @Builder.Default
    private Boolean useTargetAudience = Boolean.TRUE;

    @Column(name = "daily_send_limit", nullable = false)
    private Integer dailySendLimit;

    // 1 is served first
    @Column(nullable = false)
    private Integer priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private CampaignStatus status = CampaignStatus.DRAFT;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "activated_at")
    private LocalDateTime activatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
