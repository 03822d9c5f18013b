package com.aigreentick.services.marketing.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.domain.Persistable;

/**
 * Messages sent on one calendar day across all campaigns. One row per date.
 */
@Entity
@Table(name = "daily_quota")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyQuota implements Persistable<LocalDate> {

    @Id
    @Column(name = "quota_date")
    private LocalDate quotaDate;

    @Column(name = "messages_sent", nullable = false)
    @Builder.Default
    private Integer messagesSent = 0;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Transient
    @Builder.Default
    private boolean fresh = true;

    public static DailyQuota open(LocalDate date, LocalDateTime now) {
        return DailyQuota.builder()
                .quotaDate(date)
                .messagesSent(0)
                .updatedAt(now)
                .build();
    }

    @Override
    public LocalDate getId() {
        return quotaDate;
    }

    // Assigned key: without this, save() would merge instead of insert
    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        fresh = false;
    }
}
