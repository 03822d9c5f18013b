package com.aigreentick.services.marketing.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.domain.Persistable;

/**
 * Sends reserved by one campaign on one calendar day. Bounded by the campaign's effective daily cap.
 */
@Entity
@Table(name = "campaign_daily_sends")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignDailySend implements Persistable<CampaignDailySend.Key> {

    @EmbeddedId
    private Key key;

    @Column(name = "messages_sent", nullable = false)
    @Builder.Default
    private Integer messagesSent = 0;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Transient
    @Builder.Default
    private boolean fresh = true;

    public static CampaignDailySend open(Long campaignId, LocalDate date, LocalDateTime now) {
        return CampaignDailySend.builder()
                .key(new Key(campaignId, date))
                .messagesSent(0)
                .updatedAt(now)
                .build();
    }

    @Override
    public Key getId() {
        return key;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        fresh = false;
    }

    @Embeddable
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {

        @Column(name = "campaign_id", nullable = false)
        private Long campaignId;

        @Column(name = "send_date", nullable = false)
        private LocalDate sendDate;
    }
}
