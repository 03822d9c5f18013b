package com.aigreentick.services.marketing.campaign.repository;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.model.CampaignDailySend;

@Repository
public interface CampaignDailySendRepository extends JpaRepository<CampaignDailySend, CampaignDailySend.Key> {

    /**
     * Reserves one send of {@code campaignId} on {@code date} while the count is below {@code cap}.
     *
     * @return 1 when reserved, 0 when the cap is reached or the row does not exist
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignDailySend s
                SET s.messagesSent = s.messagesSent + 1,
                    s.updatedAt = :now
                WHERE s.key.campaignId = :campaignId
                  AND s.key.sendDate = :date
                  AND s.messagesSent < :cap
            """)
    int tryIncrement(
            @Param("campaignId") Long campaignId,
            @Param("date") LocalDate date,
            @Param("cap") int cap,
            @Param("now") LocalDateTime now);

    /**
     * Gives back a reservation whose message was never accepted by the provider.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignDailySend s
                SET s.messagesSent = s.messagesSent - 1,
                    s.updatedAt = :now
                WHERE s.key.campaignId = :campaignId
                  AND s.key.sendDate = :date
                  AND s.messagesSent > 0
            """)
    int decrement(
            @Param("campaignId") Long campaignId,
            @Param("date") LocalDate date,
            @Param("now") LocalDateTime now);

    @Query("""
                SELECT s.messagesSent FROM CampaignDailySend s
                WHERE s.key.campaignId = :campaignId
                  AND s.key.sendDate = :date
            """)
    Integer findMessagesSent(@Param("campaignId") Long campaignId, @Param("date") LocalDate date);
}
