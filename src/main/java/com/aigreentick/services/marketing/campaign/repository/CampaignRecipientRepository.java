package com.aigreentick.services.marketing.campaign.repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;
import com.aigreentick.services.marketing.campaign.model.CampaignRecipient;

@Repository
public interface CampaignRecipientRepository extends JpaRepository<CampaignRecipient, Long> {

    Optional<CampaignRecipient> findByProviderMessageId(String providerMessageId);

    Optional<CampaignRecipient> findByCampaignIdAndPhone(Long campaignId, String phone);

    List<CampaignRecipient> findByCampaignIdOrderByIdAsc(Long campaignId);

    List<CampaignRecipient> findByCampaignIdAndScheduledDateIsNullOrderByIdAsc(Long campaignId);

    long countByCampaignId(Long campaignId);

    long countByCampaignIdAndStatusIn(Long campaignId, Collection<RecipientStatus> statuses);

    @Query("SELECT r.phone FROM CampaignRecipient r WHERE r.campaignId = :campaignId")
    List<String> findPhonesByCampaignId(@Param("campaignId") Long campaignId);

    /**
     * Pending rows due now with an id above {@code afterId}, in insertion order. Rows waiting
     * on a retry backoff are skipped until their next attempt time passes.
     */
    @Query("""
                SELECT r FROM CampaignRecipient r
                WHERE r.campaignId = :campaignId
                  AND r.id > :afterId
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
                  AND r.scheduledDate <= :today
                  AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now)
                ORDER BY r.id ASC
            """)
    List<CampaignRecipient> findDue(
            @Param("campaignId") Long campaignId,
            @Param("afterId") Long afterId,
            @Param("today") LocalDate today,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    @Query("""
                SELECT r.status, COUNT(r) FROM CampaignRecipient r
                WHERE r.campaignId = :campaignId
                GROUP BY r.status
            """)
    List<Object[]> countByStatus(@Param("campaignId") Long campaignId);

    /**
     * Recipients the provider accepted that later reported a delivery failure.
     */
    @Query("""
                SELECT COUNT(r) FROM CampaignRecipient r
                WHERE r.campaignId = :campaignId
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.FAILED
                  AND r.sentAt IS NOT NULL
            """)
    long countFailedAfterSend(@Param("campaignId") Long campaignId);

    /**
     * Takes a lease on a pending row. A lease older than {@code staleBefore} is treated as
     * abandoned by a crashed run and may be taken over.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.claimToken = :token,
                    r.claimedAt = :now,
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
                  AND (r.claimToken IS NULL OR r.claimedAt < :staleBefore)
            """)
    int claim(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("now") LocalDateTime now,
            @Param("staleBefore") LocalDateTime staleBefore);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.SENT,
                    r.providerMessageId = :providerMessageId,
                    r.sentAt = :now,
                    r.claimToken = NULL,
                    r.claimedAt = NULL,
                    r.nextAttemptAt = NULL,
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.claimToken = :token
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
            """)
    int markSent(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("providerMessageId") String providerMessageId,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.retryCount = r.retryCount + 1,
                    r.scheduledDate = :scheduledDate,
                    r.nextAttemptAt = :nextAttemptAt,
                    r.failureReason = :reason,
                    r.claimToken = NULL,
                    r.claimedAt = NULL,
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.claimToken = :token
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
            """)
    int rescheduleRetry(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("scheduledDate") LocalDate scheduledDate,
            @Param("nextAttemptAt") LocalDateTime nextAttemptAt,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.FAILED,
                    r.retryCount = r.retryCount + 1,
                    r.failedAt = :now,
                    r.failureReason = :reason,
                    r.claimToken = NULL,
                    r.claimedAt = NULL,
                    r.nextAttemptAt = NULL,
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.claimToken = :token
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
            """)
    int markFailed(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now);

    /**
     * Releases a lease without consuming a retry and moves the row to {@code scheduledDate}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.scheduledDate = :scheduledDate,
                    r.nextAttemptAt = NULL,
                    r.claimToken = NULL,
                    r.claimedAt = NULL,
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.claimToken = :token
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
            """)
    int deferClaimed(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("scheduledDate") LocalDate scheduledDate,
            @Param("now") LocalDateTime now);

    /**
     * Moves every unclaimed pending row of the given campaigns that is due on or before
     * {@code today} to {@code nextDate}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.scheduledDate = :nextDate,
                    r.nextAttemptAt = NULL,
                    r.updatedAt = :now
                WHERE r.campaignId IN :campaignIds
                  AND r.status = com.aigreentick.services.marketing.campaign.enums.RecipientStatus.PENDING
                  AND r.scheduledDate <= :today
                  AND r.claimToken IS NULL
            """)
    int deferDue(
            @Param("campaignIds") Collection<Long> campaignIds,
            @Param("today") LocalDate today,
            @Param("nextDate") LocalDate nextDate,
            @Param("now") LocalDateTime now);

    /**
     * Applies a reconciled delivery status. Guarded on the status the caller read so that a
     * concurrent update makes this return 0 instead of overwriting it.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE CampaignRecipient r
                SET r.status = :next,
                    r.deliveredAt = COALESCE(r.deliveredAt, :deliveredAt),
                    r.readAt = COALESCE(r.readAt, :readAt),
                    r.failedAt = COALESCE(r.failedAt, :failedAt),
                    r.failureReason = COALESCE(:reason, r.failureReason),
                    r.updatedAt = :now
                WHERE r.id = :id
                  AND r.status = :current
            """)
    int advanceStatus(
            @Param("id") Long id,
            @Param("current") RecipientStatus current,
            @Param("next") RecipientStatus next,
            @Param("deliveredAt") LocalDateTime deliveredAt,
            @Param("readAt") LocalDateTime readAt,
            @Param("failedAt") LocalDateTime failedAt,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now);
}
