package com.aigreentick.services.marketing.campaign.repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.enums.CampaignStatus;
import com.aigreentick.services.marketing.campaign.model.Campaign;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findByStatusOrderByPriorityAscCreatedAtAscIdAsc(CampaignStatus status);

    List<Campaign> findByStatusOrderByPriorityAscCreatedAtAscIdAsc(CampaignStatus status, Pageable pageable);

    List<Campaign> findAllByOrderByPriorityAscCreatedAtAscIdAsc(Pageable pageable);

    /**
     * Conditional status change. Returns 0 when the campaign is missing or not in one of {@code from}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = :to,
                    c.updatedAt = :now
                WHERE c.id = :id
                  AND c.status IN :from
            """)
    int transition(
            @Param("id") Long id,
            @Param("from") Collection<CampaignStatus> from,
            @Param("to") CampaignStatus to,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = com.aigreentick.services.marketing.campaign.enums.CampaignStatus.ACTIVE,
                    c.startDate = :startDate,
                    c.activatedAt = :now,
                    c.updatedAt = :now
                WHERE c.id = :id
                  AND c.status = com.aigreentick.services.marketing.campaign.enums.CampaignStatus.DRAFT
            """)
    int activate(
            @Param("id") Long id,
            @Param("startDate") LocalDate startDate,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = com.aigreentick.services.marketing.campaign.enums.CampaignStatus.COMPLETED,
                    c.completedAt = :now,
                    c.updatedAt = :now
                WHERE c.id = :id
                  AND c.status = com.aigreentick.services.marketing.campaign.enums.CampaignStatus.ACTIVE
            """)
    int complete(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Query("SELECT c.status FROM Campaign c WHERE c.id = :id")
    CampaignStatus findStatusById(@Param("id") Long id);
}
