package com.aigreentick.services.marketing.campaign.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.marketing.campaign.model.HeldStatusEvent;

@Repository
public interface HeldStatusEventRepository extends JpaRepository<HeldStatusEvent, Long> {

    List<HeldStatusEvent> findByProviderMessageIdOrderByOccurredAtAscIdAsc(String providerMessageId);

    @Query("""
                SELECT h FROM HeldStatusEvent h
                WHERE h.nextAttemptAt <= :now
                ORDER BY h.nextAttemptAt ASC, h.id ASC
            """)
    List<HeldStatusEvent> findReady(@Param("now") LocalDateTime now, Pageable pageable);
}
