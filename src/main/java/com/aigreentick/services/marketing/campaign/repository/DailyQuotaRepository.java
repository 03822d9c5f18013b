package com.aigreentick.services.marketing.campaign.repository;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.marketing.campaign.model.DailyQuota;

@Repository
public interface DailyQuotaRepository extends JpaRepository<DailyQuota, LocalDate> {

    /**
     * Reserves one send for {@code date}. The cap check and the increment are a single
     * statement, so concurrent callers can never push the counter past {@code cap}.
     *
     * @return 1 when reserved, 0 when the cap is reached or the row does not exist
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE DailyQuota q
                SET q.messagesSent = q.messagesSent + 1,
                    q.updatedAt = :now
                WHERE q.quotaDate = :date
                  AND q.messagesSent < :cap
            """)
    int tryIncrement(
            @Param("date") LocalDate date,
            @Param("cap") int cap,
            @Param("now") LocalDateTime now);

    @Query("SELECT q.messagesSent FROM DailyQuota q WHERE q.quotaDate = :date")
    Integer findMessagesSent(@Param("date") LocalDate date);
}
