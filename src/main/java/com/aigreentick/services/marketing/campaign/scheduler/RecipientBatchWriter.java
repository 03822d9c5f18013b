package com.aigreentick.services.marketing.campaign.scheduler;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.IntStream;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.aigreentick.services.marketing.campaign.enums.RecipientStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bulk writes of recipient rows through JDBC batches.
 * The UNIQUE(campaign_id, phone) constraint makes a repeated pair a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientBatchWriter {

    static final int BATCH_SIZE = 500;

    private static final String INSERT_SQL = """
            INSERT INTO campaign_recipients
                (campaign_id, phone, scheduled_date, status, retry_count, created_at, updated_at)
            VALUES (?, ?, ?, ?, 0, ?, ?)
            """;

    private static final String ASSIGN_DATE_SQL = """
            UPDATE campaign_recipients
            SET scheduled_date = ?, updated_at = ?
            WHERE id = ? AND scheduled_date IS NULL
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Inserts pending rows. A null slot date leaves the row unscheduled.
     *
     * @return number of rows actually inserted
     */
    public int insertPending(Long campaignId, List<RecipientSlot> slots, LocalDateTime now) {
        int inserted = 0;
        for (int from = 0; from < slots.size(); from += BATCH_SIZE) {
            List<RecipientSlot> chunk = slots.subList(from, Math.min(from + BATCH_SIZE, slots.size()));
            try {
                inserted += insertChunk(campaignId, chunk, now);
            } catch (DataIntegrityViolationException e) {
                log.warn("Batch insert hit an existing recipient, retrying row by row. campaignId={} size={}",
                        campaignId, chunk.size());
                inserted += insertOneByOne(campaignId, chunk, now);
            }
        }
        log.debug("Inserted {} of {} recipients. campaignId={}", inserted, slots.size(), campaignId);
        return inserted;
    }

    /**
     * Sets the scheduled date of rows that have none yet. {@code ids} and {@code dates} are parallel.
     */
    public int assignDates(List<Long> ids, List<LocalDate> dates, LocalDateTime now) {
        if (ids.isEmpty()) {
            return 0;
        }
        Timestamp ts = Timestamp.valueOf(now);
        int[][] counts = jdbcTemplate.batchUpdate(ASSIGN_DATE_SQL, toIndexed(ids), BATCH_SIZE,
                (ps, index) -> {
                    ps.setDate(1, Date.valueOf(dates.get(index)));
                    ps.setTimestamp(2, ts);
                    ps.setLong(3, ids.get(index));
                });
        return sum(counts);
    }

    private int insertChunk(Long campaignId, List<RecipientSlot> chunk, LocalDateTime now) {
        Timestamp ts = Timestamp.valueOf(now);
        int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                bind(ps, campaignId, chunk.get(i), ts);
            }

            @Override
            public int getBatchSize() {
                return chunk.size();
            }
        });

        int inserted = 0;
        for (int count : counts) {
            // SUCCESS_NO_INFO (-2) still means the row was written
            inserted += count == 0 ? 0 : 1;
        }
        return inserted;
    }

    private int insertOneByOne(Long campaignId, List<RecipientSlot> chunk, LocalDateTime now) {
        Timestamp ts = Timestamp.valueOf(now);
        int inserted = 0;
        for (RecipientSlot slot : chunk) {
            try {
                inserted += jdbcTemplate.update(INSERT_SQL, ps -> bind(ps, campaignId, slot, ts));
            } catch (DuplicateKeyException e) {
                log.debug("Recipient already present, skipped. campaignId={} phone={}", campaignId, slot.phone());
            } catch (DataIntegrityViolationException e) {
                log.warn("Recipient rejected by the database, skipped. campaignId={} phone={} error={}",
                        campaignId, slot.phone(), e.getMostSpecificCause().getMessage());
            }
        }
        return inserted;
    }

    private static void bind(PreparedStatement ps, Long campaignId, RecipientSlot slot, Timestamp ts)
            throws SQLException {
        ps.setLong(1, campaignId);
        ps.setString(2, slot.phone());
        if (slot.scheduledDate() == null) {
            ps.setNull(3, Types.DATE);
        } else {
            ps.setDate(3, Date.valueOf(slot.scheduledDate()));
        }
        ps.setString(4, RecipientStatus.PENDING.name());
        ps.setTimestamp(5, ts);
        ps.setTimestamp(6, ts);
    }

    private static List<Integer> toIndexed(List<Long> ids) {
        return IntStream.range(0, ids.size()).boxed().toList();
    }

    private static int sum(int[][] counts) {
        int total = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                total += count == 0 ? 0 : 1;
            }
        }
        return total;
    }
}
