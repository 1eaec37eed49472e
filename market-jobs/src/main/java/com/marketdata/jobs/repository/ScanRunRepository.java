package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.ScanRun;
import com.marketdata.jobs.domain.ScanStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for ScanRun entity.
 * Counter updates are single-row UPDATE statements so that concurrent
 * increments never work from a stale loaded copy.
 */
@Repository
public interface ScanRunRepository extends JpaRepository<ScanRun, Long> {

    List<ScanRun> findAllByOrderByStartedAtDescIdDesc(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.symbolsRequested = :count WHERE s.id = :id")
    int setSymbolsRequested(@Param("id") Long id, @Param("count") int count);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.symbolsFetched = s.symbolsFetched + 1 WHERE s.id = :id")
    int incrementSymbolsFetched(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.errorCount = s.errorCount + 1 WHERE s.id = :id")
    int incrementErrorCount(@Param("id") Long id);

    /**
     * Decrease the error counter, never below zero.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.errorCount = CASE WHEN s.errorCount > :by THEN s.errorCount - :by ELSE 0 END "
            + "WHERE s.id = :id")
    int decrementErrorCount(@Param("id") Long id, @Param("by") int by);

    /**
     * Close a scan that is still in {@code from}. A scan already closed by
     * someone else is left untouched.
     *
     * @return 1 if the scan was closed, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.status = :status, s.completedAt = :completedAt "
            + "WHERE s.id = :id AND s.status = :from")
    int finish(@Param("id") Long id, @Param("from") ScanStatus from, @Param("status") ScanStatus status,
            @Param("completedAt") LocalDateTime completedAt);

    /**
     * Move every scan in {@code from} to {@code status} without touching its counters.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScanRun s SET s.status = :status, s.completedAt = :completedAt WHERE s.status = :from")
    int closeAllIn(@Param("from") ScanStatus from, @Param("status") ScanStatus status,
            @Param("completedAt") LocalDateTime completedAt);

    @Query("SELECT s.id FROM ScanRun s ORDER BY s.startedAt DESC, s.id DESC")
    List<Long> findIdsNewestFirst(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanRun s WHERE s.id NOT IN :keepIds")
    int deleteByIdNotIn(@Param("keepIds") Collection<Long> keepIds);
}
