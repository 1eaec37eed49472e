package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.ScanError;
import com.marketdata.jobs.domain.ScanErrorType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for ScanError entity.
 */
@Repository
public interface ScanErrorRepository extends JpaRepository<ScanError, Long> {

    /**
     * Find the diagnostics of a scan, newest first.
     *
     * @param scanRunId the scan id
     * @param pageable  page limiting the number of rows
     * @return list of error rows
     */
    @Query("SELECT e FROM ScanError e WHERE e.scanRun.id = :scanRunId ORDER BY e.occurredAt DESC, e.id DESC")
    List<ScanError> findByScanRunId(@Param("scanRunId") Long scanRunId, Pageable pageable);

    /**
     * Find provider errors of a scan whose upstream status marks them as transient:
     * no status, 401, 429 or any 5xx.
     *
     * @param scanRunId the scan id
     * @param type      the provider error type
     * @return list of retry candidates
     */
    @Query("SELECT e FROM ScanError e WHERE e.scanRun.id = :scanRunId AND e.errorType = :type "
            + "AND (e.httpStatus IS NULL OR e.httpStatus = 401 OR e.httpStatus = 429 OR e.httpStatus >= 500) "
            + "ORDER BY e.id")
    List<ScanError> findTransientErrors(@Param("scanRunId") Long scanRunId, @Param("type") ScanErrorType type);

    long countByScanRun_IdAndSymbol(Long scanRunId, String symbol);

    /**
     * Delete the rows of one type recorded for a symbol in a scan.
     *
     * @return number of rows deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanError e WHERE e.scanRun.id = :scanRunId AND e.symbol = :symbol AND e.errorType = :type")
    int deleteBySymbol(@Param("scanRunId") Long scanRunId, @Param("symbol") String symbol,
            @Param("type") ScanErrorType type);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScanError e WHERE e.scanRun.id NOT IN :keepIds")
    int deleteByScanRunIdNotIn(@Param("keepIds") Collection<Long> keepIds);
}
