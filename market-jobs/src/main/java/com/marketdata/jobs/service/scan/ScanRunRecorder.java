package com.marketdata.jobs.service.scan;

import com.marketdata.jobs.domain.ScanError;
import com.marketdata.jobs.domain.ScanErrorType;
import com.marketdata.jobs.domain.ScanRun;
import com.marketdata.jobs.domain.ScanStatus;
import com.marketdata.jobs.exception.ScanNotFoundException;
import com.marketdata.jobs.repository.ScanErrorRepository;
import com.marketdata.jobs.repository.ScanRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Persistence of scan runs and their diagnostics.
 * Every write commits on its own so progress is visible while a scan runs
 * and a failure on one symbol never rolls back another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanRunRecorder {

    private final ScanRunRepository scanRunRepository;
    private final ScanErrorRepository scanErrorRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ScanRun create(String scanDate) {
        ScanRun scan = scanRunRepository.saveAndFlush(ScanRun.builder()
                .status(ScanStatus.RUNNING)
                .scanDate(scanDate)
                .startedAt(now())
                .build());
        log.info("Scan {} created for {}", scan.getId(), scanDate);
        return scan;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void setRequested(Long scanId, int count) {
        scanRunRepository.setSymbolsRequested(scanId, count);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFetched(Long scanId) {
        scanRunRepository.incrementSymbolsFetched(scanId);
    }

    /**
     * Insert a diagnostic row and bump the scan's error counter.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordError(Long scanId, String symbol, ScanErrorType type, String message, Integer httpStatus) {
        scanErrorRepository.save(ScanError.builder()
                .scanRun(scanRunRepository.getReferenceById(scanId))
                .symbol(symbol)
                .errorType(type)
                .errorMessage(message)
                .httpStatus(httpStatus)
                .occurredAt(now())
                .build());
        scanRunRepository.incrementErrorCount(scanId);
    }

    /**
     * Remove a symbol's provider errors after a successful retry and lower
     * the error counter by the number of rows removed.
     *
     * @return number of rows removed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int clearProviderErrors(Long scanId, String symbol) {
        int deleted = scanErrorRepository.deleteBySymbol(scanId, symbol, ScanErrorType.PROVIDER_ERROR);
        if (deleted > 0) {
            scanRunRepository.decrementErrorCount(scanId, deleted);
        }
        return deleted;
    }

    /**
     * Close a RUNNING scan. Terminal states are final: a scan already closed
     * by the stuck-run cleanup keeps its status.
     *
     * @return true if this call closed the scan
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean finish(Long scanId, ScanStatus status) {
        int changed = scanRunRepository.finish(scanId, ScanStatus.RUNNING, status, now());
        if (changed == 0) {
            log.warn("Scan {} was already closed, not marking it {}", scanId, status);
            return false;
        }
        log.info("Scan {} finished as {}", scanId, status);
        return true;
    }

    /**
     * Fail every scan still marked RUNNING.
     *
     * @return number of scans changed
     */
    @Transactional
    public int failAllRunning() {
        int failed = scanRunRepository.closeAllIn(ScanStatus.RUNNING, ScanStatus.FAILED, now());
        if (failed > 0) {
            log.warn("Marked {} dangling scans as failed", failed);
        }
        return failed;
    }

    /**
     * Keep the {@code keep} most recent scans, deleting older ones with their errors.
     *
     * @return number of scans deleted
     */
    @Transactional
    public int pruneScans(int keep) {
        if (keep < 1) {
            throw new IllegalArgumentException("keep must be at least 1");
        }
        List<Long> keepIds = scanRunRepository.findIdsNewestFirst(PageRequest.of(0, keep));
        if (keepIds.isEmpty()) {
            return 0;
        }
        int errorsDeleted = scanErrorRepository.deleteByScanRunIdNotIn(keepIds);
        int scansDeleted = scanRunRepository.deleteByIdNotIn(keepIds);
        if (scansDeleted > 0) {
            log.info("Pruned {} old scans and {} of their error rows", scansDeleted, errorsDeleted);
        }
        return scansDeleted;
    }

    /**
     * @throws ScanNotFoundException if the scan does not exist
     */
    @Transactional(readOnly = true)
    public ScanRun require(Long scanId) {
        return scanRunRepository.findById(scanId).orElseThrow(() -> new ScanNotFoundException(scanId));
    }

    @Transactional(readOnly = true)
    public List<ScanRun> recent(int limit) {
        return scanRunRepository.findAllByOrderByStartedAtDescIdDesc(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<ScanError> errors(Long scanId, int limit) {
        return scanErrorRepository.findByScanRunId(scanId, PageRequest.of(0, limit));
    }

    /**
     * Provider errors of a scan in the transient class (no status, 401, 429, 5xx).
     */
    @Transactional(readOnly = true)
    public List<ScanError> transientErrors(Long scanId) {
        return scanErrorRepository.findTransientErrors(scanId, ScanErrorType.PROVIDER_ERROR);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
