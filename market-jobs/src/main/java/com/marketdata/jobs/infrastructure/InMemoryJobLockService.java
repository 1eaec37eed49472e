package com.marketdata.jobs.infrastructure;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local job locks.
 * Locks are not owned by a thread: the run that took the lock may release it
 * from whichever pool thread finishes the job.
 */
@Slf4j
public class InMemoryJobLockService implements JobLockService {

    private final Map<String, Instant> held = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String jobName) {
        boolean acquired = held.putIfAbsent(jobName, Instant.now()) == null;
        if (!acquired) {
            log.debug("Lock for {} already held since {}", jobName, held.get(jobName));
        }
        return acquired;
    }

    @Override
    public void release(String jobName) {
        if (held.remove(jobName) == null) {
            log.warn("Released lock for {} that was not held", jobName);
        }
    }

    @Override
    public boolean isLocked(String jobName) {
        return held.containsKey(jobName);
    }
}
