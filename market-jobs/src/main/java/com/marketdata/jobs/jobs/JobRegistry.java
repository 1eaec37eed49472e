package com.marketdata.jobs.jobs;

import com.marketdata.jobs.exception.JobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lookup of job bodies by name, built from every {@link ScheduledJob} bean.
 */
@Component
@Slf4j
public class JobRegistry {

    private final Map<String, ScheduledJob> jobs = new TreeMap<>();

    public JobRegistry(List<ScheduledJob> scheduledJobs) {
        for (ScheduledJob job : scheduledJobs) {
            ScheduledJob previous = jobs.putIfAbsent(job.name(), job);
            if (previous != null) {
                throw new IllegalStateException("Duplicate job name: " + job.name());
            }
        }
        log.info("Registered {} jobs: {}", jobs.size(), jobs.keySet());
    }

    public Optional<ScheduledJob> find(String jobName) {
        return Optional.ofNullable(jobs.get(jobName));
    }

    /**
     * @throws JobNotFoundException if no job has this name
     */
    public ScheduledJob require(String jobName) {
        return find(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(jobs.keySet());
    }
}
