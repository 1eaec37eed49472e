package com.marketdata.jobs.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static job chain: job name to the job started after it completes.
 */
@Component
@ConfigurationProperties(prefix = "jobs.chain")
@Data
public class ChainProperties {

    private Map<String, Edge> edges = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Edge {
        private String next;
        private boolean weekdayOnly;
        /** Skip the edge when the local time is past this hour (HH:00). */
        private Integer maxHour;
        /** Restrict the edge to these days; empty means any day. */
        private Set<DayOfWeek> daysOfWeek;
    }
}
