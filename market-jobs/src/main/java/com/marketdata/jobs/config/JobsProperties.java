package com.marketdata.jobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Typed view of the {@code jobs.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "jobs")
@Data
public class JobsProperties {

    private String timezone = "America/Chicago";
    private History history = new History();
    private MarketHours marketHours = new MarketHours();
    private Scheduler scheduler = new Scheduler();
    private Scan scan = new Scan();
    private Lock lock = new Lock();
    private Upstream upstream = new Upstream();
    private Analytics analytics = new Analytics();

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class History {
        private int keep = 5;
    }

    @Data
    public static class MarketHours {
        private int openHour = 8;
        private int openMinute = 30;
        private int closeHour = 15;
        private int closeMinute = 0;
        private int tradingDayCutoffHour = 16;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int poolSize = 4;
        private int misfireGraceSeconds = 300;
    }

    @Data
    public static class Scan {
        private int workers = 5;
        private int maxRps = 3;
        private int batchSize = 100;
        private int maxSymbols = 0;
        private int retryWorkers = 3;
        private int retryMaxRps = 1;
        private Duration taskTimeout = Duration.ofSeconds(30);
        private int keepRuns = 5;
        private String source = "schwab";
    }

    @Data
    public static class Lock {
        private LockBackend backend = LockBackend.MEMORY;
        private Duration ttl = Duration.ofHours(6);

        public enum LockBackend {
            MEMORY, REDIS
        }
    }

    @Data
    public static class Upstream {
        private String baseUrl = "http://localhost:8081";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Analytics {
        private String baseUrl = "http://localhost:8082";
    }
}
