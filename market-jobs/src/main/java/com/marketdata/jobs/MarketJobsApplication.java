package com.marketdata.jobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the market-data jobs service.
 * Runs the job scheduler, the EOD scan engine and the admin REST surface
 * in a single process.
 */
@SpringBootApplication
public class MarketJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketJobsApplication.class, args);
    }

}
