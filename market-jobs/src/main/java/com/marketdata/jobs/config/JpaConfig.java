package com.marketdata.jobs.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for job configuration, run history, scan and price tables.
 * Auditing stamps created/updated timestamps on job configurations.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.marketdata.jobs.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
