package com.marketdata.jobs.config;

import com.marketdata.jobs.infrastructure.InMemoryJobLockService;
import com.marketdata.jobs.infrastructure.JobLockService;
import com.marketdata.jobs.infrastructure.RedisJobLockService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the per-job-name lock backend.
 * {@code jobs.lock.backend=redis} shares locks between processes through Redis,
 * anything else keeps them in memory.
 */
@Configuration
public class LockConfig {

        @Bean
        @ConditionalOnProperty(name = "jobs.lock.backend", havingValue = "redis")
        public JobLockService redisJobLockService(StringRedisTemplate redisTemplate, JobsProperties properties) {
                return new RedisJobLockService(redisTemplate, properties.getLock().getTtl());
        }

        @Bean
        @ConditionalOnMissingBean(JobLockService.class)
        public JobLockService inMemoryJobLockService() {
                return new InMemoryJobLockService();
        }
}
