package com.marketdata.jobs.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis-backed job locks (SET NX with expiry).
 * The TTL bounds how long a crashed process can keep a job locked.
 * Release only deletes the key while it still carries this process's token.
 */
@Slf4j
public class RedisJobLockService implements JobLockService {

    private static final String KEY_PREFIX = "market-jobs:lock:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;
    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    public RedisJobLockService(StringRedisTemplate redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public boolean tryAcquire(String jobName) {
        String token = UUID.randomUUID().toString();
        try {
            // SET NX PX is atomic in Redis
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + jobName, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                tokens.put(jobName, token);
                log.debug("Acquired Redis lock for {}", jobName);
                return true;
            }
            return false;
        } catch (DataAccessException e) {
            log.error("Redis error while locking job {}: {}", jobName, e.getMessage(), e);
            throw new IllegalStateException("Failed to acquire job lock due to Redis error", e);
        }
    }

    @Override
    public void release(String jobName) {
        String token = tokens.remove(jobName);
        if (token == null) {
            log.warn("Released lock for {} that was not held by this process", jobName);
            return;
        }
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(KEY_PREFIX + jobName), token);
            if (deleted == null || deleted == 0L) {
                log.warn("Lock for {} expired or was taken over before release", jobName);
            }
        } catch (DataAccessException e) {
            log.error("Redis error while releasing lock for {}: {}", jobName, e.getMessage(), e);
            throw new IllegalStateException("Failed to release job lock due to Redis error", e);
        }
    }

    @Override
    public boolean isLocked(String jobName) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + jobName));
        } catch (DataAccessException e) {
            log.error("Redis error while checking lock for {}: {}", jobName, e.getMessage(), e);
            throw new IllegalStateException("Failed to read job lock due to Redis error", e);
        }
    }
}
