package org.theridian.service;

import lombok.extern.slf4j.Slf4j;
import org.theridian.models.dto.HealthResponse;
import org.theridian.service.jobs.JobQueue;
import org.theridian.service.jobs.QueueStats;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Probes the database, the cache and the job worker pool. Each probe fails independently; only
 * the database and the cache decide the overall status.
 */
@Slf4j
@Service
public class HealthService {

    static final String HEALTHY = "healthy";
    static final String UNHEALTHY = "unhealthy";
    static final String CACHE_PROBE_KEY = "health_check";

    private final JdbcTemplate jdbcTemplate;
    private final StringRedisTemplate redisTemplate;
    private final JobQueue jobQueue;
    private final Clock clock;
    private final String version;
    private final Instant startedAt;

    public HealthService(JdbcTemplate jdbcTemplate,
                         StringRedisTemplate redisTemplate,
                         JobQueue jobQueue,
                         Clock clock,
                         @Value("${app.version:1.0.0}") String version) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.jobQueue = jobQueue;
        this.clock = clock;
        this.version = version;
        this.startedAt = clock.instant();
    }

    public HealthResponse check() {
        boolean database = checkDatabase();
        boolean cache = checkCache();
        boolean worker = checkWorker();

        Instant now = clock.instant();
        return new HealthResponse(
                database && cache ? HEALTHY : UNHEALTHY,
                now,
                version,
                database,
                cache,
                worker,
                Duration.between(startedAt, now).toSeconds()
        );
    }

    boolean checkDatabase() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (RuntimeException exception) {
            log.error("Database health check failed: {}", exception.getMessage());
            return false;
        }
    }

    boolean checkCache() {
        try {
            redisTemplate.opsForValue().set(CACHE_PROBE_KEY, "ok", Duration.ofSeconds(30));
            return "ok".equals(redisTemplate.opsForValue().get(CACHE_PROBE_KEY));
        } catch (RuntimeException exception) {
            log.error("Cache health check failed: {}", exception.getMessage());
            return false;
        }
    }

    boolean checkWorker() {
        try {
            QueueStats stats = jobQueue.stats();
            return stats.healthy();
        } catch (RuntimeException exception) {
            log.error("Worker health check failed: {}", exception.getMessage());
            return false;
        }
    }
}
