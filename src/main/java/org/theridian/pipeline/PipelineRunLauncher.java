package org.theridian.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Launches pipeline runs at most once per run key. Keys are claimed in Redis so several instances
 * share the dedupe; when Redis is unreachable the claim falls back to this instance's memory.
 */
@Slf4j
@Component
public class PipelineRunLauncher {

    static final String RUN_KEY_PREFIX = "pipeline:run-key:";
    static final Duration RUN_KEY_TTL = Duration.ofDays(7);

    private final EtlPipeline pipeline;
    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final Set<String> localKeys = ConcurrentHashMap.newKeySet();

    public PipelineRunLauncher(EtlPipeline pipeline, StringRedisTemplate redisTemplate, Clock clock) {
        this.pipeline = pipeline;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    public Optional<PipelineRunResult> launch(RunRequest request) {
        if (!claim(request.runKey())) {
            log.info("Run key {} already launched, skipping", request.runKey());
            return Optional.empty();
        }

        log.info("Launching {} run {} with tags {}", request.job().getValue(), request.runKey(), request.tags());
        PipelineRunResult result;
        try {
            result = pipeline.run(request.runKey(), request.job());
        } catch (RuntimeException exception) {
            log.error("Pipeline run {} crashed", request.runKey(), exception);
            result = PipelineRunResult.failure(request.runKey(), request.job(), 0, exception.getMessage());
        }

        if (result.succeeded()) {
            log.info("Pipeline run {} finished, {} records extracted", request.runKey(), result.recordsExtracted());
        } else {
            log.warn("Pipeline run {} failed: {}", request.runKey(), result.errorMessage());
        }
        return Optional.of(result);
    }

    boolean claim(String runKey) {
        try {
            boolean claimed = Boolean.TRUE.equals(redisTemplate.opsForValue()
                    .setIfAbsent(RUN_KEY_PREFIX + runKey, clock.instant().toString(), RUN_KEY_TTL));
            if (claimed) {
                // remembered locally too, for when Redis drops out later
                localKeys.add(runKey);
            }
            return claimed;
        } catch (DataAccessException exception) {
            log.warn("Run key store unavailable, deduplicating locally: {}", exception.getMessage());
            return localKeys.add(runKey);
        }
    }
}
