package org.theridian.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineRunLauncher Tests")
class PipelineRunLauncherTest {

    private static final RunRequest DAILY = new RunRequest("daily_etl_2024_05_01", PipelineJob.ETL_PIPELINE,
            Map.of("schedule", "daily"));

    @Mock
    private EtlPipeline pipeline;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private PipelineRunLauncher launcher;

    @BeforeEach
    void setUp() {
        launcher = new PipelineRunLauncher(pipeline, redisTemplate,
                Clock.fixed(Instant.parse("2024-05-01T02:00:00Z"), ZoneOffset.UTC));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("Should launch a run key only once")
    void testLaunch_Dedupes() {
        when(valueOperations.setIfAbsent(eq("pipeline:run-key:daily_etl_2024_05_01"), anyString(),
                eq(PipelineRunLauncher.RUN_KEY_TTL))).thenReturn(true, false);
        PipelineRunResult ok = new PipelineRunResult(DAILY.runKey(), DAILY.job(), true, 1000, null, true, null);
        when(pipeline.run(DAILY.runKey(), DAILY.job())).thenReturn(ok);

        Optional<PipelineRunResult> first = launcher.launch(DAILY);
        Optional<PipelineRunResult> second = launcher.launch(DAILY);

        assertEquals(Optional.of(ok), first);
        assertTrue(second.isEmpty());
        verify(pipeline, times(1)).run(DAILY.runKey(), DAILY.job());
    }

    @Test
    @DisplayName("Should fall back to local dedupe when Redis is down")
    void testLaunch_RedisUnavailable() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), eq(PipelineRunLauncher.RUN_KEY_TTL)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(pipeline.run(DAILY.runKey(), DAILY.job())).thenReturn(
                new PipelineRunResult(DAILY.runKey(), DAILY.job(), true, 10, null, true, null));

        assertTrue(launcher.launch(DAILY).isPresent());
        assertTrue(launcher.launch(DAILY).isEmpty());
    }

    @Test
    @DisplayName("Should turn a crashing run into a failed result")
    void testLaunch_Crash() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), eq(PipelineRunLauncher.RUN_KEY_TTL)))
                .thenReturn(true);
        when(pipeline.run(DAILY.runKey(), DAILY.job())).thenThrow(new IllegalStateException("stage exploded"));

        PipelineRunResult result = launcher.launch(DAILY).orElseThrow();

        assertFalse(result.succeeded());
        assertEquals("stage exploded", result.errorMessage());
    }
}
