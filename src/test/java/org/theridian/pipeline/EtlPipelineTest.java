package org.theridian.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EtlPipeline Tests")
class EtlPipelineTest {

    @Mock
    private RawDataExtractStage extractStage;

    @Mock
    private LoadStage loadStage;

    private CleanDataStage cleanStage;
    private AggregateMetricsStage aggregateStage;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T02:00:00Z"), ZoneOffset.UTC);
        cleanStage = new CleanDataStage(clock);
        aggregateStage = new AggregateMetricsStage(clock);
    }

    @Test
    @DisplayName("Should run every stage for the full pipeline")
    void testRun_Full() {
        when(extractStage.extract()).thenReturn(List.of(
                new RawRecord(1L, "Record_1", 10L, "active"),
                new RawRecord(2L, "Record_2", 20L, "active")));
        when(loadStage.load(any())).thenReturn(true);
        EtlPipeline pipeline = new EtlPipeline(extractStage, cleanStage, aggregateStage, loadStage);

        PipelineRunResult result = pipeline.run("daily_etl_2024_05_01", PipelineJob.ETL_PIPELINE);

        assertTrue(result.succeeded());
        assertTrue(result.loaded());
        assertEquals(2, result.recordsExtracted());
        assertEquals(2, result.metrics().totalRecords());
        assertNull(result.errorMessage());
    }

    @Test
    @DisplayName("Should stop after extraction for the extract-only job")
    void testRun_ExtractOnly() {
        when(extractStage.extract()).thenReturn(List.of(new RawRecord(1L, "Record_1", 10L, "active")));
        EtlPipeline pipeline = new EtlPipeline(extractStage, cleanStage, aggregateStage, loadStage);

        PipelineRunResult result = pipeline.run("extract_2024_05_01_06", PipelineJob.EXTRACT_ONLY);

        assertTrue(result.succeeded());
        assertEquals(1, result.recordsExtracted());
        assertNull(result.metrics());
        verifyNoInteractions(loadStage);
    }

    @Test
    @DisplayName("Should report a validation failure on the result")
    void testRun_ValidationFailure() {
        when(extractStage.extract()).thenReturn(List.of(new RawRecord(null, "orphan", 10L, "active")));
        EtlPipeline pipeline = new EtlPipeline(extractStage, cleanStage, aggregateStage, loadStage);

        PipelineRunResult result = pipeline.run("run-1", PipelineJob.ETL_PIPELINE);

        assertFalse(result.succeeded());
        assertEquals("No records after cleaning", result.errorMessage());
        verifyNoInteractions(loadStage);
    }

    @Test
    @DisplayName("Should mark the run failed when loading fails")
    void testRun_LoadFailure() {
        when(extractStage.extract()).thenReturn(List.of(new RawRecord(1L, "Record_1", 10L, "active")));
        when(loadStage.load(any())).thenReturn(false);
        EtlPipeline pipeline = new EtlPipeline(extractStage, cleanStage, aggregateStage, loadStage);

        PipelineRunResult result = pipeline.run("run-2", PipelineJob.ETL_PIPELINE);

        assertFalse(result.succeeded());
        assertFalse(result.loaded());
        assertEquals("Data load failed", result.errorMessage());
        assertNotNull(result.metrics());
    }
}
