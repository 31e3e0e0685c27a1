package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.PipelineValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the offline stages in order for one pipeline job. Stage failures end the run and are
 * reported on the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EtlPipeline {

    private final RawDataExtractStage extractStage;
    private final CleanDataStage cleanStage;
    private final AggregateMetricsStage aggregateStage;
    private final LoadStage loadStage;

    public PipelineRunResult run(String runKey, PipelineJob job) {
        List<RawRecord> raw = extractStage.extract();
        if (job == PipelineJob.EXTRACT_ONLY) {
            return new PipelineRunResult(runKey, job, true, raw.size(), null, false, null);
        }

        try {
            List<CleanRecord> cleaned = cleanStage.clean(raw);
            AggregatedMetrics metrics = aggregateStage.aggregate(cleaned);
            boolean loaded = loadStage.load(metrics);
            return new PipelineRunResult(runKey, job, loaded, raw.size(), metrics, loaded,
                    loaded ? null : "Data load failed");
        } catch (PipelineValidationException exception) {
            log.error("Pipeline run {} failed validation: {}", runKey, exception.getMessage());
            return PipelineRunResult.failure(runKey, job, raw.size(), exception.getMessage());
        }
    }
}
