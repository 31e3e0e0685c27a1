package org.theridian.pipeline;

public record PipelineRunResult(
        String runKey,
        PipelineJob job,
        boolean succeeded,
        int recordsExtracted,
        AggregatedMetrics metrics,
        boolean loaded,
        String errorMessage
) {

    static PipelineRunResult failure(String runKey, PipelineJob job, int recordsExtracted, String errorMessage) {
        return new PipelineRunResult(runKey, job, false, recordsExtracted, null, false, errorMessage);
    }
}
