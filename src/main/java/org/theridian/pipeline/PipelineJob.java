package org.theridian.pipeline;

public enum PipelineJob {
    /** extract, clean, aggregate and load */
    ETL_PIPELINE("etl_pipeline"),
    /** extract only, for smoke runs */
    EXTRACT_ONLY("extract_only");

    private final String value;

    PipelineJob(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
