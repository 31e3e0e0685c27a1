package org.theridian.tasks;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record DailyReport(
        LocalDate date,
        long totalJobs,
        long completedJobs,
        long failedJobs,
        long totalRecordsProcessed,
        double successRate
) {

    /**
     * Numeric fields keyed by the suffix used for the {@code daily_report_*} metrics.
     */
    public Map<String, Double> numericValues() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("total_jobs", (double) totalJobs);
        values.put("completed_jobs", (double) completedJobs);
        values.put("failed_jobs", (double) failedJobs);
        values.put("total_records_processed", (double) totalRecordsProcessed);
        values.put("success_rate", successRate);
        return values;
    }
}
