package org.theridian.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.PipelineProperties;
import org.theridian.models.entity.DataSource;
import org.theridian.repository.DataSourceRepository;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * Triggers the full pipeline when an active data source was updated recently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataAvailabilitySensor {

    static final DateTimeFormatter KEY_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final DataSourceRepository dataSourceRepository;
    private final PipelineRunLauncher launcher;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pipeline.sensor-interval:30000}", initialDelayString = "${pipeline.sensor-interval:30000}")
    public void tick() {
        if (!properties.sensorsEnabled()) {
            return;
        }
        SensorResult result = evaluate();
        result.request().ifPresentOrElse(launcher::launch,
                () -> log.debug("Data availability sensor skipped: {}", result.skipReason()));
    }

    public SensorResult evaluate() {
        try {
            Instant now = clock.instant();
            Optional<DataSource> latest = dataSourceRepository
                    .findFirstByActiveTrueAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
                            now.minus(properties.sourceUpdateWindow()));
            if (latest.isEmpty()) {
                return SensorResult.skip("No new data sources updated in the last hour");
            }

            DataSource source = latest.get();
            return SensorResult.run(new RunRequest(
                    "sensor_triggered_" + source.getSourceUid() + "_" + KEY_TIME.format(now),
                    PipelineJob.ETL_PIPELINE,
                    Map.of("trigger", "sensor",
                            "data_source", source.getName(),
                            "source_type", source.getSourceType().getValue())));
        } catch (RuntimeException exception) {
            log.error("Error in data availability sensor: {}", exception.getMessage());
            return SensorResult.skip("Sensor error: " + exception.getMessage());
        }
    }
}
