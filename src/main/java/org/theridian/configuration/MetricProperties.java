package org.theridian.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param retention       how long metric rows are kept
 * @param labelScanLimit  most rows loaded for a label filter; the newest rows by the requested
 *                        ordering are scanned first
 */
@ConfigurationProperties("etl.metrics")
public record MetricProperties(
        @DefaultValue("30d") Duration retention,
        @DefaultValue("10000") int labelScanLimit
) {
}
