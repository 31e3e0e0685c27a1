package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateMetricRequest(
        @NotBlank @Size(max = 100) String metricName,
        @NotNull Double metricValue,
        String metricType,
        Map<String, Object> labels
) {
}
