package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record CreateEtlJobRequest(
        @NotBlank(message = "Job name is required")
        @Size(max = 100, message = "Job name must be at most 100 characters")
        String name,
        @NotBlank(message = "Data source is required")
        @JsonAlias({"data_source_id"})
        String dataSource,
        Map<String, Object> configuration
) {
}
