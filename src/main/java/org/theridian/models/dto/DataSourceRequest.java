package org.theridian.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.theridian.models.enums.SourceType;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DataSourceRequest(
        String name,
        SourceType sourceType,
        String connectionString,
        @JsonProperty("is_active") Boolean active,
        Map<String, Object> metadata
) {
}
