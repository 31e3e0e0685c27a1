package org.theridian.models.dto;

import org.theridian.models.enums.SourceType;

public record DataSourceFilter(
        SourceType sourceType,
        Boolean active,
        String search
) {
}
