package org.theridian.pipeline;

import java.util.Map;

public record RunRequest(String runKey, PipelineJob job, Map<String, String> tags) {
}
