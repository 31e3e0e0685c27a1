package org.theridian.controllers;

import jakarta.validation.Valid;
import org.theridian.models.dto.CreateMetricRequest;
import org.theridian.models.dto.MetricDataDTO;
import org.theridian.models.dto.MetricFilter;
import org.theridian.models.dto.PageResponse;
import org.theridian.models.enums.MetricType;
import org.theridian.service.metrics.MetricService;
import org.theridian.utils.OrderingParser;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/metrics")
@CrossOrigin(origins = "*")
public class MetricController {

    private static final Map<String, String> ORDERING_FIELDS = Map.of(
            "timestamp", "timestamp",
            "metric_name", "metricName",
            "metric_value", "metricValue");

    private final MetricService metricService;

    public MetricController(MetricService metricService) {
        this.metricService = metricService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<MetricDataDTO>> listMetrics(
            @RequestParam(value = "metric_name", required = false) String metricName,
            @RequestParam(value = "metric_type", required = false) MetricType metricType,
            @RequestParam(value = "timestamp_after", required = false) Instant timestampAfter,
            @RequestParam(value = "timestamp_before", required = false) Instant timestampBefore,
            @RequestParam(value = "min_value", required = false) Double minValue,
            @RequestParam(value = "max_value", required = false) Double maxValue,
            @RequestParam(value = "has_labels", required = false) Boolean hasLabels,
            @RequestParam(value = "label_key", required = false) String labelKey,
            @RequestParam(value = "label_value", required = false) String labelValue,
            @RequestParam(value = "ordering", required = false) String ordering,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {
        MetricFilter filter = new MetricFilter(metricName, metricType, timestampAfter, timestampBefore,
                minValue, maxValue, hasLabels, labelKey, labelValue);
        return ResponseEntity.ok(PageResponse.from(metricService.search(filter,
                        PageRequests.of(page, size, OrderingParser.parse(ordering, ORDERING_FIELDS, "-timestamp")))
                .map(MetricService::toDto)));
    }

    @PostMapping
    public ResponseEntity<MetricDataDTO> recordMetric(@Valid @RequestBody CreateMetricRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(MetricService.toDto(metricService.create(request)));
    }
}
