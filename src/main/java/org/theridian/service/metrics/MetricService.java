package org.theridian.service.metrics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.configuration.MetricProperties;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.CreateMetricRequest;
import org.theridian.models.dto.MetricDataDTO;
import org.theridian.models.dto.MetricFilter;
import org.theridian.models.entity.MetricData;
import org.theridian.models.enums.MetricType;
import org.theridian.repository.MetricDataRepository;
import org.theridian.repository.MetricDataSpecs;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricService {

    static final String CLEANUP_METRIC = "metrics_cleanup";

    private final MetricDataRepository metricDataRepository;
    private final MetricRecorder metricRecorder;
    private final MetricProperties metricProperties;
    private final Clock clock;

    @Transactional
    public MetricData create(CreateMetricRequest request) {
        MetricType type = parseType(request.metricType());
        Map<String, String> labels = new LinkedHashMap<>();
        if (request.labels() != null) {
            request.labels().forEach((key, value) -> labels.put(key, value == null ? "" : String.valueOf(value)));
        }
        log.debug("Recording metric {} via API", request.metricName());
        return metricRecorder.record(request.metricName(), request.metricValue(), type, labels);
    }

    @Transactional(readOnly = true)
    public Page<MetricData> search(MetricFilter filter, Pageable pageable) {
        MetricFilter effective = filter != null ? filter : MetricFilter.empty();
        if (!effective.filtersOnLabels()) {
            return metricDataRepository.findAll(MetricDataSpecs.matching(effective), pageable);
        }

        // labels are JSON, so they are matched here over a bounded slice of the column-filtered rows
        Page<MetricData> scanned = metricDataRepository.findAll(MetricDataSpecs.matching(effective),
                PageRequest.of(0, metricProperties.labelScanLimit(), pageable.getSort()));
        if (scanned.hasNext()) {
            log.warn("Label filter scanned the first {} of {} metric rows, narrow it with a name or time range",
                    metricProperties.labelScanLimit(), scanned.getTotalElements());
        }
        List<MetricData> matching = scanned.getContent().stream()
                .filter(metric -> matchesLabels(metric, effective))
                .toList();

        if (pageable.isUnpaged()) {
            return new PageImpl<>(matching);
        }
        int from = (int) Math.min(pageable.getOffset(), matching.size());
        int to = Math.min(from + pageable.getPageSize(), matching.size());
        return new PageImpl<>(matching.subList(from, to), pageable, matching.size());
    }

    /**
     * Deletes every metric recorded before the retention window and records the number of removed
     * rows as a metric of its own.
     */
    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(metricProperties.retention());
        int deleted = metricDataRepository.deleteAllRecordedBefore(cutoff);
        log.info("Cleaned up {} metric rows recorded before {}", deleted, cutoff);
        metricRecorder.gauge(CLEANUP_METRIC, deleted,
                Map.of("retention_days", String.valueOf(metricProperties.retention().toDays())));
        return deleted;
    }

    static boolean matchesLabels(MetricData metric, MetricFilter filter) {
        Map<String, String> labels = metric.getLabels() != null ? metric.getLabels() : Map.of();
        if (filter.hasLabels() != null && filter.hasLabels() == labels.isEmpty()) {
            return false;
        }
        if (StringUtils.hasText(filter.labelKey()) && !labels.containsKey(filter.labelKey())) {
            return false;
        }
        // approximate: substring match against every label value
        if (StringUtils.hasText(filter.labelValue())) {
            return labels.values().stream()
                    .anyMatch(value -> value != null && value.contains(filter.labelValue()));
        }
        return true;
    }

    public static MetricDataDTO toDto(MetricData metric) {
        return new MetricDataDTO(
                metric.getMetricUid(),
                metric.getMetricName(),
                metric.getMetricValue(),
                metric.getMetricType(),
                metric.getLabels(),
                metric.getTimestamp(),
                metric.getCreatedAt()
        );
    }

    private MetricType parseType(String value) {
        if (!StringUtils.hasText(value)) {
            return MetricType.GAUGE;
        }
        try {
            return MetricType.fromValue(value);
        } catch (IllegalArgumentException exception) {
            throw new ValidationFailedException("metric_type", exception.getMessage());
        }
    }
}
