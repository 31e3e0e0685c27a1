package org.theridian.service.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.theridian.configuration.MetricProperties;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.CreateMetricRequest;
import org.theridian.models.dto.MetricDataDTO;
import org.theridian.models.dto.MetricFilter;
import org.theridian.models.entity.MetricData;
import org.theridian.models.enums.MetricType;
import org.theridian.repository.MetricDataRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MetricService Tests")
class MetricServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-31T00:00:00Z");

    @Mock
    private MetricDataRepository metricDataRepository;

    @Mock
    private MetricRecorder metricRecorder;

    private MetricService service;

    @BeforeEach
    void setUp() {
        service = new MetricService(metricDataRepository, metricRecorder,
                new MetricProperties(Duration.ofDays(30), 3), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should default the type to gauge and stringify label values")
    void testCreate_Defaults() {
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("host", "web-1");
        labels.put("shard", 3);
        when(metricRecorder.record(anyString(), anyDouble(), any(), anyMap())).thenReturn(new MetricData());

        service.create(new CreateMetricRequest("cpu_usage", 42.5, null, labels));

        verify(metricRecorder).record("cpu_usage", 42.5, MetricType.GAUGE, Map.of("host", "web-1", "shard", "3"));
    }

    @Test
    @DisplayName("Should reject an unknown metric type")
    void testCreate_InvalidType() {
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> service.create(new CreateMetricRequest("cpu_usage", 1.0, "meter", Map.of())));

        assertEquals("metric_type", ex.getField());
        verifyNoInteractions(metricRecorder);
    }

    @Test
    @DisplayName("Should purge rows older than the retention and record how many went")
    void testPurgeExpired() {
        when(metricDataRepository.deleteAllRecordedBefore(Instant.parse("2024-05-01T00:00:00Z"))).thenReturn(5);

        int deleted = service.purgeExpired();

        assertEquals(5, deleted);
        verify(metricRecorder).gauge(eq("metrics_cleanup"), eq(5.0), eq(Map.of("retention_days", "30")));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should apply label filters in memory and page the result")
    void testSearch_LabelFilter() {
        MetricData tagged = metric("etl_jobs_started", Map.of("job_name", "nightly", "data_source", "warehouse"));
        MetricData other = metric("etl_jobs_started", Map.of("job_name", "hourly"));
        MetricData bare = metric("cpu_usage", Map.of());
        when(metricDataRepository.findAll(any(Specification.class), eq(PageRequest.of(0, 3, Sort.unsorted()))))
                .thenReturn(new PageImpl<>(List.of(tagged, other, bare)));

        MetricFilter byKey = new MetricFilter(null, null, null, null, null, null, null, "data_source", null);
        Page<MetricData> page = service.search(byKey, PageRequest.of(0, 10));
        assertEquals(List.of(tagged), page.getContent());
        assertEquals(1, page.getTotalElements());

        MetricFilter byValue = new MetricFilter(null, null, null, null, null, null, null, null, "ly");
        assertEquals(2, service.search(byValue, PageRequest.of(0, 10)).getTotalElements());

        MetricFilter unlabelled = new MetricFilter(null, null, null, null, null, null, false, null, null);
        assertEquals(List.of(bare), service.search(unlabelled, PageRequest.of(0, 10)).getContent());

        MetricFilter labelled = new MetricFilter(null, null, null, null, null, null, true, null, null);
        Page<MetricData> second = service.search(labelled, PageRequest.of(1, 1));
        assertEquals(List.of(other), second.getContent());
        assertEquals(2, second.getTotalElements());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should page in the database when no label filter is set")
    void testSearch_NoLabelFilter() {
        PageRequest pageable = PageRequest.of(0, 20);
        when(metricDataRepository.findAll(any(Specification.class), eq(pageable)))
                .thenReturn(Page.empty(pageable));

        service.search(MetricFilter.empty(), pageable);

        verify(metricDataRepository).findAll(any(Specification.class), eq(pageable));
        verifyNoMoreInteractions(metricDataRepository);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should load at most the scan limit of rows for a label filter, newest first")
    void testSearch_LabelFilterScanLimit() {
        MetricData newest = metric("etl_jobs_started", Map.of("job_name", "nightly"));
        MetricData older = metric("etl_jobs_started", Map.of("job_name", "hourly"));
        MetricData oldest = metric("etl_jobs_started", Map.of("job_name", "weekly"));
        PageRequest requested = PageRequest.of(0, 10, Sort.by(Sort.Direction.DESC, "timestamp"));
        PageRequest scan = PageRequest.of(0, 3, requested.getSort());
        when(metricDataRepository.findAll(any(Specification.class), eq(scan)))
                .thenReturn(new PageImpl<>(List.of(newest, older, oldest), scan, 5000));

        MetricFilter byValue = new MetricFilter(null, null, null, null, null, null, null, null, "ly");
        Page<MetricData> page = service.search(byValue, requested);

        assertEquals(List.of(newest, older, oldest), page.getContent());
        assertEquals(3, page.getTotalElements());
        verify(metricDataRepository, never()).findAll(any(Specification.class), any(Sort.class));
    }

    @Test
    @DisplayName("Should map a metric row to its wire form")
    void testToDto() {
        MetricData metric = metric("cpu_usage", Map.of("host", "a"));
        metric.setMetricUid("m-1");
        metric.setMetricValue(0.5);
        metric.setMetricType(MetricType.HISTOGRAM);
        metric.setTimestamp(NOW);

        MetricDataDTO dto = MetricService.toDto(metric);
        assertEquals("m-1", dto.id());
        assertEquals(MetricType.HISTOGRAM, dto.metricType());
        assertEquals(NOW, dto.timestamp());
    }

    private static MetricData metric(String name, Map<String, String> labels) {
        MetricData metric = new MetricData();
        metric.setMetricName(name);
        metric.setMetricType(MetricType.COUNTER);
        metric.setMetricValue(1);
        metric.setLabels(new HashMap<>(labels));
        return metric;
    }
}
