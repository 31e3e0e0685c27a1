package org.theridian.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.theridian.models.dto.MetricFilter;
import org.theridian.models.entity.MetricData;
import org.theridian.models.enums.MetricType;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@DisplayName("MetricDataRepository Tests")
class MetricDataRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-31T00:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private MetricDataRepository metricDataRepository;

    @BeforeEach
    void setUp() {
        entityManager.persist(metric("m-1", "etl_jobs_started", 1, MetricType.COUNTER, NOW.minusSeconds(40L * 86400)));
        entityManager.persist(metric("m-2", "etl_job_duration_seconds", 3.5, MetricType.GAUGE, NOW.minusSeconds(3600)));
        entityManager.persist(metric("m-3", "cpu_usage", 87, MetricType.GAUGE, NOW));
        entityManager.flush();
    }

    @Test
    @DisplayName("Should filter on name, type and value range")
    void testSpecs() {
        MetricFilter etlGauges = new MetricFilter("ETL_", MetricType.GAUGE, null, null, null, null, null, null, null);
        assertEquals(List.of("m-2"), uids(etlGauges));

        MetricFilter highValues = new MetricFilter(null, null, null, null, 3.0, 100.0, null, null, null);
        assertEquals(List.of("m-2", "m-3"), uids(highValues));

        MetricFilter recent = new MetricFilter(null, null, NOW.minusSeconds(7200), null, null, null, null, null, null);
        assertEquals(List.of("m-2", "m-3"), uids(recent));
    }

    @Test
    @DisplayName("Should delete only rows recorded before the cutoff")
    void testDeleteAllRecordedBefore() {
        int deleted = metricDataRepository.deleteAllRecordedBefore(NOW.minusSeconds(30L * 86400));

        assertEquals(1, deleted);
        assertEquals(2, metricDataRepository.count());
        assertEquals(List.of("m-2", "m-3"), uids(MetricFilter.empty()));
    }

    @Test
    @DisplayName("Should keep labels as stored")
    void testLabelsRoundTrip() {
        entityManager.clear();

        MetricFilter cpu = new MetricFilter("cpu_usage", null, null, null, null, null, null, null, null);
        MetricData metric = metricDataRepository.findAll(MetricDataSpecs.matching(cpu)).get(0);

        assertEquals(Map.of("host", "m-3"), metric.getLabels());
    }

    private List<String> uids(MetricFilter filter) {
        return metricDataRepository.findAll(MetricDataSpecs.matching(filter)).stream()
                .map(MetricData::getMetricUid)
                .sorted()
                .toList();
    }

    private static MetricData metric(String uid, String name, double value, MetricType type, Instant at) {
        MetricData metric = new MetricData();
        metric.setMetricUid(uid);
        metric.setMetricName(name);
        metric.setMetricValue(value);
        metric.setMetricType(type);
        metric.setLabels(new HashMap<>(Map.of("host", uid)));
        metric.setTimestamp(at);
        metric.setCreatedAt(at);
        return metric;
    }
}
