package org.theridian.repository;

import org.theridian.models.dto.MetricFilter;
import org.theridian.models.entity.MetricData;
import org.theridian.models.enums.MetricType;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.time.Instant;

/**
 * Column-level metric filters. Label predicates are not expressible portably over a JSON column
 * and are applied by {@link org.theridian.service.metrics.MetricService} after these.
 */
public final class MetricDataSpecs {

    private MetricDataSpecs() {
    }

    public static Specification<MetricData> matching(MetricFilter filter) {
        return Specification.where(nameContains(filter.metricName()))
                .and(ofType(filter.metricType()))
                .and(recordedBetween(filter.timestampAfter(), filter.timestampBefore()))
                .and(valueBetween(filter.minValue(), filter.maxValue()));
    }

    public static Specification<MetricData> nameContains(String fragment) {
        return (root, query, cb) -> StringUtils.hasText(fragment)
                ? cb.like(cb.lower(root.get("metricName")), "%" + fragment.toLowerCase() + "%")
                : cb.conjunction();
    }

    public static Specification<MetricData> ofType(MetricType type) {
        return (root, query, cb) -> type == null ? cb.conjunction() : cb.equal(root.get("metricType"), type);
    }

    public static Specification<MetricData> recordedBetween(Instant from, Instant to) {
        return (root, query, cb) -> {
            var predicate = cb.conjunction();
            if (from != null) {
                predicate = cb.and(predicate, cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), from));
            }
            if (to != null) {
                predicate = cb.and(predicate, cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), to));
            }
            return predicate;
        };
    }

    public static Specification<MetricData> valueBetween(Double min, Double max) {
        return (root, query, cb) -> {
            var predicate = cb.conjunction();
            if (min != null) {
                predicate = cb.and(predicate, cb.greaterThanOrEqualTo(root.<Double>get("metricValue"), min));
            }
            if (max != null) {
                predicate = cb.and(predicate, cb.lessThanOrEqualTo(root.<Double>get("metricValue"), max));
            }
            return predicate;
        };
    }
}
