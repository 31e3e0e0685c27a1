package org.theridian.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import org.theridian.models.dto.EtlJobFilter;
import org.theridian.models.entity.DataSource;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Collection;

public final class EtlJobSpecs {

    private EtlJobSpecs() {
    }

    public static Specification<EtlJob> matching(EtlJobFilter filter) {
        return Specification.where(statusIn(filter.statuses()))
                .and(dataSourceUid(filter.dataSourceUid()))
                .and(dataSourceNameContains(filter.dataSourceName()))
                .and(nameEquals(filter.name()))
                .and(nameContains(filter.nameContains()))
                .and(nameContains(filter.search()))
                .and(between("createdAt", filter.createdAfter(), filter.createdBefore()))
                .and(between("startedAt", filter.startedAfter(), filter.startedBefore()))
                .and(between("completedAt", filter.completedAfter(), filter.completedBefore()))
                .and(recordsAtLeast(filter.minRecords()))
                .and(recordsAtMost(filter.maxRecords()))
                .and(hasErrors(filter.hasErrors()));
    }

    public static Specification<EtlJob> statusIn(Collection<JobStatus> statuses) {
        return (root, query, cb) -> statuses == null || statuses.isEmpty()
                ? cb.conjunction()
                : root.get("status").in(statuses);
    }

    public static Specification<EtlJob> dataSourceUid(String uid) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(uid)) {
                return cb.conjunction();
            }
            Join<EtlJob, DataSource> source = root.join("dataSource", JoinType.INNER);
            return cb.equal(source.get("sourceUid"), uid);
        };
    }

    public static Specification<EtlJob> dataSourceNameContains(String fragment) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(fragment)) {
                return cb.conjunction();
            }
            Join<EtlJob, DataSource> source = root.join("dataSource", JoinType.INNER);
            return cb.like(cb.lower(source.get("name")), "%" + fragment.toLowerCase() + "%");
        };
    }

    public static Specification<EtlJob> nameEquals(String name) {
        return (root, query, cb) -> StringUtils.hasText(name)
                ? cb.equal(root.get("name"), name)
                : cb.conjunction();
    }

    public static Specification<EtlJob> nameContains(String fragment) {
        return (root, query, cb) -> StringUtils.hasText(fragment)
                ? cb.like(cb.lower(root.get("name")), "%" + fragment.toLowerCase() + "%")
                : cb.conjunction();
    }

    public static Specification<EtlJob> between(String attribute, Instant from, Instant to) {
        return (root, query, cb) -> {
            if (from != null && to != null) {
                return cb.between(root.<Instant>get(attribute), from, to);
            }
            if (from != null) {
                return cb.greaterThanOrEqualTo(root.<Instant>get(attribute), from);
            }
            if (to != null) {
                return cb.lessThanOrEqualTo(root.<Instant>get(attribute), to);
            }
            return cb.conjunction();
        };
    }

    public static Specification<EtlJob> recordsAtLeast(Long min) {
        return (root, query, cb) -> min == null
                ? cb.conjunction()
                : cb.greaterThanOrEqualTo(root.<Long>get("recordsProcessed"), min);
    }

    public static Specification<EtlJob> recordsAtMost(Long max) {
        return (root, query, cb) -> max == null
                ? cb.conjunction()
                : cb.lessThanOrEqualTo(root.<Long>get("recordsProcessed"), max);
    }

    public static Specification<EtlJob> hasErrors(Boolean hasErrors) {
        return (root, query, cb) -> {
            if (hasErrors == null) {
                return cb.conjunction();
            }
            var blank = cb.or(cb.isNull(root.get("errorMessage")), cb.equal(root.get("errorMessage"), ""));
            return hasErrors ? cb.not(blank) : blank;
        };
    }
}
