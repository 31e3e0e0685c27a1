package org.theridian.repository;

import org.theridian.models.dto.DataSourceFilter;
import org.theridian.models.entity.DataSource;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

public final class DataSourceSpecs {

    private DataSourceSpecs() {
    }

    public static Specification<DataSource> matching(DataSourceFilter filter) {
        return (root, query, cb) -> {
            var predicate = cb.conjunction();
            if (filter.sourceType() != null) {
                predicate = cb.and(predicate, cb.equal(root.get("sourceType"), filter.sourceType()));
            }
            if (filter.active() != null) {
                predicate = cb.and(predicate, cb.equal(root.get("active"), filter.active()));
            }
            if (StringUtils.hasText(filter.search())) {
                predicate = cb.and(predicate,
                        cb.like(cb.lower(root.get("name")), "%" + filter.search().toLowerCase() + "%"));
            }
            return predicate;
        };
    }
}
