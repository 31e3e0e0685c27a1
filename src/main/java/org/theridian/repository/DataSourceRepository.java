package org.theridian.repository;

import org.theridian.models.entity.DataSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface DataSourceRepository extends JpaRepository<DataSource, Long>, JpaSpecificationExecutor<DataSource> {

    Optional<DataSource> findBySourceUid(String sourceUid);

    Optional<DataSource> findFirstByNameIgnoreCase(String name);

    long countByActiveTrue();

    Optional<DataSource> findFirstByActiveTrueAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(Instant threshold);
}
