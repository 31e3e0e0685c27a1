package org.theridian.repository;

import org.theridian.models.entity.DataSource;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface EtlJobRepository extends JpaRepository<EtlJob, Long>, JpaSpecificationExecutor<EtlJob> {

    @EntityGraph(attributePaths = "dataSource")
    Optional<EtlJob> findByJobUid(String jobUid);

    long countByDataSource(DataSource dataSource);

    long countByStatus(JobStatus status);

    long countByStatusAndCompletedAtGreaterThanEqualAndCompletedAtLessThan(JobStatus status, Instant from, Instant to);

    @EntityGraph(attributePaths = "dataSource")
    List<EtlJob> findTop5ByOrderByCreatedAtDesc();

    List<EtlJob> findAllByStatusAndStartedAtLessThan(JobStatus status, Instant threshold);

    List<EtlJob> findAllByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

    @EntityGraph(attributePaths = "dataSource")
    Optional<EtlJob> findFirstByStatusAndCompletedAtGreaterThanEqualAndErrorMessageContainingIgnoreCaseOrderByCompletedAtAsc(
            JobStatus status, Instant completedAfter, String errorFragment);
}
