package org.theridian.repository;

import org.theridian.models.entity.MetricData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface MetricDataRepository extends JpaRepository<MetricData, Long>, JpaSpecificationExecutor<MetricData> {

    @Modifying
    @Query("delete from MetricData m where m.timestamp < :cutoff")
    int deleteAllRecordedBefore(@Param("cutoff") Instant cutoff);
}
