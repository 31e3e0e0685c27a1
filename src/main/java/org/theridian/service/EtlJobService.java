package org.theridian.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.CreateEtlJobRequest;
import org.theridian.models.dto.EtlJobDTO;
import org.theridian.models.dto.EtlJobFilter;
import org.theridian.models.entity.DataSource;
import org.theridian.models.entity.EtlJob;
import org.theridian.repository.DataSourceRepository;
import org.theridian.repository.EtlJobRepository;
import org.theridian.repository.EtlJobSpecs;
import org.theridian.service.jobs.JobDispatcher;
import org.theridian.utils.AppUtils;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EtlJobService {

    private final EtlJobRepository etlJobRepository;
    private final DataSourceRepository dataSourceRepository;
    private final DataSourceService dataSourceService;
    private final JobDispatcher jobDispatcher;
    private final Clock clock;

    /**
     * Saves a pending job and hands it to the worker pool once the insert has committed.
     */
    @Transactional
    public EtlJob createJob(CreateEtlJobRequest request) {
        DataSource source = dataSourceRepository.findBySourceUid(request.dataSource())
                .orElseThrow(() -> new ValidationFailedException("data_source", "Data source does not exist."));
        if (!source.isActive()) {
            throw new ValidationFailedException("data_source", "Cannot create job for inactive data source.");
        }

        Instant now = clock.instant();
        EtlJob job = new EtlJob();
        job.setJobUid(AppUtils.generateUUID());
        job.setName(request.name().trim());
        job.setDataSource(source);
        job.setConfiguration(request.configuration() != null ? new HashMap<>(request.configuration()) : new HashMap<>());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        EtlJob saved = etlJobRepository.save(job);

        log.info("Created ETL job {} ({}) on data source {}", saved.getJobUid(), saved.getName(), source.getName());
        jobDispatcher.dispatch(saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<EtlJob> list(EtlJobFilter filter, Pageable pageable) {
        return etlJobRepository.findAll(EtlJobSpecs.matching(filter != null ? filter : EtlJobFilter.empty()), pageable);
    }

    @Transactional(readOnly = true)
    public EtlJob getJobById(String uid) {
        return etlJobRepository.findByJobUid(uid)
                .orElseThrow(() -> new ResourceNotFoundException("ETL job", uid));
    }

    @Transactional(readOnly = true)
    public EtlJobDTO toDto(EtlJob job) {
        Duration duration = job.getDuration();
        return new EtlJobDTO(
                job.getJobUid(),
                job.getName(),
                job.getStatus(),
                dataSourceService.toDto(job.getDataSource()),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getRecordsProcessed(),
                job.getErrorMessage(),
                job.getConfiguration() != null ? job.getConfiguration() : Map.of(),
                duration != null ? duration.toNanos() / 1_000_000_000.0 : null,
                job.getAttempt(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
