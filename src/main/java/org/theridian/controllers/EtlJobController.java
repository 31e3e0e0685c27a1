package org.theridian.controllers;

import jakarta.validation.Valid;
import org.theridian.models.dto.CreateEtlJobRequest;
import org.theridian.models.dto.EtlJobDTO;
import org.theridian.models.dto.EtlJobFilter;
import org.theridian.models.dto.PageResponse;
import org.theridian.models.entity.EtlJob;
import org.theridian.models.enums.JobStatus;
import org.theridian.service.EtlJobService;
import org.theridian.service.jobs.JobLifecycleService;
import org.theridian.utils.OrderingParser;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/etl-jobs")
@CrossOrigin(origins = "*")
public class EtlJobController {

    private static final Map<String, String> ORDERING_FIELDS = Map.of(
            "name", "name",
            "created_at", "createdAt",
            "started_at", "startedAt",
            "completed_at", "completedAt",
            "status", "status");

    private final EtlJobService etlJobService;
    private final JobLifecycleService jobLifecycleService;

    public EtlJobController(EtlJobService etlJobService, JobLifecycleService jobLifecycleService) {
        this.etlJobService = etlJobService;
        this.jobLifecycleService = jobLifecycleService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<EtlJobDTO>> listJobs(
            @RequestParam(value = "status", required = false) List<JobStatus> statuses,
            @RequestParam(value = "data_source", required = false) String dataSource,
            @RequestParam(value = "data_source_name", required = false) String dataSourceName,
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "name_contains", required = false) String nameContains,
            @RequestParam(value = "created_after", required = false) Instant createdAfter,
            @RequestParam(value = "created_before", required = false) Instant createdBefore,
            @RequestParam(value = "started_after", required = false) Instant startedAfter,
            @RequestParam(value = "started_before", required = false) Instant startedBefore,
            @RequestParam(value = "completed_after", required = false) Instant completedAfter,
            @RequestParam(value = "completed_before", required = false) Instant completedBefore,
            @RequestParam(value = "min_records", required = false) Long minRecords,
            @RequestParam(value = "max_records", required = false) Long maxRecords,
            @RequestParam(value = "has_errors", required = false) Boolean hasErrors,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "ordering", required = false) String ordering,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {
        EtlJobFilter filter = new EtlJobFilter(statuses != null ? statuses : List.of(), dataSource, dataSourceName,
                name, nameContains, createdAfter, createdBefore, startedAfter, startedBefore,
                completedAfter, completedBefore, minRecords, maxRecords, hasErrors, search);
        Page<EtlJob> jobs = etlJobService.list(filter,
                PageRequests.of(page, size, OrderingParser.parse(ordering, ORDERING_FIELDS, "-created_at")));
        return ResponseEntity.ok(PageResponse.from(jobs.map(etlJobService::toDto)));
    }

    @PostMapping
    public ResponseEntity<EtlJobDTO> createJob(@Valid @RequestBody CreateEtlJobRequest request) {
        EtlJob job = etlJobService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(etlJobService.toDto(job));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EtlJobDTO> getJob(@PathVariable String id) {
        return ResponseEntity.ok(etlJobService.toDto(etlJobService.getJobById(id)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<EtlJobDTO> retryJob(@PathVariable String id) {
        return ResponseEntity.ok(etlJobService.toDto(jobLifecycleService.retry(id)));
    }
}
