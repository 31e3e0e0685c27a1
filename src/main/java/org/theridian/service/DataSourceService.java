package org.theridian.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.DataSourceDTO;
import org.theridian.models.dto.DataSourceFilter;
import org.theridian.models.dto.DataSourceRequest;
import org.theridian.models.entity.DataSource;
import org.theridian.repository.DataSourceRepository;
import org.theridian.repository.DataSourceSpecs;
import org.theridian.repository.EtlJobRepository;
import org.theridian.utils.AppUtils;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceService {

    private static final int MAX_NAME_LENGTH = 100;

    private final DataSourceRepository dataSourceRepository;
    private final EtlJobRepository etlJobRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Page<DataSource> list(DataSourceFilter filter, Pageable pageable) {
        return dataSourceRepository.findAll(DataSourceSpecs.matching(filter), pageable);
    }

    @Transactional(readOnly = true)
    public DataSource getSourceById(String uid) {
        return dataSourceRepository.findBySourceUid(uid)
                .orElseThrow(() -> new ResourceNotFoundException("Data source", uid));
    }

    @Transactional
    public DataSource createSource(DataSourceRequest request) {
        String name = validateName(request.name(), null);
        if (request.sourceType() == null) {
            throw new ValidationFailedException("source_type", "Source type is required");
        }
        if (!StringUtils.hasText(request.connectionString())) {
            throw new ValidationFailedException("connection_string", "Connection string is required");
        }

        Instant now = clock.instant();
        DataSource source = new DataSource();
        source.setSourceUid(AppUtils.generateUUID());
        source.setName(name);
        source.setSourceType(request.sourceType());
        source.setConnectionString(request.connectionString());
        source.setActive(request.active() == null || request.active());
        source.setMetadata(request.metadata() != null ? new HashMap<>(request.metadata()) : new HashMap<>());
        source.setCreatedAt(now);
        source.setUpdatedAt(now);

        log.info("Creating new data source {} ({})", name, request.sourceType().getValue());
        return dataSourceRepository.save(source);
    }

    /**
     * Full replacement: name, type and connection string are required again.
     */
    @Transactional
    public DataSource replaceSource(String uid, DataSourceRequest request) {
        DataSource source = getSourceById(uid);
        if (request.sourceType() == null) {
            throw new ValidationFailedException("source_type", "Source type is required");
        }
        if (!StringUtils.hasText(request.connectionString())) {
            throw new ValidationFailedException("connection_string", "Connection string is required");
        }
        source.setName(validateName(request.name(), source));
        source.setSourceType(request.sourceType());
        source.setConnectionString(request.connectionString());
        source.setActive(request.active() == null || request.active());
        source.setMetadata(request.metadata() != null ? new HashMap<>(request.metadata()) : new HashMap<>());
        source.setUpdatedAt(clock.instant());
        return dataSourceRepository.save(source);
    }

    @Transactional
    public DataSource updateSource(String uid, DataSourceRequest request) {
        DataSource source = getSourceById(uid);

        if (request.name() != null) {
            source.setName(validateName(request.name(), source));
        }
        if (request.sourceType() != null) {
            source.setSourceType(request.sourceType());
        }
        if (request.connectionString() != null) {
            if (!StringUtils.hasText(request.connectionString())) {
                throw new ValidationFailedException("connection_string", "Connection string may not be blank");
            }
            source.setConnectionString(request.connectionString());
        }
        if (request.active() != null) {
            if (source.isActive() && !request.active()) {
                log.info("Deactivating data source {}", source.getName());
            }
            source.setActive(request.active());
        }
        if (request.metadata() != null) {
            source.setMetadata(new HashMap<>(request.metadata()));
        }

        source.setUpdatedAt(clock.instant());
        return dataSourceRepository.save(source);
    }

    @Transactional
    public void deleteSource(String uid) {
        DataSource source = getSourceById(uid);
        log.info("Deleting data source {}", source.getName());
        dataSourceRepository.delete(source);
    }

    @Transactional(readOnly = true)
    public DataSourceDTO toDto(DataSource source) {
        return new DataSourceDTO(
                source.getSourceUid(),
                source.getName(),
                source.getSourceType(),
                source.isActive(),
                source.getMetadata() != null ? source.getMetadata() : Map.of(),
                etlJobRepository.countByDataSource(source),
                source.getCreatedAt(),
                source.getUpdatedAt()
        );
    }

    private String validateName(String rawName, DataSource current) {
        if (!StringUtils.hasText(rawName)) {
            throw new ValidationFailedException("name", "Data source name is required");
        }
        String name = rawName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationFailedException("name", "Data source name must be at most 100 characters");
        }
        dataSourceRepository.findFirstByNameIgnoreCase(name)
                .filter(existing -> current == null || !existing.getId().equals(current.getId()))
                .ifPresent(existing -> {
                    throw new ValidationFailedException("name", "A data source with this name already exists.");
                });
        return name;
    }
}
