package org.theridian.controllers;

import org.theridian.models.dto.DataSourceDTO;
import org.theridian.models.dto.DataSourceFilter;
import org.theridian.models.dto.DataSourceRequest;
import org.theridian.models.dto.PageResponse;
import org.theridian.models.entity.DataSource;
import org.theridian.models.enums.SourceType;
import org.theridian.service.DataSourceService;
import org.theridian.utils.OrderingParser;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/data-sources")
@CrossOrigin(origins = "*")
public class DataSourceController {

    private static final Map<String, String> ORDERING_FIELDS = Map.of(
            "name", "name",
            "created_at", "createdAt",
            "source_type", "sourceType");

    private final DataSourceService dataSourceService;

    public DataSourceController(DataSourceService dataSourceService) {
        this.dataSourceService = dataSourceService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<DataSourceDTO>> listSources(
            @RequestParam(value = "source_type", required = false) SourceType sourceType,
            @RequestParam(value = "is_active", required = false) Boolean active,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "ordering", required = false) String ordering,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<DataSource> sources = dataSourceService.list(
                new DataSourceFilter(sourceType, active, search),
                PageRequests.of(page, size, OrderingParser.parse(ordering, ORDERING_FIELDS, "name")));
        return ResponseEntity.ok(PageResponse.from(sources.map(dataSourceService::toDto)));
    }

    @PostMapping
    public ResponseEntity<DataSourceDTO> addSource(@RequestBody DataSourceRequest request) {
        DataSource source = dataSourceService.createSource(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(dataSourceService.toDto(source));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataSourceDTO> getSource(@PathVariable String id) {
        return ResponseEntity.ok(dataSourceService.toDto(dataSourceService.getSourceById(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DataSourceDTO> replaceSource(@PathVariable String id, @RequestBody DataSourceRequest request) {
        return ResponseEntity.ok(dataSourceService.toDto(dataSourceService.replaceSource(id, request)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<DataSourceDTO> updateSource(@PathVariable String id, @RequestBody DataSourceRequest request) {
        return ResponseEntity.ok(dataSourceService.toDto(dataSourceService.updateSource(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSource(@PathVariable String id) {
        dataSourceService.deleteSource(id);
        return ResponseEntity.noContent().build();
    }
}
