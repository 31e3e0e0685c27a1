package org.theridian.controllers;

import org.theridian.models.dto.ApiKeyDTO;
import org.theridian.models.dto.ApiKeyRequest;
import org.theridian.service.ApiKeyService;
import org.theridian.utils.OrderingParser;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/keys")
@CrossOrigin(origins = "*")
public class ApiKeyController {

    private static final Map<String, String> ORDERING_FIELDS = Map.of(
            "name", "name",
            "created_at", "createdAt",
            "last_used_at", "lastUsedAt");

    private final ApiKeyService apiKeyService;

    public ApiKeyController(ApiKeyService apiKeyService) {
        this.apiKeyService = apiKeyService;
    }

    @GetMapping
    public ResponseEntity<List<ApiKeyDTO>> listKeys(@RequestParam(value = "search", required = false) String search,
                                                    @RequestParam(value = "ordering", required = false) String ordering,
                                                    Authentication authentication) {
        List<ApiKeyDTO> keys = apiKeyService.listKeys(requireUserEmail(authentication), search,
                        OrderingParser.parse(ordering, ORDERING_FIELDS, "-created_at"))
                .stream()
                .map(ApiKeyService::toDto)
                .toList();
        return ResponseEntity.ok(keys);
    }

    @PostMapping
    public ResponseEntity<ApiKeyDTO> createKey(@RequestBody ApiKeyRequest request, Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiKeyService.toDto(apiKeyService.createKey(requireUserEmail(authentication), request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiKeyDTO> getKey(@PathVariable String id, Authentication authentication) {
        return ResponseEntity.ok(ApiKeyService.toDto(apiKeyService.getKey(requireUserEmail(authentication), id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiKeyDTO> replaceKey(@PathVariable String id,
                                                @RequestBody ApiKeyRequest request,
                                                Authentication authentication) {
        return ResponseEntity.ok(ApiKeyService.toDto(
                apiKeyService.replaceKey(requireUserEmail(authentication), id, request)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiKeyDTO> updateKey(@PathVariable String id,
                                               @RequestBody ApiKeyRequest request,
                                               Authentication authentication) {
        return ResponseEntity.ok(ApiKeyService.toDto(
                apiKeyService.updateKey(requireUserEmail(authentication), id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteKey(@PathVariable String id, Authentication authentication) {
        apiKeyService.deleteKey(requireUserEmail(authentication), id);
        return ResponseEntity.noContent().build();
    }

    private String requireUserEmail(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return authentication.getName();
    }
}
