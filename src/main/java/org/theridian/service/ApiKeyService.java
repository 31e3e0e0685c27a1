package org.theridian.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.ApiKeyDTO;
import org.theridian.models.dto.ApiKeyRequest;
import org.theridian.models.dto.UserDTO;
import org.theridian.models.entity.ApiKey;
import org.theridian.models.entity.ApplicationUser;
import org.theridian.repository.ApiKeyRepository;
import org.theridian.repository.UserRepository;
import org.theridian.utils.AppUtils;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * API keys are always scoped to the calling user: another user's key behaves as if it did not
 * exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private static final int KEY_BYTES = 32;
    private static final int MIN_NAME_LENGTH = 3;
    private static final int MAX_NAME_LENGTH = 100;

    private final ApiKeyRepository apiKeyRepository;
    private final UserRepository userRepository;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Transactional(readOnly = true)
    public List<ApiKey> listKeys(String email, String search, Sort sort) {
        if (StringUtils.hasText(search)) {
            return apiKeyRepository.findAllByApplicationUser_EmailAndNameContainingIgnoreCase(email, search.trim(), sort);
        }
        return apiKeyRepository.findAllByApplicationUser_Email(email, sort);
    }

    @Transactional(readOnly = true)
    public ApiKey getKey(String email, String uid) {
        return apiKeyRepository.findByKeyUidAndApplicationUser_Email(uid, email)
                .orElseThrow(() -> new ResourceNotFoundException("API key", uid));
    }

    @Transactional
    public ApiKey createKey(String email, ApiKeyRequest request) {
        ApplicationUser user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required"));

        Instant now = clock.instant();
        ApiKey apiKey = new ApiKey();
        apiKey.setKeyUid(AppUtils.generateUUID());
        apiKey.setName(validateName(request.name()));
        apiKey.setKey(generateKey());
        apiKey.setApplicationUser(user);
        apiKey.setActive(request.active() == null || request.active());
        apiKey.setExpiresAt(request.expiresAt());
        apiKey.setCreatedAt(now);
        apiKey.setUpdatedAt(now);

        log.info("Issued API key {} for {}", apiKey.getName(), email);
        return apiKeyRepository.save(apiKey);
    }

    @Transactional
    public ApiKey replaceKey(String email, String uid, ApiKeyRequest request) {
        ApiKey apiKey = getKey(email, uid);
        apiKey.setName(validateName(request.name()));
        apiKey.setActive(request.active() == null || request.active());
        apiKey.setExpiresAt(request.expiresAt());
        apiKey.setUpdatedAt(clock.instant());
        return apiKeyRepository.save(apiKey);
    }

    @Transactional
    public ApiKey updateKey(String email, String uid, ApiKeyRequest request) {
        ApiKey apiKey = getKey(email, uid);
        if (request.name() != null) {
            apiKey.setName(validateName(request.name()));
        }
        if (request.active() != null) {
            apiKey.setActive(request.active());
        }
        if (request.expiresAt() != null) {
            apiKey.setExpiresAt(request.expiresAt());
        }
        apiKey.setUpdatedAt(clock.instant());
        return apiKeyRepository.save(apiKey);
    }

    @Transactional
    public void deleteKey(String email, String uid) {
        ApiKey apiKey = getKey(email, uid);
        log.info("Revoking API key {} for {}", apiKey.getName(), email);
        apiKeyRepository.delete(apiKey);
    }

    /**
     * Resolves the owner of a presented key. Inactive and expired keys are rejected; a successful
     * lookup stamps {@code lastUsedAt}.
     */
    @Transactional
    public Optional<ApplicationUser> authenticate(String rawKey) {
        if (!StringUtils.hasText(rawKey)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return apiKeyRepository.findByKey(rawKey.trim())
                .filter(ApiKey::isActive)
                .filter(apiKey -> !apiKey.isExpired(now))
                .filter(apiKey -> apiKey.getApplicationUser().isEnabled())
                .map(apiKey -> {
                    apiKey.setLastUsedAt(now);
                    apiKeyRepository.save(apiKey);
                    return apiKey.getApplicationUser();
                });
    }

    public static ApiKeyDTO toDto(ApiKey apiKey) {
        ApplicationUser user = apiKey.getApplicationUser();
        return new ApiKeyDTO(
                apiKey.getKeyUid(),
                apiKey.getName(),
                apiKey.getKey(),
                new UserDTO(user.getUserUid(), user.getName(), user.getEmail(), user.getCreatedAt()),
                apiKey.isActive(),
                apiKey.getExpiresAt(),
                apiKey.getLastUsedAt(),
                apiKey.getCreatedAt(),
                apiKey.getUpdatedAt()
        );
    }

    String generateKey() {
        String key;
        do {
            byte[] bytes = new byte[KEY_BYTES];
            secureRandom.nextBytes(bytes);
            key = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        } while (apiKeyRepository.existsByKey(key));
        return key;
    }

    private String validateName(String rawName) {
        if (!StringUtils.hasText(rawName)) {
            throw new ValidationFailedException("name", "API key name is required");
        }
        String name = rawName.trim();
        if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            throw new ValidationFailedException("name", "API key name must be between 3 and 100 characters");
        }
        return name;
    }
}
