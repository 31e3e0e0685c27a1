package org.theridian.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.theridian.exceptions.ResourceNotFoundException;
import org.theridian.exceptions.ValidationFailedException;
import org.theridian.models.dto.ApiKeyRequest;
import org.theridian.models.entity.ApiKey;
import org.theridian.models.entity.ApplicationUser;
import org.theridian.repository.ApiKeyRepository;
import org.theridian.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApiKeyService Tests")
class ApiKeyServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String EMAIL = "ada@example.com";

    @Mock
    private ApiKeyRepository apiKeyRepository;

    @Mock
    private UserRepository userRepository;

    private ApiKeyService service;
    private ApplicationUser user;

    @BeforeEach
    void setUp() {
        service = new ApiKeyService(apiKeyRepository, userRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        user = new ApplicationUser("user-1", "Ada", EMAIL, "{noop}secret");
        lenient().when(apiKeyRepository.save(any(ApiKey.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("Should issue a 43 character url-safe key")
    void testCreateKey() {
        when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));
        when(apiKeyRepository.existsByKey(anyString())).thenReturn(false);

        ApiKey key = service.createKey(EMAIL, new ApiKeyRequest("ci pipeline", null, null));

        assertEquals(43, key.getKey().length());
        assertTrue(key.getKey().matches("[A-Za-z0-9_-]+"));
        assertTrue(key.isActive());
        assertSame(user, key.getApplicationUser());
        assertEquals(NOW, key.getCreatedAt());
    }

    @Test
    @DisplayName("Should draw a new key when the first one collides")
    void testGenerateKey_Collision() {
        when(apiKeyRepository.existsByKey(anyString())).thenReturn(true, false);

        String key = service.generateKey();

        assertNotNull(key);
        verify(apiKeyRepository, times(2)).existsByKey(anyString());
    }

    @Test
    @DisplayName("Should validate the key name length")
    void testCreateKey_InvalidName() {
        when(userRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> service.createKey(EMAIL, new ApiKeyRequest("ab", true, null)));
        assertEquals("name", ex.getField());
    }

    @Test
    @DisplayName("Should hide keys of other users")
    void testGetKey_OtherUser() {
        when(apiKeyRepository.findByKeyUidAndApplicationUser_Email("key-1", "eve@example.com"))
                .thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.getKey("eve@example.com", "key-1"));
    }

    @Test
    @DisplayName("Should authenticate an active key and stamp its last use")
    void testAuthenticate_Active() {
        ApiKey key = key(true, NOW.plusSeconds(3600));
        when(apiKeyRepository.findByKey("raw-key")).thenReturn(Optional.of(key));

        Optional<ApplicationUser> owner = service.authenticate("raw-key");

        assertTrue(owner.isPresent());
        assertSame(user, owner.get());
        assertEquals(NOW, key.getLastUsedAt());
    }

    @Test
    @DisplayName("Should reject inactive and expired keys")
    void testAuthenticate_Rejected() {
        when(apiKeyRepository.findByKey("inactive")).thenReturn(Optional.of(key(false, null)));
        when(apiKeyRepository.findByKey("expired")).thenReturn(Optional.of(key(true, NOW)));
        when(apiKeyRepository.findByKey("unknown")).thenReturn(Optional.empty());

        assertTrue(service.authenticate("inactive").isEmpty());
        assertTrue(service.authenticate("expired").isEmpty());
        assertTrue(service.authenticate("unknown").isEmpty());
        assertTrue(service.authenticate("  ").isEmpty());
        verify(apiKeyRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject a valid key whose owner account is disabled")
    void testAuthenticate_DisabledOwner() {
        user.setActive(false);
        when(apiKeyRepository.findByKey("raw-key")).thenReturn(Optional.of(key(true, null)));

        assertTrue(service.authenticate("raw-key").isEmpty());
        verify(apiKeyRepository, never()).save(any());
    }

    private ApiKey key(boolean active, Instant expiresAt) {
        ApiKey key = new ApiKey();
        key.setKeyUid("key-1");
        key.setName("ci pipeline");
        key.setKey("raw-key");
        key.setApplicationUser(user);
        key.setActive(active);
        key.setExpiresAt(expiresAt);
        return key;
    }
}
