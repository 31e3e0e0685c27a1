package org.theridian.service.security;

import lombok.extern.slf4j.Slf4j;
import org.theridian.models.dto.LoginResponseDTO;
import org.theridian.models.entity.ApplicationUser;
import org.theridian.repository.UserRepository;
import org.theridian.utils.AppUtils;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;

@Slf4j
@Service
@Transactional
public class AuthenticationService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthenticationManager authenticationManager;
    private final TokenService tokenService;
    private final Clock clock;

    public AuthenticationService(UserRepository userRepository,
                                 PasswordEncoder passwordEncoder,
                                 AuthenticationManager authenticationManager,
                                 TokenService tokenService,
                                 Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.authenticationManager = authenticationManager;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    public ApplicationUser registerUser(String name, String rawEmail, String password) {
        String email = ApplicationUser.normalizeEmail(rawEmail);
        if (userRepository.findByEmail(email).isPresent()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "User with email already exists");
        }
        String encodedPassword = passwordEncoder.encode(password);

        log.info("Registering user {}", email);
        ApplicationUser user = new ApplicationUser(AppUtils.generateUUID(), name, email, encodedPassword);
        user.setCreatedAt(clock.instant());
        return userRepository.save(user);
    }

    public LoginResponseDTO loginUser(String rawEmail, String password) {
        String email = ApplicationUser.normalizeEmail(rawEmail);
        try {
            ApplicationUser user = userRepository.findByEmail(email)
                    .orElseThrow(() -> new UsernameNotFoundException(email));
            authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(email, password));
            user.setLastLoginAt(clock.instant());
            userRepository.save(user);
            String token = tokenService.generateJwt(user);
            return new LoginResponseDTO(user.getEmail(), user.getName(), token);
        } catch (AuthenticationException e) {
            log.info("Login refused for {}: {}", email, e.getClass().getSimpleName());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid email or password", e);
        }
    }
}
