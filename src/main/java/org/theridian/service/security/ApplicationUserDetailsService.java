package org.theridian.service.security;

import lombok.RequiredArgsConstructor;
import org.theridian.models.entity.ApplicationUser;
import org.theridian.repository.UserRepository;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ApplicationUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        return userRepository.findByEmail(ApplicationUser.normalizeEmail(email))
                .orElseThrow(() -> new UsernameNotFoundException("User not found: " + email));
    }
}
