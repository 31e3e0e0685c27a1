package org.theridian.controllers;

import org.theridian.models.dto.LoginRequestDTO;
import org.theridian.models.dto.LoginResponseDTO;
import org.theridian.models.dto.RegistrationDTO;
import org.theridian.models.dto.UserDTO;
import org.theridian.models.entity.ApplicationUser;
import org.theridian.service.security.AuthenticationService;
import org.springframework.web.bind.annotation.*;


@RestController
@RequestMapping("/auth")
@CrossOrigin("*")
public class AuthenticationController {

    private final AuthenticationService authenticationService;

    public AuthenticationController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @PostMapping("/register")
    public UserDTO registerUser(@RequestBody RegistrationDTO body) {
        ApplicationUser user = authenticationService.registerUser(body.name(), body.email(), body.password());
        return new UserDTO(user.getUserUid(), user.getName(), user.getEmail(), user.getCreatedAt());
    }

    @PostMapping("/login")
    public LoginResponseDTO loginUser(@RequestBody LoginRequestDTO body) {
        return authenticationService.loginUser(body.email(), body.password());
    }
}
