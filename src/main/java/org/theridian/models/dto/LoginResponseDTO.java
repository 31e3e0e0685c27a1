package org.theridian.models.dto;

public record LoginResponseDTO(
        String email,
        String name,
        String token
) {
}
