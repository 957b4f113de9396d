package com.aurumshield.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevokeOverrideRequest {

    @NotBlank
    @Size(max = 64)
    private String actorRole;

    @NotBlank
    @Size(max = 64)
    private String actorUserId;
}
