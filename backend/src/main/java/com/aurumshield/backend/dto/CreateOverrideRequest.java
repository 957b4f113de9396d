package com.aurumshield.backend.dto;

import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.OverrideScopeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOverrideRequest {

    @NotNull
    private OverrideScopeType scope;

    private ControlAction actionKey;

    @Size(max = 1024)
    private String reason;

    @NotNull
    private Instant expiresAt;

    @NotBlank
    @Size(max = 64)
    private String actorRole;

    @NotBlank
    @Size(max = 64)
    private String actorUserId;

    @Size(max = 128)
    private String actorName;
}
