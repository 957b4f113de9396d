package com.aurumshield.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskConfigUpdateRequest {

    @NotNull
    @Positive
    private Double maxEcrRatio;

    @NotNull
    @Positive
    private Double ecrWarnRatio;

    @NotNull
    @Positive
    private Double hardstopUtilFail;

    @NotNull
    @Positive
    private Double hardstopUtilWarn;

    @NotNull
    @Min(1)
    @Max(10)
    private Integer triCriticalThreshold;

    @NotNull
    @Min(1)
    @Max(10)
    private Integer triElevatedThreshold;

    @NotNull
    @Min(1)
    @Max(10)
    private Integer triWarnThreshold;

    @NotNull
    @DecimalMin("0.0")
    private Double triConcentrationFactor;

    @NotNull
    @Positive
    private Long autoApprovalLimitCents;

    @NotNull
    @Positive
    private Long deskHeadLimitCents;

    @NotNull
    @Positive
    private Long creditCommitteeLimitCents;

    @NotBlank
    private String actorRole;

    @NotBlank
    @Size(max = 64)
    private String actorUserId;
}
