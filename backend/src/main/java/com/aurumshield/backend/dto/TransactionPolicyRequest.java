package com.aurumshield.backend.dto;

import com.aurumshield.backend.policy.Corridor;
import com.aurumshield.backend.policy.Counterparty;
import com.aurumshield.backend.policy.Hub;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionPolicyRequest {

    @NotNull
    private Counterparty counterparty;

    @NotNull
    private Corridor corridor;

    @NotNull
    private Hub hub;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal amount;
}
