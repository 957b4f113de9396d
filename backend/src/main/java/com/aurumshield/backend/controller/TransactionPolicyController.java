package com.aurumshield.backend.controller;

import com.aurumshield.backend.dto.TransactionPolicyRequest;
import com.aurumshield.backend.policy.PolicySnapshot;
import com.aurumshield.backend.service.TransactionPolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Tag(name = "policy")
public class TransactionPolicyController {

    private final TransactionPolicyService transactionPolicyService;

    @PostMapping("/policy")
    @Operation(summary = "Transaction risk index, blockers, approval tier and compliance checks")
    public ResponseEntity<PolicySnapshot> evaluate(@Valid @RequestBody TransactionPolicyRequest request) {
        return ResponseEntity.ok(transactionPolicyService.evaluate(request, Instant.now()));
    }
}
