package com.aurumshield.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "global_risk_parameters")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalRiskParameters {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "max_ecr_ratio", nullable = false)
    private double maxEcrRatio;

    @Column(name = "ecr_warn_ratio", nullable = false)
    private double ecrWarnRatio;

    @Column(name = "hardstop_util_fail", nullable = false)
    private double hardstopUtilFail;

    @Column(name = "hardstop_util_warn", nullable = false)
    private double hardstopUtilWarn;

    @Column(name = "tri_critical_threshold", nullable = false)
    private int triCriticalThreshold;

    @Column(name = "tri_elevated_threshold", nullable = false)
    private int triElevatedThreshold;

    @Column(name = "tri_warn_threshold", nullable = false)
    private int triWarnThreshold;

    @Column(name = "tri_concentration_factor", nullable = false)
    private double triConcentrationFactor;

    @Column(name = "auto_approval_limit_cents", nullable = false)
    private long autoApprovalLimitCents;

    @Column(name = "desk_head_limit_cents", nullable = false)
    private long deskHeadLimitCents;

    @Column(name = "credit_committee_limit_cents", nullable = false)
    private long creditCommitteeLimitCents;

    @Column(name = "updated_by", length = 64)
    private String updatedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
