package com.aurumshield.backend.entity;

import com.aurumshield.backend.capital.ControlMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single row holding the last control mode a sweep observed.
 */
@Entity
@Table(name = "control_mode_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlModeState {

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ControlMode mode;

    @Column(name = "snapshot_hash", length = 16)
    private String snapshotHash;

    @Column(name = "changed_at")
    private Instant changedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
