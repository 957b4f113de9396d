package com.aurumshield.backend.entity;

import com.aurumshield.backend.capital.BreachEventType;
import com.aurumshield.backend.capital.BreachLevel;
import com.aurumshield.backend.capital.BreachSeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "capital_breach_events")
@Data
@EqualsAndHashCode(callSuper = false)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreachEventEntity extends AssignedIdEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private BreachEventType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private BreachSeverity level;

    @Column(nullable = false, length = 512)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "breach_level", nullable = false, length = 16)
    private BreachLevel breachLevel;

    @Column(nullable = false)
    private double ecr;

    @Column(name = "hardstop_utilization", nullable = false)
    private double hardstopUtilization;

    @Column(name = "snapshot_json", nullable = false, columnDefinition = "TEXT")
    private String snapshotJson;
}
