package com.aurumshield.backend.repository;

import com.aurumshield.backend.entity.ControlModeState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ControlModeStateRepository extends JpaRepository<ControlModeState, Long> {
}
