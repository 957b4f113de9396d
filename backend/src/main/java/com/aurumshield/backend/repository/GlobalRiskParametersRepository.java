package com.aurumshield.backend.repository;

import com.aurumshield.backend.model.GlobalRiskParameters;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GlobalRiskParametersRepository extends JpaRepository<GlobalRiskParameters, Long> {

    Optional<GlobalRiskParameters> findFirstByActiveTrueOrderByUpdatedAtDesc();
}
