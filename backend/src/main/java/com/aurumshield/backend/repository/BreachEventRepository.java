package com.aurumshield.backend.repository;

import com.aurumshield.backend.entity.BreachEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface BreachEventRepository extends JpaRepository<BreachEventEntity, String> {

    List<BreachEventEntity> findAllByOrderByOccurredAtDesc();

    List<BreachEventEntity> findByOccurredAtGreaterThanEqualOrderByOccurredAtDesc(Instant since);
}
