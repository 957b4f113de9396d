package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.entity.BreachEventEntity;
import com.aurumshield.backend.repository.BreachEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaBreachEventStore implements BreachEventStore {

    private final BreachEventRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public boolean appendIfAbsent(BreachEvent event) {
        if (repository.existsById(event.id())) {
            return false;
        }
        try {
            repository.saveAndFlush(toEntity(event));
            return true;
        } catch (DataIntegrityViolationException e) {
            if (!repository.existsById(event.id())) {
                throw e;
            }
            log.debug("Breach event {} already stored by a concurrent sweep", event.id());
            return false;
        }
    }

    @Override
    public List<BreachEvent> findAll() {
        return repository.findAllByOrderByOccurredAtDesc().stream().map(this::toEvent).toList();
    }

    @Override
    public List<BreachEvent> findSince(Instant since) {
        return repository.findByOccurredAtGreaterThanEqualOrderByOccurredAtDesc(since).stream()
                .map(this::toEvent)
                .toList();
    }

    private BreachEventEntity toEntity(BreachEvent event) {
        try {
            return BreachEventEntity.builder()
                    .id(event.id())
                    .occurredAt(event.occurredAt())
                    .type(event.type())
                    .level(event.level())
                    .message(event.message())
                    .breachLevel(event.snapshot().breachLevel())
                    .ecr(event.snapshot().ecr())
                    .hardstopUtilization(event.snapshot().hardstopUtilization())
                    .snapshotJson(objectMapper.writeValueAsString(event.snapshot()))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize snapshot for breach event " + event.id(), e);
        }
    }

    private BreachEvent toEvent(BreachEventEntity entity) {
        try {
            CapitalSnapshot snapshot = objectMapper.readValue(entity.getSnapshotJson(), CapitalSnapshot.class);
            return new BreachEvent(entity.getId(), entity.getOccurredAt(), entity.getType(), entity.getLevel(),
                    entity.getMessage(), snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored snapshot for breach event " + entity.getId() + " is unreadable", e);
        }
    }
}
