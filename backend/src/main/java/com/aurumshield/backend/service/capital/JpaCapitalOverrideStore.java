package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;
import com.aurumshield.backend.capital.OverrideScope;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.capital.OverrideStatus;
import com.aurumshield.backend.entity.CapitalOverrideEntity;
import com.aurumshield.backend.repository.CapitalOverrideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaCapitalOverrideStore implements CapitalOverrideStore {

    private final CapitalOverrideRepository repository;

    @Override
    public Optional<CapitalOverride> findById(String id) {
        return repository.findById(id).map(JpaCapitalOverrideStore::toDomain);
    }

    @Override
    public boolean insertIfAbsent(CapitalOverride override) {
        if (repository.existsById(override.id())) {
            return false;
        }
        try {
            repository.saveAndFlush(toEntity(override));
            return true;
        } catch (DataIntegrityViolationException e) {
            if (!repository.existsById(override.id())) {
                throw e;
            }
            log.debug("Override {} already created by a concurrent request", override.id());
            return false;
        }
    }

    @Override
    public List<CapitalOverride> findAll() {
        return repository.findAllByOrderByCreatedAtDesc().stream().map(JpaCapitalOverrideStore::toDomain).toList();
    }

    @Override
    public List<CapitalOverride> findExpiredButActive(Instant now) {
        return repository.findByStatusAndExpiresAtLessThanEqual(OverrideStatus.ACTIVE, now).stream()
                .map(JpaCapitalOverrideStore::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public boolean compareAndSetStatus(String id, OverrideStatus expected, OverrideStatus next, Instant at, String by) {
        int updated;
        if (next == OverrideStatus.REVOKED) {
            if (expected != OverrideStatus.ACTIVE) {
                return false;
            }
            updated = repository.revokeIfActive(id, at, by);
        } else {
            updated = repository.compareAndSetStatus(id, expected, next);
        }
        return updated == 1;
    }

    static CapitalOverrideEntity toEntity(CapitalOverride override) {
        return CapitalOverrideEntity.builder()
                .id(override.id())
                .scopeType(override.scope().type())
                .actionKey(override.scope().actionKey())
                .reason(override.reason())
                .createdAt(override.createdAt())
                .expiresAt(override.expiresAt())
                .status(override.status())
                .actorRole(override.actorRole())
                .actorUserId(override.actorUserId())
                .actorName(override.actorName())
                .revokedAt(override.revokedAt())
                .revokedBy(override.revokedBy())
                .snapshotHash(override.snapshotHash())
                .modeAtCreation(override.modeAtCreation())
                .build();
    }

    static CapitalOverride toDomain(CapitalOverrideEntity entity) {
        OverrideScope scope = entity.getScopeType() == OverrideScopeType.GLOBAL
                ? OverrideScope.global()
                : OverrideScope.action(entity.getActionKey());
        return new CapitalOverride(
                entity.getId(),
                scope,
                entity.getReason(),
                entity.getCreatedAt(),
                entity.getExpiresAt(),
                entity.getStatus(),
                entity.getActorRole(),
                entity.getActorUserId(),
                entity.getActorName(),
                entity.getRevokedAt(),
                entity.getRevokedBy(),
                entity.getSnapshotHash(),
                entity.getModeAtCreation());
    }
}
