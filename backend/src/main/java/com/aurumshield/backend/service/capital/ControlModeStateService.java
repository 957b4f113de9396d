package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.ControlDecision;
import com.aurumshield.backend.capital.ControlMode;
import com.aurumshield.backend.entity.ControlModeState;
import com.aurumshield.backend.repository.ControlModeStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Remembers the last control mode a sweep saw so the next sweep can detect a change.
 */
@Service
@RequiredArgsConstructor
public class ControlModeStateService {

    private static final long SINGLETON_ID = 1L;

    private final ControlModeStateRepository repository;

    @Transactional(readOnly = true)
    public Optional<ControlMode> lastKnownMode() {
        return repository.findById(SINGLETON_ID).map(ControlModeState::getMode);
    }

    /**
     * Stores the decision's mode and returns the mode that was stored before, if any.
     */
    @Transactional
    public Optional<ControlMode> recordMode(ControlDecision decision, Instant now) {
        Optional<ControlModeState> existing = repository.findById(SINGLETON_ID);
        ControlMode previous = existing.map(ControlModeState::getMode).orElse(null);
        ControlModeState state = existing.orElseGet(() -> ControlModeState.builder().id(SINGLETON_ID).build());
        if (previous != decision.mode()) {
            state.setChangedAt(now);
        }
        state.setMode(decision.mode());
        state.setSnapshotHash(decision.snapshotHash());
        state.setUpdatedAt(now);
        repository.save(state);
        return Optional.ofNullable(previous);
    }
}
