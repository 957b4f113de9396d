package com.aurumshield.backend.service;

import com.aurumshield.backend.model.AuditEvent;
import com.aurumshield.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes governance audit records. Recording is idempotent on the record id, and a failure here never
 * undoes or blocks the state change being audited: the row is written in a separate transaction and
 * every error is logged and swallowed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    private final AuditEventWriter auditEventWriter;
    private final AuditEventRepository auditEventRepository;

    /**
     * @return true if a new row was written
     */
    public boolean record(AuditRecord record) {
        try {
            boolean written = auditEventWriter.insertIfAbsent(record);
            if (!written) {
                log.debug("Audit event {} already recorded", record.id());
            }
            return written;
        } catch (DataIntegrityViolationException e) {
            log.debug("Audit event {} raced with a concurrent writer", record.id());
            return false;
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} - {}", record.action(), record.id(), e.getMessage());
            return false;
        }
    }

    public List<String> eventIdsForActions(List<String> actions) {
        return auditEventRepository.findByActionInOrderByOccurredAtAsc(actions).stream()
                .map(AuditEvent::getId)
                .toList();
    }
}
