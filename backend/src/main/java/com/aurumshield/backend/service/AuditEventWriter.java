package com.aurumshield.backend.service;

import com.aurumshield.backend.config.RequestCorrelationFilter;
import com.aurumshield.backend.model.AuditEvent;
import com.aurumshield.backend.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts one audit row in its own transaction, so a failed write rolls back only itself.
 */
@Component
@RequiredArgsConstructor
class AuditEventWriter {

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    /**
     * @return false if a row with the same id already exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean insertIfAbsent(AuditRecord record) throws JsonProcessingException {
        if (auditEventRepository.existsById(record.id())) {
            return false;
        }
        String payload = record.metadata() == null || record.metadata().isEmpty()
                ? null
                : objectMapper.writeValueAsString(record.metadata());
        auditEventRepository.saveAndFlush(AuditEvent.builder()
                .id(record.id())
                .occurredAt(record.occurredAt())
                .actorRole(record.actorRole() == null ? AuditRecord.SYSTEM_ROLE : record.actorRole())
                .actorUserId(record.actorUserId())
                .action(record.action())
                .resourceType(record.resourceType())
                .resourceId(record.resourceId())
                .result(record.result() == null ? AuditRecord.RESULT_SUCCESS : record.result())
                .severity(record.severity() == null ? AuditRecord.SEVERITY_INFO : record.severity())
                .message(record.message())
                .metadata(payload)
                .correlationId(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY))
                .build());
        return true;
    }
}
