package com.aurumshield.backend.repository;

import com.aurumshield.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, String> {

    List<AuditEvent> findByActionInOrderByOccurredAtAsc(List<String> actions);

    List<AuditEvent> findByResourceTypeAndResourceIdOrderByOccurredAtAsc(String resourceType, String resourceId);
}
